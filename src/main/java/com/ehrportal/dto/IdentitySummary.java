package com.ehrportal.dto;

import com.ehrportal.entity.Role;
import com.ehrportal.entity.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Public view of an identity. Never carries the password hash.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdentitySummary {
    private UUID id;
    private String email;
    private String fullName;
    private Role role;
    private LocalDateTime createdAt;

    public static IdentitySummary from(User user) {
        return new IdentitySummary(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getRole(),
                user.getCreatedAt()
        );
    }
}
