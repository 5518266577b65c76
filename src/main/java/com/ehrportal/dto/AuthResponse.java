package com.ehrportal.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthResponse {
    private String token;
    private String tokenType = "Bearer";
    private Instant expiresAt;
    private IdentitySummary user;

    public AuthResponse(String token, Instant expiresAt, IdentitySummary user) {
        this.token = token;
        this.expiresAt = expiresAt;
        this.user = user;
    }
}
