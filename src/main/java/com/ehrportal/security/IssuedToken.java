package com.ehrportal.security;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@AllArgsConstructor
public class IssuedToken {
    private String value;
    private UUID subjectId;
    private Instant issuedAt;
    private Instant expiresAt;
}
