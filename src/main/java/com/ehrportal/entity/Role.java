package com.ehrportal.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    PATIENT("patient"),
    DOCTOR("doctor"),
    ADMIN("admin");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isStaff() {
        return this == DOCTOR || this == ADMIN;
    }

    @JsonCreator
    public static Role fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Role role : values()) {
                if (role.value.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Role must be one of patient, doctor, admin");
    }
}
