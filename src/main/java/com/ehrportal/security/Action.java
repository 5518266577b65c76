package com.ehrportal.security;

import com.ehrportal.entity.Role;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Protected operations and the roles allowed to attempt them. Ownership of
 * the targeted profile or record is checked separately by {@link AuthorizationGuard}.
 */
public enum Action {
    VIEW_CURRENT_IDENTITY(Role.PATIENT, Role.DOCTOR, Role.ADMIN),
    CREATE_OWN_PROFILE(Role.PATIENT),
    VIEW_OWN_PROFILE(Role.PATIENT),
    UPDATE_OWN_PROFILE(Role.PATIENT),
    VIEW_PATIENT(Role.PATIENT, Role.DOCTOR, Role.ADMIN),
    LIST_PATIENTS(Role.DOCTOR, Role.ADMIN),
    CREATE_MEDICAL_RECORD(Role.DOCTOR, Role.ADMIN),
    LIST_MEDICAL_RECORDS(Role.PATIENT, Role.DOCTOR, Role.ADMIN),
    VIEW_MEDICAL_RECORD(Role.PATIENT, Role.DOCTOR, Role.ADMIN),
    LIST_USERS(Role.DOCTOR, Role.ADMIN);

    private final Set<Role> requiredRoles;

    Action(Role first, Role... rest) {
        this.requiredRoles = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }

    public Set<Role> getRequiredRoles() {
        return requiredRoles;
    }

    public boolean permits(Role role) {
        return role != null && requiredRoles.contains(role);
    }
}
