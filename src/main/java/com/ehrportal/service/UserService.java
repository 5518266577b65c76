package com.ehrportal.service;

import com.ehrportal.dto.IdentitySummary;
import com.ehrportal.security.Action;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.UserPrincipal;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class UserService {

    private final CredentialStore credentialStore;
    private final AuthorizationGuard authorizationGuard;

    public UserService(CredentialStore credentialStore, AuthorizationGuard authorizationGuard) {
        this.credentialStore = credentialStore;
        this.authorizationGuard = authorizationGuard;
    }

    public List<IdentitySummary> listUsers(UserPrincipal caller) {
        authorizationGuard.authorize(caller, Action.LIST_USERS);
        return credentialStore.findAll().stream()
                .map(IdentitySummary::from)
                .toList();
    }
}
