package com.ehrportal.security;

import com.ehrportal.service.CredentialStore;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

/**
 * Email based lookup for password authentication.
 */
@Service
public class UserPrincipalService implements UserDetailsService {

    private final CredentialStore credentialStore;

    public UserPrincipalService(CredentialStore credentialStore) {
        this.credentialStore = credentialStore;
    }

    @Override
    public UserDetails loadUserByUsername(String email) throws UsernameNotFoundException {
        return credentialStore.findByEmail(email)
                .map(UserPrincipal::from)
                .orElseThrow(() -> new UsernameNotFoundException("Unknown email"));
    }
}
