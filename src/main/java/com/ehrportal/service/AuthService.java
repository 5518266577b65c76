package com.ehrportal.service;

import com.ehrportal.dto.AuthResponse;
import com.ehrportal.dto.IdentitySummary;
import com.ehrportal.dto.LoginRequest;
import com.ehrportal.dto.RegisterRequest;
import com.ehrportal.entity.Role;
import com.ehrportal.entity.User;
import com.ehrportal.exception.DuplicateIdentityException;
import com.ehrportal.exception.InvalidCredentialsException;
import com.ehrportal.exception.UnauthenticatedException;
import com.ehrportal.security.Action;
import com.ehrportal.security.AuthorizationGuard;
import com.ehrportal.security.IssuedToken;
import com.ehrportal.security.TokenService;
import com.ehrportal.security.UserPrincipal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

@Slf4j
@Service
public class AuthService {

    private final CredentialStore credentialStore;
    private final PasswordEncoder passwordEncoder;
    private final AuthenticationManager authenticationManager;
    private final TokenService tokenService;
    private final AuthorizationGuard authorizationGuard;
    private final Executor bcryptExecutor;
    private final Clock clock;

    public AuthService(CredentialStore credentialStore,
                       PasswordEncoder passwordEncoder,
                       AuthenticationManager authenticationManager,
                       TokenService tokenService,
                       AuthorizationGuard authorizationGuard,
                       @Qualifier("bcryptExecutor") Executor bcryptExecutor,
                       Clock clock) {
        this.credentialStore = credentialStore;
        this.passwordEncoder = passwordEncoder;
        this.authenticationManager = authenticationManager;
        this.tokenService = tokenService;
        this.authorizationGuard = authorizationGuard;
        this.bcryptExecutor = bcryptExecutor;
        this.clock = clock;
    }

    /**
     * Creates a new identity and signs it in.
     *
     * @throws IllegalArgumentException if the role is not patient, doctor or admin
     * @throws DuplicateIdentityException if the email is taken
     */
    public AuthResponse register(RegisterRequest request) {
        Role role = Role.fromValue(request.getRole());

        if (credentialStore.findByEmail(request.getEmail()).isPresent()) {
            throw new DuplicateIdentityException();
        }

        String passwordHash = onBcryptExecutor(() -> passwordEncoder.encode(request.getPassword()));
        User user = credentialStore.create(request.getEmail(), passwordHash, request.getFullName().trim(), role);

        log.info("Registered identity {} with role {}", user.getId(), role.getValue());
        return issueFor(user);
    }

    /**
     * Unknown email and wrong password fail identically.
     */
    public AuthResponse login(LoginRequest request) {
        String email = CredentialStore.normalizeEmail(request.getEmail());
        Authentication authentication;
        try {
            authentication = onBcryptExecutor(() -> authenticationManager.authenticate(
                    new UsernamePasswordAuthenticationToken(email, request.getPassword())));
        } catch (BadCredentialsException | UsernameNotFoundException e) {
            log.warn("Rejected login attempt");
            throw new InvalidCredentialsException();
        }

        UserPrincipal principal = (UserPrincipal) authentication.getPrincipal();
        User user = credentialStore.findById(principal.getId())
                .orElseThrow(InvalidCredentialsException::new);

        credentialStore.recordLogin(user.getId(), LocalDateTime.now(clock));
        log.info("Identity {} logged in", user.getId());
        return issueFor(user);
    }

    public IdentitySummary currentIdentity(UserPrincipal caller) {
        authorizationGuard.authorize(caller, Action.VIEW_CURRENT_IDENTITY);
        return credentialStore.findById(caller.getId())
                .map(IdentitySummary::from)
                .orElseThrow(() -> new UnauthenticatedException("Authentication required"));
    }

    private AuthResponse issueFor(User user) {
        IssuedToken token = tokenService.issue(user);
        return new AuthResponse(token.getValue(), token.getExpiresAt(), IdentitySummary.from(user));
    }

    private <T> T onBcryptExecutor(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, bcryptExecutor).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
