package com.ehrportal.service;

import com.ehrportal.entity.Role;
import com.ehrportal.entity.User;
import com.ehrportal.exception.DuplicateIdentityException;
import com.ehrportal.repository.UserRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Sole owner of identity records. Emails are compared case-insensitively by
 * storing them trimmed and lower-cased; the unique index on {@code users.email}
 * settles concurrent registrations of the same address.
 */
@Service
public class CredentialStore {

    private final UserRepository userRepository;

    public CredentialStore(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Optional<User> findByEmail(String email) {
        return userRepository.findByEmail(normalizeEmail(email));
    }

    public Optional<User> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return userRepository.findById(id);
    }

    public List<User> findAll() {
        return userRepository.findAll();
    }

    /**
     * @throws DuplicateIdentityException if the email is already registered,
     *                                    including when a concurrent insert wins the race
     */
    public User create(String email, String passwordHash, String fullName, Role role) {
        String normalized = normalizeEmail(email);
        if (userRepository.existsByEmail(normalized)) {
            throw new DuplicateIdentityException();
        }

        User user = new User();
        user.setEmail(normalized);
        user.setPasswordHash(passwordHash);
        user.setFullName(fullName);
        user.setRole(role);

        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            // only the email index means a lost race; anything else is a store failure
            if (userRepository.existsByEmail(normalized)) {
                throw new DuplicateIdentityException(e);
            }
            throw e;
        }
    }

    public void recordLogin(UUID id, LocalDateTime at) {
        userRepository.updateLastLoginById(id, at);
    }

    public static String normalizeEmail(String email) {
        if (email == null) {
            return "";
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
