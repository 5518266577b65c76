package com.ehrportal.repository;

import com.ehrportal.entity.User;

import jakarta.transaction.Transactional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRepository extends JpaRepository<User, UUID> {
    Optional<User> findByEmail(String email);
    Boolean existsByEmail(String email);

    @Modifying
    @Transactional
    @Query("""
        update User u
        set u.lastLogin = :lastLogin
        where u.id = :id
    """)
    int updateLastLoginById(
        @Param("id") UUID id,
        @Param("lastLogin") LocalDateTime lastLogin
    );
}
