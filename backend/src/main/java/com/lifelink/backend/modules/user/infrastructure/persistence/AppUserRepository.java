package com.lifelink.backend.modules.user.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import com.lifelink.backend.modules.user.domain.AppUser;
import com.lifelink.backend.modules.user.domain.UserRole;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCase(String email);

    long countByRole(UserRole role);

    Page<AppUser> findByRole(UserRole role, Pageable pageable);
}
