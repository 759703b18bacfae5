package com.lifelink.backend.modules.user.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.lifelink.backend.modules.user.domain.AppUser;
import com.lifelink.backend.modules.user.domain.UserRole;
import com.lifelink.backend.modules.user.domain.UserStatus;

public record UserProfileResponse(
        UUID id,
        String email,
        String fullName,
        UserRole role,
        UserStatus status,
        OffsetDateTime lastLoginAt,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getFullName(),
                user.getRole(),
                user.getStatus(),
                user.getLastLoginAt(),
                user.getCreatedAt()
        );
    }
}
