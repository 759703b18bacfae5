package com.lifelink.backend.global.security;

import java.util.Optional;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    /**
     * Id of the authenticated user. Donor and hospital profiles share this id.
     */
    public static UUID getCurrentUserId() {
        return findCurrentPrincipal()
                .map(JwtAuthenticationPrincipal::userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED"));
    }
}
