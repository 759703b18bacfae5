package com.lifelink.backend.global.security;

import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, String email, String role) {
}
