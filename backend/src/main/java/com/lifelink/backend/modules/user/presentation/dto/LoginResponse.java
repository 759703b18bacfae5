package com.lifelink.backend.modules.user.presentation.dto;

public record LoginResponse(
        AccessTokenResponse tokens,
        UserProfileResponse user
) {
}
