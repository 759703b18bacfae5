package com.lifelink.backend.modules.user.presentation;

import java.util.UUID;

import com.lifelink.backend.global.security.SecurityUtils;
import com.lifelink.backend.modules.user.application.AuthService;
import com.lifelink.backend.modules.user.presentation.dto.UserProfileResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> getMyProfile() {
        UUID userId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(authService.loadProfile(userId));
    }
}
