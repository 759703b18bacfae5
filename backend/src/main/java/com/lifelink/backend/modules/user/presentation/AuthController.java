package com.lifelink.backend.modules.user.presentation;

import com.lifelink.backend.modules.user.application.AuthService;
import com.lifelink.backend.modules.user.presentation.dto.LoginRequest;
import com.lifelink.backend.modules.user.presentation.dto.LoginResponse;
import com.lifelink.backend.modules.user.presentation.dto.RegisterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(summary = "Register a donor or hospital account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created, access token issued"),
            @ApiResponse(responseCode = "400", description = "Weak password or missing role details"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping("/auth/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }
}
