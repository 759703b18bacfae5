package com.lifelink.backend.modules.admin.presentation;

import java.util.Locale;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.global.security.SecurityUtils;
import com.lifelink.backend.global.web.PageRequests;
import com.lifelink.backend.global.web.PageResponse;
import com.lifelink.backend.modules.admin.application.AdminService;
import com.lifelink.backend.modules.admin.presentation.dto.AdminDashboardResponse;
import com.lifelink.backend.modules.admin.presentation.dto.UpdateUserStatusRequest;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.donation.presentation.dto.DonationResponse;
import com.lifelink.backend.modules.donation.presentation.dto.UpdateDonationStatusRequest;
import com.lifelink.backend.modules.user.domain.UserRole;
import com.lifelink.backend.modules.user.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminController {

    private final AdminService adminService;
    private final DonationService donationService;

    public AdminController(AdminService adminService, DonationService donationService) {
        this.adminService = adminService;
        this.donationService = donationService;
    }

    @GetMapping("/dashboard")
    public ResponseEntity<AdminDashboardResponse> getDashboard() {
        return ResponseEntity.ok(AdminDashboardResponse.from(adminService.getDashboard()));
    }

    @GetMapping("/users")
    public ResponseEntity<PageResponse<UserProfileResponse>> getUsers(
            @RequestParam(name = "role", required = false) String role,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UserRole roleFilter = parseRole(role);
        return ResponseEntity.ok(PageResponse.of(
                adminService.getUsers(roleFilter, PageRequests.of(page, size)),
                UserProfileResponse::from
        ));
    }

    @PatchMapping("/users/{userId}/status")
    public ResponseEntity<UserProfileResponse> updateUserStatus(
            @PathVariable("userId") UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request
    ) {
        UUID actorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(UserProfileResponse.from(adminService.updateUserStatus(actorId, userId, request.status())));
    }

    @Operation(summary = "Override a donation status regardless of owning hospital")
    @PatchMapping("/donations/{donationId}/status")
    public ResponseEntity<DonationResponse> updateDonationStatus(
            @PathVariable("donationId") UUID donationId,
            @Valid @RequestBody UpdateDonationStatusRequest request
    ) {
        return ResponseEntity.ok(DonationResponse.from(donationService.updateStatus(donationId, request.toCommand())));
    }

    private UserRole parseRole(String role) {
        if (role == null) {
            return null;
        }
        try {
            return UserRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw ProblemException.badRequest("INVALID_ROLE", "Unknown role: " + role);
        }
    }
}
