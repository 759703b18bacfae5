package com.lifelink.backend.modules.admin.application;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;
import com.lifelink.backend.modules.user.domain.AppUser;
import com.lifelink.backend.modules.user.domain.UserRole;
import com.lifelink.backend.modules.user.domain.UserStatus;
import com.lifelink.backend.modules.user.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AdminService {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    private final AppUserRepository appUserRepository;
    private final DonationRequestRepository requestRepository;
    private final DonationRepository donationRepository;

    public AdminService(
            AppUserRepository appUserRepository,
            DonationRequestRepository requestRepository,
            DonationRepository donationRepository
    ) {
        this.appUserRepository = appUserRepository;
        this.requestRepository = requestRepository;
        this.donationRepository = donationRepository;
    }

    @Transactional(readOnly = true)
    public DashboardSummary getDashboard() {
        Map<UserRole, Long> usersByRole = new EnumMap<>(UserRole.class);
        for (UserRole role : UserRole.values()) {
            usersByRole.put(role, appUserRepository.countByRole(role));
        }
        Map<RequestStatus, Long> requestsByStatus = new EnumMap<>(RequestStatus.class);
        for (RequestStatus status : RequestStatus.values()) {
            requestsByStatus.put(status, requestRepository.countByStatus(status));
        }
        Map<DonationStatus, Long> donationsByStatus = new EnumMap<>(DonationStatus.class);
        for (DonationStatus status : DonationStatus.values()) {
            donationsByStatus.put(status, donationRepository.countByStatus(status));
        }
        return new DashboardSummary(usersByRole, requestsByStatus, donationsByStatus);
    }

    @Transactional(readOnly = true)
    public Page<AppUser> getUsers(UserRole role, Pageable pageable) {
        Pageable sorted = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(), Sort.by(Sort.Direction.DESC, "createdAt"));
        if (role == null) {
            return appUserRepository.findAll(sorted);
        }
        return appUserRepository.findByRole(role, sorted);
    }

    public AppUser updateUserStatus(UUID actorId, UUID userId, String status) {
        UserStatus target = parseUserStatus(status);
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        if (user.getId().equals(actorId) && target != UserStatus.ACTIVE) {
            throw ProblemException.badRequest("CANNOT_SUSPEND_SELF", "Admins cannot suspend their own account");
        }
        user.setStatus(target);
        log.info("User status changed userId={} status={} by={}", userId, target, actorId);
        return user;
    }

    private static UserStatus parseUserStatus(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "ACTIVE" -> UserStatus.ACTIVE;
            case "SUSPENDED" -> UserStatus.SUSPENDED;
            default -> throw ProblemException.badRequest("INVALID_STATUS", "User status must be active or suspended");
        };
    }

    public record DashboardSummary(
            Map<UserRole, Long> usersByRole,
            Map<RequestStatus, Long> requestsByStatus,
            Map<DonationStatus, Long> donationsByStatus
    ) {
    }
}
