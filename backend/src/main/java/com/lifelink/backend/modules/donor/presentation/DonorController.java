package com.lifelink.backend.modules.donor.presentation;

import java.util.List;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.global.security.SecurityUtils;
import com.lifelink.backend.global.web.PageRequests;
import com.lifelink.backend.global.web.PageResponse;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.presentation.dto.DonationResponse;
import com.lifelink.backend.modules.donor.application.DonorService;
import com.lifelink.backend.modules.donor.presentation.dto.DonorProfileResponse;
import com.lifelink.backend.modules.donor.presentation.dto.DonorStatsResponse;
import com.lifelink.backend.modules.donor.presentation.dto.RequestMatchResponse;
import com.lifelink.backend.modules.donor.presentation.dto.RespondToRequestRequest;
import com.lifelink.backend.modules.donor.presentation.dto.UpdateAvailabilityRequest;
import com.lifelink.backend.modules.donor.presentation.dto.UpdateDonorProfileRequest;
import com.lifelink.backend.modules.matching.application.MatchingService;
import com.lifelink.backend.modules.matching.application.MatchingService.MatchAnalysis;
import com.lifelink.backend.modules.request.application.DonationRequestService;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.request.presentation.dto.RequestResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/donor")
public class DonorController {

    private final DonorService donorService;
    private final DonationService donationService;
    private final DonationRequestService requestService;
    private final MatchingService matchingService;

    public DonorController(
            DonorService donorService,
            DonationService donationService,
            DonationRequestService requestService,
            MatchingService matchingService
    ) {
        this.donorService = donorService;
        this.donationService = donationService;
        this.requestService = requestService;
        this.matchingService = matchingService;
    }

    @GetMapping("/profile")
    public ResponseEntity<DonorProfileResponse> getProfile() {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonorProfileResponse.from(donorService.getProfile(donorId)));
    }

    @PutMapping("/profile")
    public ResponseEntity<DonorProfileResponse> updateProfile(@Valid @RequestBody UpdateDonorProfileRequest request) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonorProfileResponse.from(donorService.updateProfile(donorId, request.toCommand())));
    }

    @PutMapping("/availability")
    public ResponseEntity<DonorProfileResponse> updateAvailability(@Valid @RequestBody UpdateAvailabilityRequest request) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonorProfileResponse.from(donorService.updateAvailability(donorId, request.available())));
    }

    @GetMapping("/requests")
    public ResponseEntity<PageResponse<RequestResponse>> getOpenRequests(
            @RequestParam(name = "kind", required = false) String kind,
            @RequestParam(name = "urgency", required = false) String urgency,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        RequestKind kindFilter = kind == null ? null : RequestKind.fromCode(kind)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_KIND", "Unknown kind: " + kind));
        Urgency urgencyFilter = urgency == null ? null : Urgency.fromCode(urgency)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_URGENCY", "Unknown urgency: " + urgency));

        return ResponseEntity.ok(PageResponse.of(
                requestService.getOpenRequests(kindFilter, urgencyFilter, PageRequests.of(page, size)),
                RequestResponse::from
        ));
    }

    @Operation(summary = "Requests ranked for the current donor")
    @GetMapping("/matches")
    public ResponseEntity<PageResponse<RequestMatchResponse>> getMatches(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        List<RequestMatchResponse> ranked = matchingService.findCandidateRequests(donorId).stream()
                .map(RequestMatchResponse::from)
                .toList();
        return ResponseEntity.ok(PageResponse.slice(ranked, PageRequests.safePage(page), PageRequests.safeSize(size)));
    }

    @GetMapping("/requests/{requestId}/analysis")
    public ResponseEntity<MatchAnalysis> analyzeRequest(@PathVariable("requestId") UUID requestId) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(matchingService.analyze(donorId, requestId));
    }

    @Operation(
            summary = "Respond to a request",
            description = "Creates a pending donation after re-checking eligibility. "
                    + "A donor may hold only one non-cancelled donation per request."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Donation created in pending state"),
            @ApiResponse(responseCode = "404", description = "Request not found"),
            @ApiResponse(responseCode = "409", description = "DONATION_ALREADY_ACTIVE"),
            @ApiResponse(responseCode = "422", description = "DONOR_INELIGIBLE with the eligibility reason as detail")
    })
    @PostMapping("/requests/{requestId}/respond")
    public ResponseEntity<DonationResponse> respondToRequest(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody(required = false) RespondToRequestRequest request
    ) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        Integer quantity = request != null ? request.quantity() : null;
        String notes = request != null ? request.notes() : null;
        Donation donation = donationService.createDonation(donorId, requestId, quantity, notes);
        return ResponseEntity.status(HttpStatus.CREATED).body(DonationResponse.from(donation));
    }

    @GetMapping("/donations")
    public ResponseEntity<PageResponse<DonationResponse>> getDonationHistory(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        DonationStatus statusFilter = status == null ? null : DonationStatus.fromCode(status)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_STATUS", "Unknown donation status: " + status));
        return ResponseEntity.ok(PageResponse.of(
                donationService.getDonationHistory(donorId, statusFilter, PageRequests.of(page, size)),
                DonationResponse::from
        ));
    }

    @PostMapping("/donations/{donationId}/cancel")
    public ResponseEntity<DonationResponse> cancelDonation(@PathVariable("donationId") UUID donationId) {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonationResponse.from(donationService.cancelForDonor(donorId, donationId)));
    }

    @GetMapping("/stats")
    public ResponseEntity<DonorStatsResponse> getStats() {
        UUID donorId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonorStatsResponse.from(donationService.getDonorStats(donorId)));
    }
}
