package com.lifelink.backend.modules.hospital.presentation;

import java.util.List;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.global.security.SecurityUtils;
import com.lifelink.backend.global.web.PageRequests;
import com.lifelink.backend.global.web.PageResponse;
import com.lifelink.backend.modules.donation.application.DonationService;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.presentation.dto.DonationResponse;
import com.lifelink.backend.modules.donation.presentation.dto.UpdateDonationStatusRequest;
import com.lifelink.backend.modules.hospital.application.HospitalService;
import com.lifelink.backend.modules.hospital.presentation.dto.DonorCandidateResponse;
import com.lifelink.backend.modules.hospital.presentation.dto.HospitalProfileResponse;
import com.lifelink.backend.modules.hospital.presentation.dto.RequestDetailResponse;
import com.lifelink.backend.modules.hospital.presentation.dto.RequestDetailResponse.RespondingDonation;
import com.lifelink.backend.modules.hospital.presentation.dto.UpdateHospitalProfileRequest;
import com.lifelink.backend.modules.matching.application.MatchingService;
import com.lifelink.backend.modules.request.application.DonationRequestService;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.presentation.dto.CreateRequestRequest;
import com.lifelink.backend.modules.request.presentation.dto.RequestResponse;
import com.lifelink.backend.modules.request.presentation.dto.UpdateRequestStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/hospital")
public class HospitalController {

    private final HospitalService hospitalService;
    private final DonationRequestService requestService;
    private final DonationService donationService;
    private final MatchingService matchingService;

    public HospitalController(
            HospitalService hospitalService,
            DonationRequestService requestService,
            DonationService donationService,
            MatchingService matchingService
    ) {
        this.hospitalService = hospitalService;
        this.requestService = requestService;
        this.donationService = donationService;
        this.matchingService = matchingService;
    }

    @GetMapping("/profile")
    public ResponseEntity<HospitalProfileResponse> getProfile() {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(HospitalProfileResponse.from(hospitalService.getProfile(hospitalId)));
    }

    @PutMapping("/profile")
    public ResponseEntity<HospitalProfileResponse> updateProfile(@Valid @RequestBody UpdateHospitalProfileRequest request) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(HospitalProfileResponse.from(hospitalService.updateProfile(hospitalId, request.toCommand())));
    }

    @Operation(
            summary = "Create a donation request",
            description = """
                    Blood requests need `bloodType` and no `organType`; organ requests the reverse. \
                    `requiredBy` must be in the future. Matching donors are notified once the request is stored.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Request created"),
            @ApiResponse(responseCode = "400", description = "Sub-type, quantity or deadline validation failed")
    })
    @PostMapping("/requests")
    public ResponseEntity<RequestResponse> createRequest(@Valid @RequestBody CreateRequestRequest request) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        DonationRequest created = requestService.createRequest(hospitalId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(RequestResponse.from(created));
    }

    @GetMapping("/requests")
    public ResponseEntity<PageResponse<RequestResponse>> getRequests(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "kind", required = false) String kind,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        RequestStatus statusFilter = status == null ? null : RequestStatus.fromCode(status)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_STATUS", "Unknown request status: " + status));
        RequestKind kindFilter = kind == null ? null : RequestKind.fromCode(kind)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_KIND", "Unknown kind: " + kind));
        return ResponseEntity.ok(PageResponse.of(
                requestService.getHospitalRequests(hospitalId, statusFilter, kindFilter, PageRequests.of(page, size)),
                RequestResponse::from
        ));
    }

    @GetMapping("/requests/{requestId}")
    public ResponseEntity<RequestDetailResponse> getRequest(@PathVariable("requestId") UUID requestId) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        DonationRequest request = requestService.getOwnedRequest(hospitalId, requestId);
        List<RespondingDonation> donations = donationService.getDonationsForRequest(requestId).stream()
                .map(RespondingDonation::from)
                .toList();
        return ResponseEntity.ok(new RequestDetailResponse(RequestResponse.from(request), donations));
    }

    @Operation(summary = "Change request status; cancelling also cancels its open donations")
    @PatchMapping("/requests/{requestId}")
    public ResponseEntity<RequestResponse> updateRequestStatus(
            @PathVariable("requestId") UUID requestId,
            @Valid @RequestBody UpdateRequestStatusRequest request
    ) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RequestResponse.from(requestService.updateStatus(hospitalId, requestId, request.status())));
    }

    @DeleteMapping("/requests/{requestId}")
    public ResponseEntity<RequestResponse> cancelRequest(@PathVariable("requestId") UUID requestId) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(RequestResponse.from(requestService.cancelRequest(hospitalId, requestId)));
    }

    @Operation(summary = "Eligible donors for a request, best score first")
    @GetMapping("/requests/{requestId}/candidates")
    public ResponseEntity<List<DonorCandidateResponse>> getCandidates(@PathVariable("requestId") UUID requestId) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        List<DonorCandidateResponse> candidates = matchingService.findCandidateDonorsForHospital(hospitalId, requestId).stream()
                .map(DonorCandidateResponse::from)
                .toList();
        return ResponseEntity.ok(candidates);
    }

    @GetMapping("/donations")
    public ResponseEntity<PageResponse<DonationResponse>> getDonations(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        DonationStatus statusFilter = status == null ? null : DonationStatus.fromCode(status)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_STATUS", "Unknown donation status: " + status));
        return ResponseEntity.ok(PageResponse.of(
                donationService.getDonationsForHospital(hospitalId, statusFilter, PageRequests.of(page, size)),
                DonationResponse::from
        ));
    }

    @Operation(summary = "Move a donation to a new status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Status changed"),
            @ApiResponse(responseCode = "400", description = "Unknown status or date outside its allowed range"),
            @ApiResponse(responseCode = "403", description = "Donation belongs to another hospital"),
            @ApiResponse(responseCode = "409", description = "Donation already completed or cancelled")
    })
    @PatchMapping("/donations/{donationId}/status")
    public ResponseEntity<DonationResponse> updateDonationStatus(
            @PathVariable("donationId") UUID donationId,
            @Valid @RequestBody UpdateDonationStatusRequest request
    ) {
        UUID hospitalId = SecurityUtils.getCurrentUserId();
        return ResponseEntity.ok(DonationResponse.from(
                donationService.updateStatusForHospital(hospitalId, donationId, request.toCommand())
        ));
    }
}
