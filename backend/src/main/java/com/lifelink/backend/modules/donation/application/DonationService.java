package com.lifelink.backend.modules.donation.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.domain.Donation;
import com.lifelink.backend.modules.donation.domain.DonationStatus;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.matching.application.EligibilityEvaluator;
import com.lifelink.backend.modules.matching.domain.EligibilityResult;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.infrastructure.persistence.DonorRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns donation creation and status transitions.
 *
 * <p>At most one non-cancelled donation may exist per (donor, request). The existence check
 * gives a friendly error in the common case; the partial unique index
 * {@value #ACTIVE_DONATION_CONSTRAINT} settles concurrent inserts.
 */
@Service
@Transactional
public class DonationService {

    private static final Logger log = LoggerFactory.getLogger(DonationService.class);

    static final String ACTIVE_DONATION_CONSTRAINT = "uq_donation_active_donor_request";

    private final DonationRepository donationRepository;
    private final DonorRepository donorRepository;
    private final DonationRequestRepository requestRepository;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public DonationService(
            DonationRepository donationRepository,
            DonorRepository donorRepository,
            DonationRequestRepository requestRepository,
            EligibilityEvaluator eligibilityEvaluator,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.donationRepository = donationRepository;
        this.donorRepository = donorRepository;
        this.requestRepository = requestRepository;
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public Donation createDonation(UUID donorId, UUID requestId, Integer quantity, String notes) {
        Donor donor = donorRepository.findById(donorId)
                .orElseThrow(() -> ProblemException.notFound("DONOR_NOT_FOUND"));
        DonationRequest request = requestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND"));

        EligibilityResult eligibility = eligibilityEvaluator.evaluate(donor, request);
        if (!eligibility.eligible()) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "DONOR_INELIGIBLE", eligibility.reason());
        }

        if (donationRepository.existsByDonorIdAndRequestIdAndStatusNot(donorId, requestId, DonationStatus.CANCELLED)) {
            throw alreadyActive();
        }

        int effectiveQuantity = quantity == null ? 1 : quantity;
        if (effectiveQuantity < 1) {
            throw ProblemException.badRequest("INVALID_QUANTITY", "Quantity must be at least 1");
        }

        Donation donation = new Donation(donor, request, effectiveQuantity, notes);
        try {
            donation = donationRepository.saveAndFlush(donation);
        } catch (DataIntegrityViolationException ex) {
            if (isActiveDonationConflict(ex)) {
                throw alreadyActive();
            }
            throw ex;
        }

        log.info("Donation created donationId={} donorId={} requestId={}", donation.getId(), donorId, requestId);
        eventPublisher.publishEvent(new DonationMatchedEvent(donation.getId(), requestId, request.getHospital().getId()));
        return donation;
    }

    public Donation updateStatus(UUID donationId, UpdateDonationStatusCommand command) {
        Donation donation = donationRepository.findById(donationId)
                .orElseThrow(() -> ProblemException.notFound("DONATION_NOT_FOUND"));
        return applyStatus(donation, command);
    }

    public Donation cancelDonation(UUID donationId) {
        return updateStatus(donationId, UpdateDonationStatusCommand.of(DonationStatus.CANCELLED.getCode()));
    }

    /**
     * Status change guarded by ownership: the donation must belong to a request of {@code hospitalId}.
     */
    public Donation updateStatusForHospital(UUID hospitalId, UUID donationId, UpdateDonationStatusCommand command) {
        Donation donation = donationRepository.findById(donationId)
                .orElseThrow(() -> ProblemException.notFound("DONATION_NOT_FOUND"));
        if (!donation.getRequest().getHospital().getId().equals(hospitalId)) {
            throw ProblemException.forbidden("DONATION_ACCESS_DENIED");
        }
        return applyStatus(donation, command);
    }

    public Donation cancelForDonor(UUID donorId, UUID donationId) {
        Donation donation = donationRepository.findById(donationId)
                .orElseThrow(() -> ProblemException.notFound("DONATION_NOT_FOUND"));
        if (!donation.getDonor().getId().equals(donorId)) {
            throw ProblemException.forbidden("DONATION_ACCESS_DENIED");
        }
        return applyStatus(donation, UpdateDonationStatusCommand.of(DonationStatus.CANCELLED.getCode()));
    }

    /**
     * Cancels the request's donations that are not completed. Runs inside the caller's transaction.
     */
    public int cancelOpenDonationsForRequest(UUID requestId) {
        return donationRepository.cancelOpenByRequestId(requestId, OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public Page<Donation> getDonationHistory(UUID donorId, DonationStatus status, Pageable pageable) {
        return donationRepository.searchByDonor(donorId, status, pageable);
    }

    @Transactional(readOnly = true)
    public Page<Donation> getDonationsForHospital(UUID hospitalId, DonationStatus status, Pageable pageable) {
        return donationRepository.searchByHospital(hospitalId, status, pageable);
    }

    @Transactional(readOnly = true)
    public List<Donation> getDonationsForRequest(UUID requestId) {
        return donationRepository.findByRequestIdWithDonor(requestId);
    }

    @Transactional(readOnly = true)
    public DonorStats getDonorStats(UUID donorId) {
        return new DonorStats(
                donationRepository.countByDonorId(donorId),
                donationRepository.countByDonorIdAndStatus(donorId, DonationStatus.COMPLETED),
                donationRepository.countByDonorIdAndStatus(donorId, DonationStatus.PENDING),
                donationRepository.countByDonorIdAndStatus(donorId, DonationStatus.SCHEDULED),
                donationRepository.sumCompletedQuantityByDonorId(donorId)
        );
    }

    private Donation applyStatus(Donation donation, UpdateDonationStatusCommand command) {
        DonationStatus target = DonationStatus.fromCode(command.status())
                .orElseThrow(() -> ProblemException.badRequest("INVALID_STATUS", "Invalid donation status: " + command.status()));

        DonationStatus current = donation.getStatus();
        if (current.isTerminal()) {
            throw ProblemException.conflict("DONATION_STATUS_TERMINAL",
                    "Donation is already " + current.getCode() + " and cannot change");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (command.scheduledDate() != null && !command.scheduledDate().isAfter(now)) {
            throw ProblemException.badRequest("SCHEDULED_DATE_NOT_IN_FUTURE", "Scheduled date must be in the future");
        }
        if (command.completedDate() != null && command.completedDate().isAfter(now)) {
            throw ProblemException.badRequest("COMPLETED_DATE_IN_FUTURE", "Completed date cannot be in the future");
        }

        donation.setStatus(target);
        if (command.scheduledDate() != null) {
            donation.setScheduledDate(command.scheduledDate());
        }
        if (command.notes() != null) {
            donation.setNotes(command.notes());
        }

        if (target == DonationStatus.COMPLETED) {
            donation.setCompletedDate(command.completedDate() != null ? command.completedDate() : now);
            // restarts the donor's cooldown window in the same transaction
            donation.getDonor().setLastDonationDate(now);
            eventPublisher.publishEvent(new DonationCompletedEvent(donation.getId(), donation.getDonor().getId()));
        } else if (command.completedDate() != null) {
            donation.setCompletedDate(command.completedDate());
        }

        log.info("Donation status changed donationId={} from={} to={}", donation.getId(), current, target);
        return donation;
    }

    private static ProblemException alreadyActive() {
        return ProblemException.conflict("DONATION_ALREADY_ACTIVE", "Donor has already responded to this request");
    }

    private static boolean isActiveDonationConflict(DataIntegrityViolationException ex) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
        String message = cause.getMessage();
        return message != null && message.contains(ACTIVE_DONATION_CONSTRAINT);
    }

    public record UpdateDonationStatusCommand(
            String status,
            OffsetDateTime scheduledDate,
            OffsetDateTime completedDate,
            String notes
    ) {
        public static UpdateDonationStatusCommand of(String status) {
            return new UpdateDonationStatusCommand(status, null, null, null);
        }
    }

    public record DonorStats(
            long totalDonations,
            long completedDonations,
            long pendingDonations,
            long scheduledDonations,
            long totalUnitsDonated
    ) {
    }
}
