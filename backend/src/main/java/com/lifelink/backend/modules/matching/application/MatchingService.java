package com.lifelink.backend.modules.matching.application;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lifelink.backend.global.error.ProblemException;
import com.lifelink.backend.modules.donation.infrastructure.persistence.DonationRepository;
import com.lifelink.backend.modules.matching.domain.BloodCompatibility;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.matching.domain.EligibilityResult;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.OrganType;
import com.lifelink.backend.modules.request.domain.RequestKind;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.request.infrastructure.persistence.DonationRequestRepository;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.infrastructure.persistence.DonorRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Loads matching pools from persistence and hands them to the {@link MatchingEngine}.
 * Every call reads fresh state; nothing is cached between calls.
 */
@Service
@Transactional(readOnly = true)
public class MatchingService {

    private final MatchingEngine matchingEngine;
    private final EligibilityEvaluator eligibilityEvaluator;
    private final DonorRepository donorRepository;
    private final DonationRequestRepository requestRepository;
    private final DonationRepository donationRepository;

    public MatchingService(
            MatchingEngine matchingEngine,
            EligibilityEvaluator eligibilityEvaluator,
            DonorRepository donorRepository,
            DonationRequestRepository requestRepository,
            DonationRepository donationRepository
    ) {
        this.matchingEngine = matchingEngine;
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.donorRepository = donorRepository;
        this.requestRepository = requestRepository;
        this.donationRepository = donationRepository;
    }

    public List<DonorCandidate> findCandidateDonors(UUID requestId) {
        DonationRequest request = loadRequest(requestId);
        return rankDonors(request);
    }

    public List<DonorCandidate> findCandidateDonorsForHospital(UUID hospitalId, UUID requestId) {
        DonationRequest request = loadRequest(requestId);
        if (!request.getHospital().getId().equals(hospitalId)) {
            throw ProblemException.forbidden("REQUEST_ACCESS_DENIED");
        }
        return rankDonors(request);
    }

    public List<RequestCandidate> findCandidateRequests(UUID donorId) {
        Donor donor = loadDonor(donorId);
        List<DonationRequest> pool = requestRepository.findWithHospitalByStatusIn(RequestStatus.OPEN);
        Set<UUID> responded = new HashSet<>(donationRepository.findActiveRequestIdsByDonorId(donorId));
        return matchingEngine.findCandidateRequests(donor, pool, responded);
    }

    public MatchAnalysis analyze(UUID donorId, UUID requestId) {
        Donor donor = loadDonor(donorId);
        DonationRequest request = loadRequest(requestId);
        EligibilityResult eligibility = eligibilityEvaluator.evaluate(donor, request);

        Boolean bloodTypeMatch = request.getKind() == RequestKind.BLOOD
                ? BloodCompatibility.isCompatible(donor.getBloodType(), request.getBloodType())
                : null;

        return new MatchAnalysis(
                new MatchAnalysis.DonorSummary(
                        donor.getId(),
                        donor.getUser().getFullName(),
                        donor.getBloodType(),
                        donor.isAvailable(),
                        donor.getLastDonationDate()
                ),
                new MatchAnalysis.RequestSummary(
                        request.getId(),
                        request.getKind(),
                        request.getBloodType(),
                        request.getOrganType(),
                        request.getUrgency()
                ),
                new MatchAnalysis.Compatibility(bloodTypeMatch, eligibility.eligible(), eligibility.reason())
        );
    }

    private List<DonorCandidate> rankDonors(DonationRequest request) {
        List<Donor> pool = donorRepository.findMatchingPool();
        Set<UUID> responded = new HashSet<>(donationRepository.findActiveDonorIdsByRequestId(request.getId()));
        return matchingEngine.findCandidateDonors(request, pool, responded);
    }

    private DonationRequest loadRequest(UUID requestId) {
        return requestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND"));
    }

    private Donor loadDonor(UUID donorId) {
        return donorRepository.findById(donorId)
                .orElseThrow(() -> ProblemException.notFound("DONOR_NOT_FOUND"));
    }

    public record MatchAnalysis(DonorSummary donor, RequestSummary request, Compatibility compatibility) {

        public record DonorSummary(
                UUID id,
                String name,
                BloodType bloodType,
                boolean available,
                OffsetDateTime lastDonationDate
        ) {
        }

        public record RequestSummary(
                UUID id,
                RequestKind kind,
                BloodType bloodType,
                OrganType organType,
                Urgency urgency
        ) {
        }

        /**
         * @param bloodTypeMatch compatibility of the blood types, or {@code null} for organ requests
         */
        public record Compatibility(Boolean bloodTypeMatch, boolean eligible, String reason) {
        }
    }
}
