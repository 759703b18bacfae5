package com.lifelink.backend.modules.matching.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.lifelink.backend.global.common.GeoLocation;
import com.lifelink.backend.modules.matching.domain.EligibilityResult;
import com.lifelink.backend.modules.matching.domain.GeoDistance;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.user.domain.Donor;

import org.springframework.stereotype.Component;

/**
 * Ranks donors for a request and requests for a donor. Works on already loaded pools and never
 * mutates them; the result is only advisory since eligibility is checked again when a donation
 * is created.
 */
@Component
public class MatchingEngine {

    private final EligibilityEvaluator eligibilityEvaluator;
    private final MatchingProperties properties;

    public MatchingEngine(EligibilityEvaluator eligibilityEvaluator, MatchingProperties properties) {
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.properties = properties;
    }

    /**
     * @param respondedDonorIds donors already holding a non-cancelled donation against the request
     */
    public List<DonorCandidate> findCandidateDonors(DonationRequest request, Collection<Donor> donorPool, Set<UUID> respondedDonorIds) {
        List<DonorCandidate> candidates = new ArrayList<>();
        for (Donor donor : donorPool) {
            if (respondedDonorIds.contains(donor.getId())) {
                continue;
            }
            EligibilityResult eligibility = eligibilityEvaluator.evaluate(donor, request);
            if (!eligibility.eligible()) {
                continue;
            }

            double score = properties.baseScore();
            if (isExactBloodMatch(donor, request)) {
                score += properties.exactMatchBonus();
            }
            score = (score + locationScore(donor.getLocation(), request.getHospital().getLocation())) / 2;

            candidates.add(new DonorCandidate(donor, score, eligibility.reason()));
        }
        // List.sort is stable, so equal scores keep pool order
        candidates.sort(Comparator.comparingDouble(DonorCandidate::score).reversed());
        return candidates;
    }

    /**
     * @param respondedRequestIds requests the donor already holds a non-cancelled donation against
     */
    public List<RequestCandidate> findCandidateRequests(Donor donor, Collection<DonationRequest> requestPool, Set<UUID> respondedRequestIds) {
        List<RequestCandidate> candidates = new ArrayList<>();
        for (DonationRequest request : requestPool) {
            if (!request.getStatus().isOpen() || respondedRequestIds.contains(request.getId())) {
                continue;
            }
            if (!eligibilityEvaluator.evaluate(donor, request).eligible()) {
                continue;
            }

            boolean exactMatch = isExactBloodMatch(donor, request);
            int score = properties.baseScore();
            if (exactMatch) {
                score += properties.exactMatchBonus();
            }
            score += request.getUrgency().getScoreBonus();

            candidates.add(new RequestCandidate(request, score, new RequestCandidate.Compatibility(exactMatch, true)));
        }
        candidates.sort(Comparator.comparingInt(RequestCandidate::score).reversed());
        return candidates;
    }

    double locationScore(GeoLocation donorLocation, GeoLocation hospitalLocation) {
        if (donorLocation == null || hospitalLocation == null
                || !donorLocation.hasCoordinates() || !hospitalLocation.hasCoordinates()) {
            return properties.neutralLocationScore();
        }
        double distance = GeoDistance.distanceKm(donorLocation, hospitalLocation);
        return GeoDistance.locationScore(distance, properties.maxDistanceKm());
    }

    private static boolean isExactBloodMatch(Donor donor, DonationRequest request) {
        return request.isBlood() && donor.getBloodType() != null && donor.getBloodType() == request.getBloodType();
    }
}
