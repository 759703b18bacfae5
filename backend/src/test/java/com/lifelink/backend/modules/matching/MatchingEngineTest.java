package com.lifelink.backend.modules.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import com.lifelink.backend.modules.matching.application.DonorCandidate;
import com.lifelink.backend.modules.matching.application.EligibilityEvaluator;
import com.lifelink.backend.modules.matching.application.MatchingEngine;
import com.lifelink.backend.modules.matching.application.MatchingProperties;
import com.lifelink.backend.modules.matching.application.RequestCandidate;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.OrganType;
import com.lifelink.backend.modules.request.domain.RequestStatus;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MatchingEngineTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private MatchingEngine engine;

    @BeforeEach
    void setUp() {
        MatchingProperties properties = MatchingProperties.defaults();
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        engine = new MatchingEngine(new EligibilityEvaluator(properties, clock), properties);
    }

    @Test
    @DisplayName("O+ critical request: exact match ranks first, incompatible A- is excluded")
    void ranksCompatibleDonorsForBloodRequest() {
        Hospital hospital = DomainFixtures.hospital();
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.CRITICAL);
        Donor exact = DomainFixtures.donor(BloodType.O_POSITIVE);
        Donor universal = DomainFixtures.donor(BloodType.O_NEGATIVE);
        Donor incompatible = DomainFixtures.donor(BloodType.A_NEGATIVE);

        List<DonorCandidate> candidates = engine.findCandidateDonors(request, List.of(universal, incompatible, exact), Set.of());

        assertThat(candidates).extracting(DonorCandidate::donor).containsExactly(exact, universal);
        // no coordinates: neutral proximity of 50 averaged with the running score
        assertThat(candidates.get(0).score()).isEqualTo(85.0);
        assertThat(candidates.get(1).score()).isEqualTo(75.0);
        assertThat(candidates.get(0).reason()).isEqualTo("Donor is eligible");
    }

    @Test
    void excludesDonorsWhoAlreadyResponded() {
        Hospital hospital = DomainFixtures.hospital();
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.AB_POSITIVE, Urgency.LOW);
        Donor responded = DomainFixtures.donor(BloodType.AB_POSITIVE);
        Donor fresh = DomainFixtures.donor(BloodType.A_POSITIVE);

        List<DonorCandidate> candidates = engine.findCandidateDonors(request, List.of(responded, fresh), Set.of(responded.getId()));

        assertThat(candidates).extracting(DonorCandidate::donor).containsExactly(fresh);
    }

    @Test
    void excludesIneligibleDonors() {
        Hospital hospital = DomainFixtures.hospital();
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.B_POSITIVE, Urgency.MEDIUM);
        Donor unavailable = DomainFixtures.donor(BloodType.B_POSITIVE);
        unavailable.setAvailable(false);
        Donor cooling = DomainFixtures.donor(BloodType.B_POSITIVE);
        cooling.setLastDonationDate(NOW.minusDays(10));

        assertThat(engine.findCandidateDonors(request, List.of(unavailable, cooling), Set.of())).isEmpty();
    }

    @Test
    void proximityBlendsIntoScore() {
        Hospital hospital = DomainFixtures.hospitalAt(0, 0);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.HIGH);
        Donor near = DomainFixtures.donorAt(BloodType.O_POSITIVE, 0, 0);
        Donor far = DomainFixtures.donorAt(BloodType.O_POSITIVE, 10, 10);
        Donor unknown = DomainFixtures.donor(BloodType.O_POSITIVE);

        List<DonorCandidate> candidates = engine.findCandidateDonors(request, List.of(far, unknown, near), Set.of());

        assertThat(candidates).extracting(DonorCandidate::donor).containsExactly(near, unknown, far);
        assertThat(candidates.get(0).score()).isEqualTo(110.0);
        assertThat(candidates.get(1).score()).isEqualTo(85.0);
        assertThat(candidates.get(2).score()).isCloseTo(60.0, within(1e-9));
    }

    @Test
    void scoresAreNonIncreasingAndTiesKeepPoolOrder() {
        Hospital hospital = DomainFixtures.hospital();
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.AB_POSITIVE, Urgency.LOW);
        Donor first = DomainFixtures.donor(BloodType.O_NEGATIVE);
        Donor second = DomainFixtures.donor(BloodType.A_POSITIVE);
        Donor exact = DomainFixtures.donor(BloodType.AB_POSITIVE);

        List<DonorCandidate> candidates = engine.findCandidateDonors(request, List.of(first, second, exact), Set.of());

        assertThat(candidates).extracting(DonorCandidate::donor).containsExactly(exact, first, second);
        assertThat(candidates).extracting(DonorCandidate::score).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void organRequestsHaveNoExactMatchBonus() {
        Hospital hospital = DomainFixtures.hospital();
        DonationRequest request = DomainFixtures.organRequest(hospital, OrganType.LIVER, Urgency.CRITICAL);
        Donor donor = DomainFixtures.donor(null);

        List<DonorCandidate> candidates = engine.findCandidateDonors(request, List.of(donor), Set.of());

        assertThat(candidates).singleElement().extracting(DonorCandidate::score).isEqualTo(75.0);
    }

    @Test
    void findCandidateRequestsAddsUrgencyBonusAndSkipsClosedRequests() {
        Hospital hospital = DomainFixtures.hospital();
        Donor donor = DomainFixtures.donor(BloodType.O_POSITIVE);
        DonationRequest exactLow = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.LOW);
        DonationRequest compatibleCritical = DomainFixtures.bloodRequest(hospital, BloodType.A_POSITIVE, Urgency.CRITICAL);
        DonationRequest inProgressMedium = DomainFixtures.bloodRequest(hospital, BloodType.B_POSITIVE, Urgency.MEDIUM);
        inProgressMedium.setStatus(RequestStatus.IN_PROGRESS);
        DonationRequest completed = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.CRITICAL);
        completed.setStatus(RequestStatus.COMPLETED);
        DonationRequest incompatible = DomainFixtures.bloodRequest(hospital, BloodType.O_NEGATIVE, Urgency.CRITICAL);

        List<RequestCandidate> candidates = engine.findCandidateRequests(
                donor,
                List.of(exactLow, compatibleCritical, inProgressMedium, completed, incompatible),
                Set.of()
        );

        assertThat(candidates).extracting(RequestCandidate::request)
                .containsExactly(compatibleCritical, exactLow, inProgressMedium);
        assertThat(candidates).extracting(RequestCandidate::score).containsExactly(125, 120, 105);
        assertThat(candidates.get(1).compatibility().bloodTypeMatch()).isTrue();
        assertThat(candidates.get(0).compatibility().bloodTypeMatch()).isFalse();
        assertThat(candidates).allMatch(candidate -> candidate.compatibility().eligible());
    }

    @Test
    void findCandidateRequestsSkipsRespondedRequests() {
        Hospital hospital = DomainFixtures.hospital();
        Donor donor = DomainFixtures.donor(BloodType.O_NEGATIVE);
        DonationRequest responded = DomainFixtures.bloodRequest(hospital, BloodType.O_NEGATIVE, Urgency.HIGH);
        DonationRequest open = DomainFixtures.organRequest(hospital, OrganType.KIDNEY, Urgency.LOW);

        List<RequestCandidate> candidates = engine.findCandidateRequests(donor, List.of(responded, open), Set.of(responded.getId()));

        assertThat(candidates).extracting(RequestCandidate::request).containsExactly(open);
        assertThat(candidates.get(0).score()).isEqualTo(100);
    }
}
