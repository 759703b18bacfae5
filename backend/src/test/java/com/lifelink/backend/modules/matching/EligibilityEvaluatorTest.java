package com.lifelink.backend.modules.matching;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.lifelink.backend.modules.matching.application.EligibilityEvaluator;
import com.lifelink.backend.modules.matching.application.MatchingProperties;
import com.lifelink.backend.modules.matching.domain.BloodType;
import com.lifelink.backend.modules.matching.domain.EligibilityResult;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.request.domain.OrganType;
import com.lifelink.backend.modules.request.domain.Urgency;
import com.lifelink.backend.modules.user.domain.Donor;
import com.lifelink.backend.modules.user.domain.Hospital;
import com.lifelink.backend.support.DomainFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EligibilityEvaluatorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");

    private EligibilityEvaluator evaluator;
    private Hospital hospital;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        evaluator = new EligibilityEvaluator(MatchingProperties.defaults(), clock);
        hospital = DomainFixtures.hospital();
    }

    @Test
    void compatibleAvailableDonorIsEligible() {
        Donor donor = DomainFixtures.donor(BloodType.O_NEGATIVE);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.AB_POSITIVE, Urgency.HIGH);

        EligibilityResult result = evaluator.evaluate(donor, request);

        assertThat(result.eligible()).isTrue();
        assertThat(result.reason()).isEqualTo("Donor is eligible");
    }

    @Test
    @DisplayName("unavailability wins over every other rule")
    void unavailableDonorIsRejectedFirst() {
        Donor donor = DomainFixtures.donor(null);
        donor.setAvailable(false);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.LOW);

        EligibilityResult result = evaluator.evaluate(donor, request);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("Donor is not currently available");
    }

    @Test
    void missingBloodTypeIsRejectedForBloodRequests() {
        Donor donor = DomainFixtures.donor(null);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.LOW);

        assertThat(evaluator.evaluate(donor, request).reason())
                .isEqualTo("Donor has not provided blood type information");
    }

    @Test
    void incompatibleTypeNamesBothTypes() {
        Donor donor = DomainFixtures.donor(BloodType.A_NEGATIVE);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.CRITICAL);

        EligibilityResult result = evaluator.evaluate(donor, request);

        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("Donor blood type A- is not compatible with request for O+");
    }

    @Test
    void cooldownBoundaryIsFiftySixWholeDays() {
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.MEDIUM);

        Donor exactly56 = DomainFixtures.donor(BloodType.O_POSITIVE);
        exactly56.setLastDonationDate(NOW.minusDays(56));
        assertThat(evaluator.evaluate(exactly56, request).eligible()).isTrue();

        Donor only55 = DomainFixtures.donor(BloodType.O_POSITIVE);
        only55.setLastDonationDate(NOW.minusDays(55));
        EligibilityResult result = evaluator.evaluate(only55, request);
        assertThat(result.eligible()).isFalse();
        assertThat(result.reason()).isEqualTo("Must wait 1 more days before donating again");

        Donor almost56 = DomainFixtures.donor(BloodType.O_POSITIVE);
        almost56.setLastDonationDate(NOW.minusDays(56).plusHours(1));
        assertThat(evaluator.evaluate(almost56, request).eligible()).isFalse();
    }

    @Test
    void donationJustNowRequiresFullCooldown() {
        Donor donor = DomainFixtures.donor(BloodType.O_POSITIVE);
        donor.setLastDonationDate(NOW);
        DonationRequest request = DomainFixtures.bloodRequest(hospital, BloodType.O_POSITIVE, Urgency.MEDIUM);

        assertThat(evaluator.evaluate(donor, request).reason())
                .isEqualTo("Must wait 56 more days before donating again");
    }

    @Test
    void organRequestsOnlyCheckAvailability() {
        Donor donor = DomainFixtures.donor(null);
        donor.setLastDonationDate(NOW);
        DonationRequest request = DomainFixtures.organRequest(hospital, OrganType.KIDNEY, Urgency.HIGH);

        assertThat(evaluator.evaluate(donor, request).eligible()).isTrue();

        donor.setAvailable(false);
        assertThat(evaluator.evaluate(donor, request).eligible()).isFalse();
    }

    @Test
    void cooldownFollowsConfiguredDays() {
        MatchingProperties shortCooldown = new MatchingProperties(7, 100, 50, 20, 100);
        EligibilityEvaluator custom = new EligibilityEvaluator(shortCooldown, Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        Donor donor = DomainFixtures.donor(BloodType.B_POSITIVE);
        donor.setLastDonationDate(NOW.minusDays(7));

        assertThat(custom.evaluate(donor, DomainFixtures.bloodRequest(hospital, BloodType.AB_POSITIVE, Urgency.LOW)).eligible())
                .isTrue();
    }
}
