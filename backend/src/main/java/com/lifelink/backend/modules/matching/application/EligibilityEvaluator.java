package com.lifelink.backend.modules.matching.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

import com.lifelink.backend.modules.matching.domain.BloodCompatibility;
import com.lifelink.backend.modules.matching.domain.EligibilityResult;
import com.lifelink.backend.modules.request.domain.DonationRequest;
import com.lifelink.backend.modules.user.domain.Donor;

import org.springframework.stereotype.Component;

/**
 * Decides whether a donor may currently donate against a request. Rules run in order and
 * stop at the first failure: availability, then for blood requests the blood type,
 * compatibility and cooldown. Organ requests only check availability.
 */
@Component
public class EligibilityEvaluator {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final MatchingProperties properties;
    private final Clock clock;

    public EligibilityEvaluator(MatchingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public EligibilityResult evaluate(Donor donor, DonationRequest request) {
        if (!donor.isAvailable()) {
            return EligibilityResult.rejected("Donor is not currently available");
        }

        if (request.isBlood()) {
            if (donor.getBloodType() == null) {
                return EligibilityResult.rejected("Donor has not provided blood type information");
            }

            if (!BloodCompatibility.isCompatible(donor.getBloodType(), request.getBloodType())) {
                return EligibilityResult.rejected("Donor blood type %s is not compatible with request for %s"
                        .formatted(donor.getBloodType().getCode(), request.getBloodType().getCode()));
            }

            if (donor.getLastDonationDate() != null) {
                long daysSince = wholeDaysSince(donor.getLastDonationDate());
                if (daysSince < properties.donationCooldownDays()) {
                    long remaining = properties.donationCooldownDays() - daysSince;
                    return EligibilityResult.rejected("Must wait %d more days before donating again".formatted(remaining));
                }
            }
        }

        return EligibilityResult.ok();
    }

    private long wholeDaysSince(OffsetDateTime timestamp) {
        long seconds = Duration.between(timestamp, OffsetDateTime.now(clock)).getSeconds();
        return Math.floorDiv(seconds, SECONDS_PER_DAY);
    }
}
