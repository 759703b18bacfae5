package com.lifelink.backend.modules.matching.application;

/**
 * Tunables for eligibility and ranking, bound from {@code lifelink.matching.*}.
 *
 * @param donationCooldownDays minimum whole days between completed blood donations
 * @param maxDistanceKm radius at which the proximity sub-score reaches zero
 * @param neutralLocationScore proximity sub-score used when either side has no coordinates
 * @param exactMatchBonus added when donor and request blood types are identical
 * @param baseScore starting score of every candidate
 */
public record MatchingProperties(
        int donationCooldownDays,
        double maxDistanceKm,
        double neutralLocationScore,
        int exactMatchBonus,
        int baseScore
) {

    public MatchingProperties {
        if (donationCooldownDays < 0) {
            throw new IllegalArgumentException("donationCooldownDays must not be negative");
        }
        if (maxDistanceKm <= 0) {
            throw new IllegalArgumentException("maxDistanceKm must be positive");
        }
    }

    public static MatchingProperties defaults() {
        return new MatchingProperties(56, 100, 50, 20, 100);
    }
}
