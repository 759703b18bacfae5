package com.lifelink.backend.modules.matching.application;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MatchingConfig {

    @Bean
    public MatchingProperties matchingProperties(
            @Value("${lifelink.matching.donation-cooldown-days:56}") int donationCooldownDays,
            @Value("${lifelink.matching.max-distance-km:100}") double maxDistanceKm,
            @Value("${lifelink.matching.neutral-location-score:50}") double neutralLocationScore,
            @Value("${lifelink.matching.exact-match-bonus:20}") int exactMatchBonus,
            @Value("${lifelink.matching.base-score:100}") int baseScore
    ) {
        return new MatchingProperties(donationCooldownDays, maxDistanceKm, neutralLocationScore, exactMatchBonus, baseScore);
    }
}
