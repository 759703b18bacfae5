package com.lifelink.backend.modules.notification.application;

import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

/**
 * Maps a donor's completed-donation count to the achievement unlocked at that count.
 */
@Component
public class MilestonePolicy {

    private static final String TYPE_DONATION_COUNT = "donation-count";

    private static final Map<Long, String> TITLES = Map.of(
            1L, "First Donation",
            5L, "Regular Donor",
            10L, "Dedicated Donor",
            25L, "Lifesaver",
            50L, "Hero Donor"
    );

    public Optional<Achievement> achievementFor(long completedDonations) {
        String title = TITLES.get(completedDonations);
        if (title == null) {
            return Optional.empty();
        }
        String message = completedDonations == 1
                ? "Congratulations on completing your first donation!"
                : "Congratulations! You have completed " + completedDonations + " donations.";
        return Optional.of(new Achievement(
                "donations-" + completedDonations,
                TYPE_DONATION_COUNT,
                title,
                message,
                (int) completedDonations * 10
        ));
    }
}
