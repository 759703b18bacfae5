package com.lifelink.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.lifelink.backend.modules.notification.application.Achievement;
import com.lifelink.backend.modules.notification.application.MilestonePolicy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class MilestonePolicyTest {

    private final MilestonePolicy policy = new MilestonePolicy();

    @ParameterizedTest
    @CsvSource({
            "1, First Donation",
            "5, Regular Donor",
            "10, Dedicated Donor",
            "25, Lifesaver",
            "50, Hero Donor"
    })
    void thresholdsUnlockAchievements(long count, String title) {
        Achievement achievement = policy.achievementFor(count).orElseThrow();

        assertThat(achievement.title()).isEqualTo(title);
        assertThat(achievement.id()).isEqualTo("donations-" + count);
        assertThat(achievement.points()).isEqualTo((int) count * 10);
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 2, 4, 6, 26, 51, 100})
    void otherCountsUnlockNothing(long count) {
        assertThat(policy.achievementFor(count)).isEmpty();
    }

    @Test
    void firstDonationHasDedicatedMessage() {
        assertThat(policy.achievementFor(1).orElseThrow().message())
                .isEqualTo("Congratulations on completing your first donation!");
    }
}
