package com.lifelink.backend.modules.matching;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.lifelink.backend.global.common.GeoLocation;
import com.lifelink.backend.modules.matching.domain.GeoDistance;

import org.junit.jupiter.api.Test;

class GeoDistanceTest {

    @Test
    void samePointIsZero() {
        assertThat(GeoDistance.distanceKm(37.5665, 126.9780, 37.5665, 126.9780)).isEqualTo(0.0);
    }

    @Test
    void oneDegreeOfLatitudeIsAboutOneHundredElevenKm() {
        assertThat(GeoDistance.distanceKm(0, 0, 1, 0)).isCloseTo(111.19, within(0.05));
    }

    @Test
    void londonToParis() {
        GeoLocation london = new GeoLocation("London", "England", 51.5074, -0.1278);
        GeoLocation paris = new GeoLocation("Paris", "Ile-de-France", 48.8566, 2.3522);

        assertThat(GeoDistance.distanceKm(london, paris)).isCloseTo(343.5, within(1.0));
        assertThat(GeoDistance.distanceKm(paris, london)).isCloseTo(GeoDistance.distanceKm(london, paris), within(1e-9));
    }

    @Test
    void locationScoreDecaysLinearlyToZeroAtRadius() {
        assertThat(GeoDistance.locationScore(0, 100)).isEqualTo(100.0);
        assertThat(GeoDistance.locationScore(25, 100)).isEqualTo(75.0);
        assertThat(GeoDistance.locationScore(100, 100)).isEqualTo(0.0);
        assertThat(GeoDistance.locationScore(150, 100)).isEqualTo(0.0);
    }
}
