package com.lifelink.backend.modules.matching.domain;

import com.lifelink.backend.global.common.GeoLocation;

public final class GeoDistance {

    private static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Great-circle distance in kilometres (haversine).
     */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    public static double distanceKm(GeoLocation from, GeoLocation to) {
        return distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
    }

    /**
     * 100 at zero distance, decaying linearly to 0 at {@code maxDistanceKm}; 0 beyond it.
     */
    public static double locationScore(double distanceKm, double maxDistanceKm) {
        if (distanceKm > maxDistanceKm) {
            return 0;
        }
        return Math.max(0, 100 - (distanceKm / maxDistanceKm) * 100);
    }
}
