package com.lifelink.backend.modules.user.presentation.dto;

import com.lifelink.backend.global.common.GeoLocation;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;

public record LocationPayload(
        @Size(max = 100) String city,
        @Size(max = 100) String region,
        @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
        @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude
) {

    public GeoLocation toGeoLocation() {
        return new GeoLocation(city, region, latitude, longitude);
    }

    public static LocationPayload from(GeoLocation location) {
        if (location == null) {
            return null;
        }
        return new LocationPayload(location.getCity(), location.getRegion(), location.getLatitude(), location.getLongitude());
    }
}
