package com.lifelink.backend.global.common;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * City/region pair with optional coordinates. Proximity scoring only applies when both
 * latitude and longitude are present.
 */
@Embeddable
public class GeoLocation {

    @Column(name = "city", length = 100)
    private String city;

    @Column(name = "region", length = 100)
    private String region;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    protected GeoLocation() {
    }

    public GeoLocation(String city, String region, Double latitude, Double longitude) {
        this.city = city;
        this.region = region;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public static GeoLocation of(String city, String region) {
        return new GeoLocation(city, region, null, null);
    }

    public String getCity() {
        return city;
    }

    public String getRegion() {
        return region;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }
}
