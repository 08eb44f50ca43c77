package com.ridedispatch.api.shared.entities;

import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location {

    private static final double EARTH_RADIUS_KM = 6371;

    private Double latitude;
    private Double longitude;
    private String address;
    private String city;

    public static Location of(double latitude, double longitude) {
        return Location.builder()
                .latitude(latitude)
                .longitude(longitude)
                .build();
    }

    // Great-circle distance in kilometers
    public double distanceTo(Location other) {
        if (other == null || latitude == null || longitude == null
                || other.getLatitude() == null || other.getLongitude() == null) {
            return Double.MAX_VALUE;
        }

        double lat1Rad = Math.toRadians(latitude);
        double lat2Rad = Math.toRadians(other.getLatitude());
        double deltaLatRad = Math.toRadians(other.getLatitude() - latitude);
        double deltaLonRad = Math.toRadians(other.getLongitude() - longitude);

        double a = Math.sin(deltaLatRad / 2) * Math.sin(deltaLatRad / 2) +
                Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                        Math.sin(deltaLonRad / 2) * Math.sin(deltaLonRad / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }
}
