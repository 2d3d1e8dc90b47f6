package com.strollie.planner.engine.geo;

import com.strollie.planner.error.ValidationException;

/**
 * Coordinate pair in decimal degrees. Out-of-range values are rejected, not clamped.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new ValidationException("Latitude must be within [-90, 90], got " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new ValidationException("Longitude must be within [-180, 180], got " + longitude);
        }
    }

    public static GeoPoint of(double latitude, double longitude) {
        return new GeoPoint(latitude, longitude);
    }
}
