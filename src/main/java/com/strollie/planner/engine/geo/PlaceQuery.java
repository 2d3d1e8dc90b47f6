package com.strollie.planner.engine.geo;

import com.strollie.planner.error.ValidationException;

/**
 * Target of a proximity query: a named reference record, explicit coordinates, or both.
 * Explicit coordinates win when both are given.
 */
public record PlaceQuery(String name, GeoPoint point) {

    public PlaceQuery {
        if (point == null && (name == null || name.isBlank())) {
            throw new ValidationException("Either a place name or coordinates must be given");
        }
    }

    public static PlaceQuery byName(String name) {
        return new PlaceQuery(name, null);
    }

    public static PlaceQuery byPoint(GeoPoint point) {
        return new PlaceQuery(null, point);
    }

    public boolean hasPoint() {
        return point != null;
    }
}
