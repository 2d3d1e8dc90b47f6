package com.strollie.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * A record together with its great-circle distance to the target of one proximity query.
 * Only produced by {@link com.strollie.planner.engine.geo.ProximityJoin}; never reused for another target.
 */
public record DistanceAnnotatedRecord(
        @JsonProperty("record") TravelRecord record,
        @JsonProperty("distance_km") double distanceKm
) implements FieldSource {

    public static final String DISTANCE_KM = "distance_km";
    public static final String DISTANCE_TO_PLACE = "distance_to_place";

    public DistanceAnnotatedRecord {
        if (Double.isNaN(distanceKm) || distanceKm < 0) {
            throw new IllegalArgumentException("distanceKm must be non-negative, got " + distanceKm);
        }
    }

    @Override
    public Optional<Object> field(String name) {
        if (DISTANCE_KM.equals(name) || DISTANCE_TO_PLACE.equals(name)) {
            return Optional.of(distanceKm);
        }
        return record.field(name);
    }

    @Override
    public Set<String> fieldNames() {
        Set<String> names = new LinkedHashSet<>(record.fieldNames());
        names.add(DISTANCE_KM);
        names.add(DISTANCE_TO_PLACE);
        return Collections.unmodifiableSet(names);
    }

    public String name() {
        return record.getName();
    }
}
