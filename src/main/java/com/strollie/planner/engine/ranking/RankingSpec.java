package com.strollie.planner.engine.ranking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Caller intent for one preference-filtered ranking: field filters plus an optional sort key.
 * The sort direction comes from {@link #ASCENDING_FIELDS}; everything else sorts descending.
 */
public record RankingSpec(Map<String, Object> filters, String sortKey, boolean sortAscending) {

    /** Cost, distance and duration style fields where smaller is better. */
    public static final Set<String> ASCENDING_FIELDS = Set.of(
            "price",
            "distance_km",
            "distance_to_place",
            "distance_to_city_center",
            "distance_to_metro",
            "duration_minutes",
            "duration_hours",
            "travel_time_minutes"
    );

    public RankingSpec {
        filters = filters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(filters));
        sortKey = sortKey == null || sortKey.isBlank() ? null : sortKey.trim();
    }

    public static RankingSpec of(Map<String, ?> filters, String sortKey) {
        Map<String, Object> copy = filters == null ? null : new LinkedHashMap<String, Object>(filters);
        String key = sortKey == null || sortKey.isBlank() ? null : sortKey.trim();
        return new RankingSpec(copy, key, key != null && ASCENDING_FIELDS.contains(key));
    }

    public static RankingSpec none() {
        return new RankingSpec(Map.of(), null, false);
    }

    public boolean hasFilters() {
        return !filters.isEmpty();
    }

    public boolean hasSortKey() {
        return sortKey != null;
    }

    public boolean isEmpty() {
        return !hasFilters() && !hasSortKey();
    }
}
