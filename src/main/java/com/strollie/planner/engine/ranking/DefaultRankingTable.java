package com.strollie.planner.engine.ranking;

import com.strollie.planner.model.FieldSource;

import java.util.Comparator;
import java.util.List;

/**
 * Fixed priority list of sort keys for default ranking. Not caller-configurable, so the same
 * rows always come back in the same order. A new domain gets its own table.
 */
public record DefaultRankingTable(String name, List<SortKey> keys) {

    public static final DefaultRankingTable LODGING = new DefaultRankingTable("lodging", List.of(
            SortKey.desc("overall_rating"),
            SortKey.desc("reputation_score"),
            SortKey.desc("cleanliness"),
            SortKey.desc("walk_score"),
            SortKey.asc("distance_to_city_center"),
            SortKey.asc("distance_to_metro"),
            SortKey.asc("nearby_attractions")
    ));

    public static final DefaultRankingTable ATTRACTIONS = new DefaultRankingTable("attractions", List.of(
            SortKey.desc("rating"),
            SortKey.desc("review_count")
    ));

    public DefaultRankingTable {
        keys = List.copyOf(keys);
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("ranking table '" + name + "' has no keys");
        }
    }

    <T extends FieldSource> Comparator<T> comparator() {
        Comparator<T> comparator = keys.get(0).comparator();
        for (SortKey key : keys.subList(1, keys.size())) {
            comparator = comparator.thenComparing(key.<T>comparator());
        }
        return comparator;
    }
}
