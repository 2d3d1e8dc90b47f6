package com.strollie.planner.engine.ranking;

import com.strollie.planner.engine.geo.PlaceQuery;
import com.strollie.planner.engine.geo.ProximityJoin;
import com.strollie.planner.error.ValidationException;
import com.strollie.planner.model.DistanceAnnotatedRecord;
import com.strollie.planner.model.FieldSource;
import com.strollie.planner.model.TravelRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw rows into ordered recommendations.
 * <p>
 * Every mode works on a copy: inputs are never reordered or modified. Sorting is stable, and
 * truncation to {@code topN} is always the last step.
 */
@Slf4j
@RequiredArgsConstructor
public class RankingEngine {

    public static final int DEFAULT_TOP_N = 5;

    private final ProximityJoin proximityJoin;

    public <T extends FieldSource> List<T> rankDefault(Collection<T> records, int topN) {
        return rankDefault(records, DefaultRankingTable.LODGING, topN);
    }

    public <T extends FieldSource> List<T> rankDefault(Collection<T> records, DefaultRankingTable table, int topN) {
        requireRecords(records);
        requireTopN(topN);

        List<T> ranked = new ArrayList<>(records);
        ranked.sort(table.<T>comparator());
        log.info("Default ranking '{}': {} records, returning {}", table.name(), ranked.size(), Math.min(topN, ranked.size()));
        return truncate(ranked, topN);
    }

    public <T extends FieldSource> List<T> rankWithPreferences(Collection<T> records,
                                                               Map<String, ?> filters,
                                                               String sortKey,
                                                               int topN) {
        return rank(records, RankingSpec.of(filters, sortKey), topN);
    }

    /**
     * Applies the filters of {@code spec}, then sorts by its key when at least one remaining
     * record carries it. Filters on fields no record has are ignored.
     */
    public <T extends FieldSource> List<T> rank(Collection<T> records, RankingSpec spec, int topN) {
        requireRecords(records);
        requireTopN(topN);

        List<T> remaining = new ArrayList<>(records);
        Set<String> schema = schemaOf(remaining);

        for (Map.Entry<String, Object> filter : spec.filters().entrySet()) {
            String field = filter.getKey();
            if (!schema.contains(field)) {
                log.info("Ignoring filter on unknown field '{}'", field);
                continue;
            }
            int before = remaining.size();
            remaining.removeIf(r -> !FieldValues.matches(r.field(field).orElse(null), filter.getValue()));
            log.info("Filter applied: {}={}, reduced {} -> {} rows", field, filter.getValue(), before, remaining.size());
        }

        if (spec.hasSortKey()) {
            String key = spec.sortKey();
            boolean present = remaining.stream().anyMatch(r -> r.field(key).isPresent());
            if (present) {
                log.info("Sorting by {}, ascending={}", key, spec.sortAscending());
                remaining.sort(new SortKey(key, spec.sortAscending()).<T>comparator());
            } else {
                log.info("Sort key '{}' not present in remaining rows, keeping filtered order", key);
            }
        }

        log.info("Returning {} recommendations", Math.min(topN, remaining.size()));
        return truncate(remaining, topN);
    }

    /**
     * Listings around a reference place, unbounded radius.
     *
     * @see #rankNearPlace(Collection, Collection, PlaceQuery, double, Map, String, int)
     */
    public List<DistanceAnnotatedRecord> rankNearPlace(Collection<TravelRecord> listings,
                                                       Collection<TravelRecord> places,
                                                       PlaceQuery target,
                                                       Map<String, ?> filters,
                                                       String sortKey,
                                                       int topN) {
        return rankNearPlace(listings, places, target, Double.POSITIVE_INFINITY, filters, sortKey, topN);
    }

    /**
     * Listings within {@code maxDistanceKm} of the target, each carrying {@code distance_km}.
     * With filters or a sort key the annotated rows go through preference ranking; otherwise
     * they stay nearest first. An unresolvable place name yields an empty list.
     */
    public List<DistanceAnnotatedRecord> rankNearPlace(Collection<TravelRecord> listings,
                                                       Collection<TravelRecord> places,
                                                       PlaceQuery target,
                                                       double maxDistanceKm,
                                                       Map<String, ?> filters,
                                                       String sortKey,
                                                       int topN) {
        requireRecords(listings);
        requireRecords(places);
        requireTopN(topN);

        List<DistanceAnnotatedRecord> nearby =
                proximityJoin.join(target, places, listings, maxDistanceKm, Integer.MAX_VALUE);
        log.info("Calculated distance for {} listings near {}", nearby.size(), describe(target));

        RankingSpec spec = RankingSpec.of(filters, sortKey);
        if (!spec.isEmpty()) {
            return rank(nearby, spec, topN);
        }

        log.info("Returning {} nearest listings", Math.min(topN, nearby.size()));
        return truncate(nearby, topN);
    }

    private static Set<String> schemaOf(Collection<? extends FieldSource> records) {
        Set<String> fields = new HashSet<>();
        records.forEach(r -> fields.addAll(r.fieldNames()));
        return fields;
    }

    private static <T> List<T> truncate(List<T> ranked, int topN) {
        return ranked.size() > topN ? List.copyOf(ranked.subList(0, topN)) : List.copyOf(ranked);
    }

    private static void requireRecords(Collection<?> records) {
        if (records == null) {
            throw new ValidationException("Record collection is required");
        }
    }

    private static void requireTopN(int topN) {
        if (topN < 0) {
            throw new ValidationException("topN must be >= 0, got " + topN);
        }
    }

    private static String describe(PlaceQuery target) {
        return target.hasPoint() ? target.point().toString() : "'" + target.name() + "'";
    }
}
