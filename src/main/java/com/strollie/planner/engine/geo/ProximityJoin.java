package com.strollie.planner.engine.geo;

import com.strollie.planner.error.ValidationException;
import com.strollie.planner.model.DistanceAnnotatedRecord;
import com.strollie.planner.model.TravelRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Matches candidates to a target point by great-circle distance.
 * <p>
 * Works in either direction: attractions around a listing and listings around an attraction
 * are the same call with the collections swapped. Candidates are scanned linearly.
 */
@Slf4j
public class ProximityJoin {

    public static final double DEFAULT_MAX_DISTANCE_KM = 2.0;
    public static final int DEFAULT_LIMIT = 5;

    /**
     * Point coordinates first; otherwise a case-insensitive name lookup in {@code references}.
     * An unknown name, or a reference without coordinates, resolves to empty.
     */
    public Optional<GeoPoint> resolveTarget(PlaceQuery query, Collection<TravelRecord> references) {
        if (query.hasPoint()) {
            return Optional.of(query.point());
        }

        String wanted = query.name().trim();
        Optional<GeoPoint> resolved = references.stream()
                .filter(r -> r.getName() != null && r.getName().trim().equalsIgnoreCase(wanted))
                .findFirst()
                .flatMap(TravelRecord::getCoordinates);

        if (resolved.isEmpty()) {
            log.info("Reference place '{}' not found among {} records", wanted, references.size());
        }
        return resolved;
    }

    public List<DistanceAnnotatedRecord> join(PlaceQuery query,
                                              Collection<TravelRecord> references,
                                              Collection<TravelRecord> candidates,
                                              double maxDistanceKm,
                                              int limit) {
        return resolveTarget(query, references)
                .map(target -> join(target, candidates, maxDistanceKm, limit))
                .orElseGet(List::of);
    }

    public List<DistanceAnnotatedRecord> join(GeoPoint target, Collection<TravelRecord> candidates) {
        return join(target, candidates, DEFAULT_MAX_DISTANCE_KM, DEFAULT_LIMIT);
    }

    /**
     * Candidates within {@code maxDistanceKm} of {@code target}, nearest first, at most {@code limit}.
     * Candidates without coordinates are skipped; equal distances keep their input order.
     */
    public List<DistanceAnnotatedRecord> join(GeoPoint target,
                                              Collection<TravelRecord> candidates,
                                              double maxDistanceKm,
                                              int limit) {
        if (target == null) {
            throw new ValidationException("Target point is required");
        }
        if (Double.isNaN(maxDistanceKm) || maxDistanceKm < 0) {
            throw new ValidationException("maxDistanceKm must be >= 0, got " + maxDistanceKm);
        }
        if (limit < 0) {
            throw new ValidationException("limit must be >= 0, got " + limit);
        }

        List<DistanceAnnotatedRecord> matches = new ArrayList<>();
        int skipped = 0;
        for (TravelRecord candidate : candidates) {
            Optional<GeoPoint> point = candidate.getCoordinates();
            if (point.isEmpty()) {
                skipped++;
                continue;
            }
            double distance = Haversine.distanceKm(target, point.get());
            if (distance <= maxDistanceKm) {
                matches.add(new DistanceAnnotatedRecord(candidate, distance));
            }
        }

        matches.sort(Comparator.comparingDouble(DistanceAnnotatedRecord::distanceKm));
        log.debug("Proximity join: {} candidates, {} without coordinates, {} within {} km",
                candidates.size(), skipped, matches.size(), maxDistanceKm);

        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }
}
