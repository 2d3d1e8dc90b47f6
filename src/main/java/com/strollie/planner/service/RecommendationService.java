package com.strollie.planner.service;

import com.strollie.planner.catalog.ListingCatalog;
import com.strollie.planner.catalog.PlaceCatalog;
import com.strollie.planner.config.EngineProperties;
import com.strollie.planner.engine.geo.PlaceQuery;
import com.strollie.planner.engine.geo.ProximityJoin;
import com.strollie.planner.engine.ranking.DefaultRankingTable;
import com.strollie.planner.engine.ranking.RankingEngine;
import com.strollie.planner.error.ValidationException;
import com.strollie.planner.model.DistanceAnnotatedRecord;
import com.strollie.planner.model.TravelRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * City-scoped recommendations over the listing and place catalogs.
 * A city without data is an empty answer, not a failure.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final ListingCatalog listingCatalog;
    private final PlaceCatalog placeCatalog;
    private final RankingEngine rankingEngine;
    private final ProximityJoin proximityJoin;
    private final EngineProperties properties;

    public List<TravelRecord> recommendDefault(String city, Integer topN) {
        log.info("Running default recommendation for city: {}, topN={}", city, topN);
        List<TravelRecord> listings = listingsIn(city);
        if (listings.isEmpty()) {
            return List.of();
        }
        return rankingEngine.rankDefault(listings, DefaultRankingTable.LODGING, topNOrDefault(topN));
    }

    public List<TravelRecord> recommendWithPreferences(String city, Map<String, ?> filters, String sortBy, Integer topN) {
        log.info("Running preference-based recommendation for city={}, filters={}, sortBy={}", city, filters, sortBy);
        List<TravelRecord> listings = listingsIn(city);
        if (listings.isEmpty()) {
            return List.of();
        }
        return rankingEngine.rankWithPreferences(listings, filters, sortBy, topNOrDefault(topN));
    }

    public List<DistanceAnnotatedRecord> recommendNearPlace(String city,
                                                            PlaceQuery target,
                                                            Double maxDistanceKm,
                                                            Map<String, ?> filters,
                                                            String sortBy,
                                                            Integer topN) {
        log.info("Running near-place recommendation for city={}, target={}", city, target);
        List<TravelRecord> listings = listingsIn(city);
        if (listings.isEmpty()) {
            return List.of();
        }
        double radius = maxDistanceKm != null ? maxDistanceKm : Double.POSITIVE_INFINITY;
        return rankingEngine.rankNearPlace(listings, placeCatalog.byCity(city), target, radius,
                filters, sortBy, topNOrDefault(topN));
    }

    /**
     * Attractions around one listing: the reverse direction of {@link #recommendNearPlace}.
     */
    public List<DistanceAnnotatedRecord> attractionsNearListing(String city,
                                                                String listingName,
                                                                Double maxDistanceKm,
                                                                Integer limit) {
        requireCity(city);
        log.info("Searching attractions near listing '{}' in {}", listingName, city);
        double radius = maxDistanceKm != null ? maxDistanceKm : properties.getProximity().getMaxDistanceKm();
        int max = limit != null ? limit : properties.getProximity().getLimit();

        return proximityJoin.join(PlaceQuery.byName(listingName), listingCatalog.byCity(city),
                placeCatalog.byCity(city), radius, max);
    }

    public List<TravelRecord> topAttractions(String city, Integer topN) {
        requireCity(city);
        List<TravelRecord> places = placeCatalog.byCity(city);
        if (places.isEmpty()) {
            log.warn("No places found for city={}", city);
            return List.of();
        }
        return rankingEngine.rankDefault(places, DefaultRankingTable.ATTRACTIONS, topNOrDefault(topN));
    }

    private List<TravelRecord> listingsIn(String city) {
        requireCity(city);
        List<TravelRecord> listings = listingCatalog.byCity(city);
        if (listings.isEmpty()) {
            log.warn("No listings found for city={}", city);
        }
        return listings;
    }

    private int topNOrDefault(Integer topN) {
        return topN != null ? topN : properties.getDefaultTopN();
    }

    private static void requireCity(String city) {
        if (city == null || city.isBlank()) {
            throw new ValidationException("City is required");
        }
    }
}
