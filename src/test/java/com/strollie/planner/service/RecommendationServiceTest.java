package com.strollie.planner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.catalog.ListingCatalog;
import com.strollie.planner.catalog.PlaceCatalog;
import com.strollie.planner.config.EngineProperties;
import com.strollie.planner.engine.geo.GeoPoint;
import com.strollie.planner.engine.geo.PlaceQuery;
import com.strollie.planner.engine.geo.ProximityJoin;
import com.strollie.planner.engine.ranking.RankingEngine;
import com.strollie.planner.error.ValidationException;
import com.strollie.planner.model.DistanceAnnotatedRecord;
import com.strollie.planner.model.TravelRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RecommendationServiceTest {

    private RecommendationService service;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper();
        ListingCatalog listings = new ListingCatalog(mapper, new ClassPathResource("listings.json"));
        PlaceCatalog places = new PlaceCatalog(mapper, new ClassPathResource("places.json"));
        listings.init();
        places.init();

        ProximityJoin proximityJoin = new ProximityJoin();
        service = new RecommendationService(listings, places, new RankingEngine(proximityJoin), proximityJoin,
                new EngineProperties());
    }

    private static List<String> names(List<TravelRecord> records) {
        return records.stream().map(TravelRecord::getName).toList();
    }

    @Test
    void defaultRecommendationPrefersRatingThenReputation() {
        List<TravelRecord> results = service.recommendDefault("Paris", 3);

        assertThat(names(results)).containsExactly("Trocadero apartment", "Marais loft", "Cozy studio near Louvre");
    }

    @Test
    void missingTopNFallsBackToConfiguredDefault() {
        assertThat(service.recommendDefault("paris", null)).hasSize(5);
    }

    @Test
    void preferencesFilterAndSortCheapestFirst() {
        List<TravelRecord> results = service.recommendWithPreferences("Paris",
                Map.of("room_type", "entire"), "price", 3);

        assertThat(names(results)).containsExactly("Cozy studio near Louvre", "Latin Quarter flat", "Marais loft");
    }

    @Test
    void nearPlaceByNameWithinRadius() {
        List<DistanceAnnotatedRecord> results = service.recommendNearPlace("Paris",
                PlaceQuery.byName("Eiffel Tower"), 3.5, null, null, 5);

        assertThat(results).extracting(DistanceAnnotatedRecord::name)
                .containsExactly("Room with Eiffel view", "Trocadero apartment", "Cozy studio near Louvre");
        assertThat(results.get(0).distanceKm()).isCloseTo(0.37, within(0.01));
    }

    @Test
    void nearPlaceByPointWithoutRadiusCoversTheCity() {
        List<DistanceAnnotatedRecord> results = service.recommendNearPlace("Paris",
                PlaceQuery.byPoint(GeoPoint.of(48.8600, 2.3266)), null, Map.of("room_type", "shared"), null, 10);

        assertThat(results).extracting(DistanceAnnotatedRecord::name)
                .containsExactly("Canal Saint-Martin bed", "Bastille hostel bunk");
    }

    @Test
    void nearPlaceOnlyLooksAtPlacesInTheSameCity() {
        assertThat(service.recommendNearPlace("Rome", PlaceQuery.byName("Eiffel Tower"), null, null, null, 5))
                .isEmpty();
    }

    @Test
    void attractionsNearListingUseWalkingDefaults() {
        List<DistanceAnnotatedRecord> results =
                service.attractionsNearListing("Paris", "Cozy studio near Louvre", null, null);

        assertThat(results).extracting(DistanceAnnotatedRecord::name)
                .containsExactly("Louvre Museum", "Musee d'Orsay", "Notre-Dame Cathedral");
        assertThat(results).allSatisfy(r -> assertThat(r.distanceKm()).isLessThanOrEqualTo(2.0));
    }

    @Test
    void attractionsNearUnknownListingIsEmpty() {
        assertThat(service.attractionsNearListing("Paris", "Nowhere inn", 5.0, 3)).isEmpty();
    }

    @Test
    void topAttractionsByRatingThenReviews() {
        assertThat(names(service.topAttractions("Paris", 3)))
                .containsExactly("Sacre-Coeur Basilica", "Musee d'Orsay", "Eiffel Tower");
    }

    @Test
    void unknownCityIsEmptyNotAnError() {
        assertThat(service.recommendDefault("Lisbon", 5)).isEmpty();
        assertThat(service.recommendWithPreferences("Lisbon", Map.of("price", 10), "price", 5)).isEmpty();
        assertThat(service.topAttractions("Lisbon", 5)).isEmpty();
    }

    @Test
    void blankCityIsRejected() {
        assertThatThrownBy(() -> service.recommendDefault(" ", 5)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> service.topAttractions(null, 5)).isInstanceOf(ValidationException.class);
    }
}
