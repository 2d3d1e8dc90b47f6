package com.strollie.planner.web;

import com.strollie.planner.engine.geo.GeoPoint;
import com.strollie.planner.engine.geo.PlaceQuery;
import com.strollie.planner.model.DistanceAnnotatedRecord;
import com.strollie.planner.model.NearPlaceRequest;
import com.strollie.planner.model.PreferenceRequest;
import com.strollie.planner.model.RecommendationResponse;
import com.strollie.planner.model.TravelRecord;
import com.strollie.planner.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
@Tag(name = "Recommendations", description = "Lodging and attraction ranking")
public class RecommendationController {

    private final RecommendationService recommendationService;

    @GetMapping("/recommendations/default")
    @Operation(summary = "Default lodging ranking",
            description = "Rating, reputation, cleanliness and walk score first, then distance to center and metro")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Ranked listings, possibly empty"),
            @ApiResponse(responseCode = "400", description = "Missing city or negative topN")
    })
    public RecommendationResponse<TravelRecord> recommendDefault(
            @Parameter(description = "City", example = "Paris") @RequestParam String city,
            @Parameter(description = "Maximum number of results") @RequestParam(required = false) Integer topN) {
        List<TravelRecord> results = recommendationService.recommendDefault(city, topN);
        return RecommendationResponse.of("default", city, results);
    }

    @PostMapping("/recommendations/preferences")
    @Operation(summary = "Lodging filtered by preferences",
            description = "Unknown filter fields are ignored; sort direction depends on the field")
    public RecommendationResponse<TravelRecord> recommendWithPreferences(@Valid @RequestBody PreferenceRequest request) {
        List<TravelRecord> results = recommendationService.recommendWithPreferences(
                request.getCity(), request.getFilters(), request.getSortBy(), request.getTopN());
        return RecommendationResponse.of("preferences", request.getCity(), results);
    }

    @PostMapping("/recommendations/near-place")
    @Operation(summary = "Lodging near an attraction or coordinates",
            description = "An unknown attraction name yields an empty result")
    public RecommendationResponse<DistanceAnnotatedRecord> recommendNearPlace(@Valid @RequestBody NearPlaceRequest request) {
        GeoPoint point = request.getPoint() == null ? null
                : new GeoPoint(request.getPoint().getLat(), request.getPoint().getLon());
        PlaceQuery target = new PlaceQuery(request.getPlaceName(), point);

        List<DistanceAnnotatedRecord> results = recommendationService.recommendNearPlace(
                request.getCity(), target, request.getMaxDistanceKm(),
                request.getFilters(), request.getSortBy(), request.getTopN());
        return RecommendationResponse.of("near-place", request.getCity(), results);
    }

    @GetMapping("/recommendations/attractions-near-listing")
    @Operation(summary = "Attractions within walking distance of a listing")
    public RecommendationResponse<DistanceAnnotatedRecord> attractionsNearListing(
            @RequestParam String city,
            @RequestParam String listing,
            @RequestParam(required = false) Double maxDistanceKm,
            @RequestParam(required = false) Integer limit) {
        List<DistanceAnnotatedRecord> results =
                recommendationService.attractionsNearListing(city, listing, maxDistanceKm, limit);
        return RecommendationResponse.of("attractions-near-listing", city, results);
    }

    @GetMapping("/attractions/top")
    @Operation(summary = "Best rated attractions in a city")
    public RecommendationResponse<TravelRecord> topAttractions(
            @RequestParam String city,
            @RequestParam(required = false) Integer topN) {
        return RecommendationResponse.of("top-attractions", city, recommendationService.topAttractions(city, topN));
    }

}
