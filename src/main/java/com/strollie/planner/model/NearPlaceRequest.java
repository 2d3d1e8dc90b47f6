package com.strollie.planner.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "NearPlaceRequest", description = "Listings around a named attraction or explicit coordinates")
public class NearPlaceRequest {
    @NotBlank
    @Schema(description = "City", example = "Paris")
    private String city;
    @Schema(description = "Attraction name, case-insensitive", example = "Eiffel Tower")
    private String placeName;
    @Valid
    @Schema(description = "Explicit coordinates; take precedence over placeName")
    private Point point;
    @PositiveOrZero
    @Schema(description = "Search radius in km; unbounded when omitted", example = "3")
    private Double maxDistanceKm;
    @Schema(description = "Field filters", example = "{\"room_type\": \"private\"}")
    private Map<String, Object> filters;
    @Schema(description = "Sort field", example = "price")
    private String sortBy;
    @Min(0)
    @Schema(description = "Maximum number of results", example = "5")
    private Integer topN;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Point", description = "Coordinates")
    public static class Point {
        @NotNull
        @Schema(description = "Latitude", example = "48.8584")
        private Double lat;
        @NotNull
        @Schema(description = "Longitude", example = "2.2945")
        private Double lon;
    }
}
