package com.strollie.planner.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "RecommendationResponse", description = "Ordered recommendations")
public class RecommendationResponse<T> {

    @Schema(description = "Ranking mode", example = "default")
    private String mode;

    @Schema(description = "City", example = "Paris")
    private String city;

    @Schema(description = "Number of results", example = "3")
    private int count;

    @Schema(description = "Results, best first")
    private List<T> results;

    public static <T> RecommendationResponse<T> of(String mode, String city, List<T> results) {
        return RecommendationResponse.<T>builder()
                .mode(mode)
                .city(city)
                .count(results.size())
                .results(results)
                .build();
    }
}
