package com.strollie.planner.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "PreferenceRequest", description = "Listing search with field filters and a sort key")
public class PreferenceRequest {
    @NotBlank
    @Schema(description = "City", example = "Paris")
    private String city;
    @Schema(description = "Field filters: substring match on text, equality otherwise", example = "{\"room_type\": \"entire\"}")
    private Map<String, Object> filters;
    @Schema(description = "Sort field; price and distance fields sort ascending, others descending", example = "price")
    private String sortBy;
    @Min(0)
    @Schema(description = "Maximum number of results", example = "5")
    private Integer topN;
}
