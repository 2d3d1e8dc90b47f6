package com.strollie.planner.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "WeatherReport", description = "Current conditions or a daily average for a city")
public class WeatherReport {
    @Schema(description = "City as reported by the provider", example = "Paris")
    private String city;
    @Schema(description = "Day the report covers", example = "2025-06-01")
    private LocalDate date;
    @Schema(description = "Temperature, °C", example = "21.4")
    private Double tempC;
    @Schema(description = "Feels-like temperature, °C", example = "20.9")
    private Double feelsLikeC;
    @Schema(description = "Condition", example = "scattered clouds")
    private String weather;
    @Schema(description = "Relative humidity, %", example = "54")
    private Double humidity;
    @Schema(description = "Wind speed, m/s", example = "3.6")
    private Double wind;
}
