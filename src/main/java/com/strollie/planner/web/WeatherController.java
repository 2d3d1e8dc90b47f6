package com.strollie.planner.web;

import com.strollie.planner.client.WeatherApiClient;
import com.strollie.planner.model.WeatherReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/weather")
@Tag(name = "Weather", description = "Cached and retried OpenWeather lookups")
public class WeatherController {

    private final WeatherApiClient weatherApiClient;

    @GetMapping
    @Operation(summary = "Current weather in a city")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current conditions"),
            @ApiResponse(responseCode = "400", description = "Unknown or missing city"),
            @ApiResponse(responseCode = "502", description = "Weather provider unavailable after retries")
    })
    public WeatherReport current(@RequestParam String city) {
        return weatherApiClient.currentWeather(city);
    }

    @GetMapping("/forecast")
    @Operation(summary = "Average forecast for one day")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Daily average"),
            @ApiResponse(responseCode = "404", description = "No forecast slots for that day")
    })
    public ResponseEntity<WeatherReport> forecast(
            @RequestParam String city,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.of(weatherApiClient.forecast(city, date));
    }
}
