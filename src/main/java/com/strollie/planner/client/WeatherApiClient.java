package com.strollie.planner.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strollie.planner.config.ApiKeysConfig;
import com.strollie.planner.engine.resilience.CallArguments;
import com.strollie.planner.engine.resilience.ResilientCall;
import com.strollie.planner.engine.resilience.ResilientCalls;
import com.strollie.planner.engine.resilience.RetryPolicy;
import com.strollie.planner.error.ConfigurationException;
import com.strollie.planner.error.TransientFetchException;
import com.strollie.planner.error.ValidationException;
import com.strollie.planner.model.WeatherReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.Exceptions;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * OpenWeather client. Both lookups go through a resilient call, so repeated questions about the
 * same city within the cache TTL cost one upstream request.
 */
@Slf4j
@Component
public class WeatherApiClient {

    static final String CURRENT_OPERATION = "weather.current";
    static final String FORECAST_OPERATION = "weather.forecast";

    private static final String CURRENT_ENDPOINT = "/data/2.5/weather";
    private static final String FORECAST_ENDPOINT = "/data/2.5/forecast";

    private final WebClient webClient;
    private final ApiKeysConfig config;
    private final ObjectMapper mapper;
    private final ResilientCall<WeatherReport> currentWeather;
    private final ResilientCall<Optional<WeatherReport>> dailyForecast;

    public WeatherApiClient(WebClient webClient,
                            ApiKeysConfig config,
                            ObjectMapper mapper,
                            ResilientCalls resilientCalls,
                            RetryPolicy retryPolicy) {
        this.webClient = webClient;
        this.config = config;
        this.mapper = mapper;
        this.currentWeather = resilientCalls.resilient(CURRENT_OPERATION, retryPolicy).wrap(this::fetchCurrent);
        this.dailyForecast = resilientCalls.resilient(FORECAST_OPERATION, retryPolicy).wrap(this::fetchForecast);
    }

    public WeatherReport currentWeather(String city) {
        return currentWeather.invoke(CallArguments.of("city", normalizeCity(city)));
    }

    /**
     * Average conditions for {@code date}. Empty when the provider has no 3-hour slots for that day
     * (the free forecast covers five days ahead).
     */
    public Optional<WeatherReport> forecast(String city, LocalDate date) {
        if (date == null) {
            throw new ValidationException("Forecast date is required");
        }
        return dailyForecast.invoke(CallArguments.of("city", normalizeCity(city), "date", date));
    }

    /**
     * Worst-case blocking time of one lookup, for callers sizing their own deadline.
     */
    public Duration latencyCeiling() {
        return currentWeather.policy().worstCaseLatency(timeout());
    }

    WeatherReport fetchCurrent(CallArguments args) {
        String city = args.getString("city");
        JsonNode root = get(CURRENT_ENDPOINT, city);

        JsonNode main = root.path("main");
        long epochSeconds = root.path("dt").asLong(Instant.now().getEpochSecond());
        return WeatherReport.builder()
                .city(root.path("name").asText(city))
                .date(LocalDate.ofInstant(Instant.ofEpochSecond(epochSeconds), ZoneOffset.UTC))
                .tempC(number(main.path("temp")))
                .feelsLikeC(number(main.path("feels_like")))
                .weather(root.path("weather").path(0).path("description").asText(null))
                .humidity(number(main.path("humidity")))
                .wind(number(root.path("wind").path("speed")))
                .build();
    }

    Optional<WeatherReport> fetchForecast(CallArguments args) {
        String city = args.getString("city");
        LocalDate date = parseDate(args.getString("date"));
        JsonNode root = get(FORECAST_ENDPOINT, city);

        List<JsonNode> slots = new ArrayList<>();
        for (JsonNode slot : root.path("list")) {
            LocalDate slotDate = LocalDate.ofInstant(Instant.ofEpochSecond(slot.path("dt").asLong()), ZoneOffset.UTC);
            if (slotDate.equals(date)) {
                slots.add(slot);
            }
        }

        if (slots.isEmpty()) {
            log.warn("No forecast data available for {} on {}", city, date);
            return Optional.empty();
        }

        return Optional.of(WeatherReport.builder()
                .city(root.path("city").path("name").asText(city))
                .date(date)
                .tempC(average(slots, "main", "temp"))
                .feelsLikeC(average(slots, "main", "feels_like"))
                .weather(mostCommonCondition(slots))
                .humidity(average(slots, "main", "humidity"))
                .wind(average(slots, "wind", "speed"))
                .build());
    }

    private JsonNode get(String endpoint, String city) {
        String key = apiKey();
        if (key.isEmpty()) {
            throw new ConfigurationException("Weather API key is not configured");
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getWeather().getBaseUrl())
                .path(endpoint)
                .queryParam("q", city)
                .queryParam("appid", key)
                .queryParam("units", "metric")
                .queryParam("lang", "en")
                .build()
                .encode()
                .toUri();

        log.info(">>> REQUEST: {}", sanitizeUrl(uri.toString()));

        String responseBody;
        try {
            responseBody = webClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout())
                    .block();
        } catch (WebClientResponseException e) {
            throw classify(e, city);
        } catch (WebClientRequestException e) {
            throw new TransientFetchException("Weather API unreachable: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new TransientFetchException("Weather API timed out after " + timeout().toMillis() + " ms", e);
            }
            throw e;
        }

        if (responseBody == null || responseBody.isBlank()) {
            throw new TransientFetchException("Weather API returned an empty body for " + city);
        }

        try {
            return mapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new TransientFetchException("Weather API returned malformed JSON for " + city, e);
        }
    }

    private RuntimeException classify(WebClientResponseException e, String city) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        log.warn("Weather API responded {} for city '{}'", e.getStatusCode().value(), city);

        if (e.getStatusCode().is5xxServerError() || status == HttpStatus.TOO_MANY_REQUESTS) {
            return new TransientFetchException("Weather API responded " + e.getStatusCode().value(), e);
        }
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            return new ConfigurationException("Weather API rejected the configured key");
        }
        if (status == HttpStatus.NOT_FOUND) {
            return new ValidationException("Unknown city: " + city, e);
        }
        return new ValidationException("Weather API rejected the request: " + e.getStatusCode().value(), e);
    }

    private String normalizeCity(String city) {
        if (city == null || city.isBlank()) {
            throw new ValidationException("City required");
        }
        return city.trim().toLowerCase(Locale.ROOT);
    }

    private LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date format: " + text, e);
        }
    }

    private Double number(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    private Double average(List<JsonNode> slots, String group, String field) {
        return slots.stream()
                .map(s -> s.path(group).path(field))
                .filter(JsonNode::isNumber)
                .mapToDouble(JsonNode::asDouble)
                .average()
                .stream()
                .mapToObj(avg -> Math.round(avg * 10) / 10.0)
                .findFirst()
                .orElse(null);
    }

    private String mostCommonCondition(List<JsonNode> slots) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (JsonNode slot : slots) {
            String description = slot.path("weather").path(0).path("description").asText(null);
            if (description != null) {
                counts.merge(description, 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private Duration timeout() {
        int millis = config.getWeather().getTimeout();
        return Duration.ofMillis(millis > 0 ? millis : 10000);
    }

    private String sanitizeUrl(String url) {
        return url == null ? null : url.replaceAll("(appid=)[^&]+", "$1***");
    }

    private String apiKey() {
        return Optional.ofNullable(config.getWeather())
                .map(ApiKeysConfig.Weather::getKey)
                .map(String::trim)
                .orElse("");
    }

}
