package com.strollie.planner.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Slf4j
@Configuration
@ConfigurationProperties(prefix = "api")
public class ApiKeysConfig {
    private Weather weather = new Weather();

    @Data
    public static class Weather {
        private String baseUrl = "https://api.openweathermap.org";
        private String key;
        private int timeout = 10000;
    }

    @PostConstruct
    public void validate() {
        log.info("==== Loaded API Configuration ====");
        log.info("Weather:");
        log.info("  baseUrl: {}", weather.getBaseUrl());
        log.info("  key: {}", maskKey(weather.getKey()));
        log.info("  timeout: {}", weather.getTimeout());

        // a missing key only disables the weather endpoints, listings and places still work
        if (weather.getKey() == null || weather.getKey().isBlank()) {
            log.warn("Weather API key is not configured, weather lookups will fail");
        }
    }

    public static String maskKey(String key) {
        if (key == null || key.length() <= 4) return "****";
        return key.substring(0, 4) + "****";
    }

}
