package com.strollie.planner.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI plannerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Travel Planner API")
                        .description("Lodging and attraction recommendations, proximity search and weather lookups")
                        .version("v1")
                        .license(new License().name("MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Local")));
    }

    @Bean
    public GroupedOpenApi recommendationsGroup() {
        return GroupedOpenApi.builder()
                .group("recommendations")
                .packagesToScan("com.strollie.planner.web")
                .pathsToMatch("/api/recommendations/**", "/api/attractions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi infrastructureGroup() {
        return GroupedOpenApi.builder()
                .group("infrastructure")
                .packagesToScan("com.strollie.planner.web")
                .pathsToMatch("/api/weather/**", "/api/cache/**")
                .build();
    }
}
