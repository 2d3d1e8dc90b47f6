package com.strollie.planner.web.error;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(name = "ErrorResponse", description = "Standard API error body")
public class ErrorResponse {
    @Schema(description = "Timestamp", example = "2025-12-02T12:00:00Z")
    private OffsetDateTime timestamp;
    @Schema(description = "HTTP status", example = "400")
    private int status;
    @Schema(description = "Status reason", example = "Bad Request")
    private String error;
    @Schema(description = "Error message", example = "Validation failed")
    private String message;
    @Schema(description = "Request path", example = "uri=/api/recommendations/preferences")
    private String path;
    @Schema(description = "Field violations")
    private List<Violation> violations;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Schema(name = "Violation", description = "Error on a single field")
    public static class Violation {
        @Schema(description = "Field", example = "city")
        private String field;
        @Schema(description = "Message", example = "must not be blank")
        private String message;
    }
}
