package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Instant;

@Schema(description = "Error payload returned by all endpoints")
public record ErrorResponse(
        @Schema(description = "When the error occurred") Instant timestamp,
        @Schema(description = "HTTP status code", example = "404") int status,
        @Schema(description = "HTTP reason phrase", example = "Not Found") String error,
        @Schema(description = "Error detail", example = "No crop session for target 7") String message,
        @Schema(description = "Request path", example = "/api/v1/crop-sessions/7/frame") String path) {
}
