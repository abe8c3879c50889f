package com.example.interactivecrop.geometry;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Centre of a resize handle")
public record HandlePoint(
        @Schema(description = "Handle role", example = "se") Handle handle,
        @Schema(example = "300") double x,
        @Schema(example = "300") double y) {
}
