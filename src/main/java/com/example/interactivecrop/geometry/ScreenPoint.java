package com.example.interactivecrop.geometry;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Position in display space")
public record ScreenPoint(
        @Schema(example = "240") double x,
        @Schema(example = "180") double y) {
}
