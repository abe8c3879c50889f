package com.example.interactivecrop.geometry;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Display-space rectangle where the image is currently painted")
public record DrawBox(
        @Schema(description = "Left edge in display units", example = "8") double x,
        @Schema(description = "Top edge in display units", example = "120") double y,
        @Schema(description = "Painted width in display units", example = "400") double w,
        @Schema(description = "Painted height in display units", example = "300") double h) {

    public boolean contains(ScreenPoint point) {
        return point.x() >= x && point.x() <= x + w && point.y() >= y && point.y() <= y + h;
    }
}
