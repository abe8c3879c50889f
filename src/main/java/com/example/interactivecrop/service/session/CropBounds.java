package com.example.interactivecrop.service.session;

import com.example.interactivecrop.geometry.Rect;
import io.swagger.v3.oas.annotations.media.Schema;

// (x0, y0) inclusive, (x1, y1) exclusive
@Schema(description = "Crop bounds sent with a continue decision")
public record CropBounds(
        @Schema(example = "100") int x0,
        @Schema(example = "100") int y0,
        @Schema(example = "300") int x1,
        @Schema(example = "300") int y1) {

    public static CropBounds of(Rect rect) {
        return new CropBounds(
                (int) Math.round(rect.x()),
                (int) Math.round(rect.y()),
                (int) Math.round(rect.x() + rect.w()),
                (int) Math.round(rect.y() + rect.h()));
    }

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }
}
