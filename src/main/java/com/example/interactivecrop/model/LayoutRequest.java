package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@Schema(description = "Area of the host element available for the preview")
public record LayoutRequest(
        @Schema(description = "Element width in display units", example = "416") @NotNull @PositiveOrZero Double width,
        @Schema(description = "Element height in display units", example = "520") @NotNull @PositiveOrZero Double height,
        @Schema(description = "Offset of the preview area from the element top", example = "120") @NotNull @PositiveOrZero Double contentTop) {
}
