package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Live toggle of the aspect-ratio lock")
public record AspectLockRequest(
        @Schema(description = "Lock the selection to the source image ratio", example = "true") @NotNull Boolean forceOriginalRatio) {
}
