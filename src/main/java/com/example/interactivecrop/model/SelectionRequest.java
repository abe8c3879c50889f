package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Selection state of the host element")
public record SelectionRequest(
        @Schema(description = "Whether the element owning the crop is selected", example = "true") @NotNull Boolean selected) {
}
