package com.example.interactivecrop.model;

import com.example.interactivecrop.service.session.DecisionAction;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "User decision for a crop session")
public record DecisionRequest(
        @Schema(description = "continue crops to the selection, passthrough skips, cancel stops the run",
                example = "continue", allowableValues = {"continue", "passthrough", "cancel"})
        @NotNull DecisionAction action) {
}
