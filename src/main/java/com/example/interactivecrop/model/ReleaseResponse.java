package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a global drag release")
public record ReleaseResponse(
        @Schema(description = "Whether a live drag was ended") boolean released,
        @Schema(description = "Element whose drag was ended, if any", example = "7") String releasedTargetId) {
}
