package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of a forwarded pointer event")
public record PointerResponse(
        @Schema(description = "Whether the crop overlay consumed the event; the host handles it otherwise") boolean claimed,
        @Schema(description = "Overlay state after the event") RenderFrame frame) {
}
