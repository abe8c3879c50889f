package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Global signal that any live drag must end")
public record ReleaseRequest(
        @Schema(description = "Window-level event that triggered the release", example = "POINTER_UP") ReleaseReason reason) {

    public enum ReleaseReason {
        POINTER_UP,
        MOUSE_UP,
        POINTER_CANCEL,
        BLUR
    }
}
