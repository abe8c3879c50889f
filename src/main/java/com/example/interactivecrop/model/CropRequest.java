package com.example.interactivecrop.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Crop request raised by a paused computation step")
public record CropRequest(
        @Schema(description = "Identifier of the paused run", example = "run-42") String requestId,
        @Schema(description = "Identifier of the element that owns the crop", example = "7") String targetId,
        @Schema(description = "Preview image to crop") ImageRef image,
        @Schema(description = "Source image width in pixels", example = "800") Integer width,
        @Schema(description = "Source image height in pixels", example = "600") Integer height,
        @Schema(description = "Lock the selection to the source image aspect ratio", example = "false") boolean forceOriginalRatio) {

    @JsonIgnore
    public boolean isComplete() {
        return hasText(requestId)
                && hasText(targetId)
                && image != null
                && hasText(image.filename())
                && width != null && width > 0
                && height != null && height > 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
