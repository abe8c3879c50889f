package com.example.interactivecrop.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Location of the preview image on the remote image endpoint")
public record ImageRef(
        @Schema(description = "File name of the stored preview", example = "crop_42_7_5f1c.png") String filename,
        @Schema(description = "Storage folder type", example = "temp") String type,
        @Schema(description = "Sub folder inside the storage folder", example = "") String subfolder) {
}
