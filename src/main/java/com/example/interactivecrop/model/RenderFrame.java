package com.example.interactivecrop.model;

import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.geometry.HandlePoint;
import com.example.interactivecrop.geometry.Rect;
import com.example.interactivecrop.interaction.CursorHint;
import com.example.interactivecrop.interaction.DragMode;
import com.example.interactivecrop.service.session.SessionState;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Overlay state to paint for a crop session")
public record RenderFrame(
        @Schema(description = "Element owning the crop", example = "7") String targetId,
        @Schema(description = "Paused run the crop belongs to", example = "run-42") String requestId,
        @Schema(description = "Decision lifecycle state", example = "ACTIVE") SessionState state,
        @Schema(description = "Whether pointer editing and the Apply/Cancel buttons are enabled") boolean interactive,
        @Schema(description = "Current preview width in pixels", example = "800") int imageWidth,
        @Schema(description = "Current preview height in pixels", example = "600") int imageHeight,
        @Schema(description = "Whether the aspect-ratio lock is on") boolean forceOriginalRatio,
        @Schema(description = "Where the image is painted, or null before the first layout") DrawBox drawBox,
        @Schema(description = "Display units per image pixel", example = "0.5") double scale,
        @Schema(description = "Selection in image pixels, or null") Rect selection,
        @Schema(description = "Selection in display units, or null") Rect selectionOnScreen,
        @ArraySchema(arraySchema = @Schema(description = "Resize handles in display units"),
                schema = @Schema(implementation = HandlePoint.class))
        List<HandlePoint> handles,
        @Schema(description = "CSS cursor to show", example = "crosshair") CursorHint cursor,
        @Schema(description = "Current drag mode", example = "none") DragMode dragMode) {
}
