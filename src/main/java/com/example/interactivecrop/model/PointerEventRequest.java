package com.example.interactivecrop.model;

import com.example.interactivecrop.interaction.PointerInput;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

@Schema(description = "Pointer event forwarded by the host")
public record PointerEventRequest(
        @Schema(description = "Event phase", example = "DOWN") @NotNull PointerPhase phase,
        @Schema(description = "Pointer X in display units", example = "240") @NotNull Double x,
        @Schema(description = "Pointer Y in display units", example = "180") @NotNull Double y,
        @Schema(description = "DOM buttons bitmask; 1 means the primary button is held", example = "1") Integer buttons) {

    public PointerInput toInput() {
        return PointerInput.at(x, y, buttons == null ? 0 : buttons);
    }

    public enum PointerPhase {
        DOWN,
        MOVE,
        UP
    }
}
