package com.example.interactivecrop.model;

import com.example.interactivecrop.service.session.CropBounds;
import com.example.interactivecrop.service.session.CropDecision;
import com.example.interactivecrop.service.session.DecisionAction;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a decision submission")
public record DecisionResponse(
        @Schema(description = "False when the session was not active or had already submitted") boolean accepted,
        @Schema(description = "Action actually sent; continue without a valid selection is sent as passthrough",
                example = "continue") DecisionAction sentAction,
        @Schema(description = "Bounds sent with a continue decision") CropBounds rect,
        @Schema(description = "Overlay state after the submission") RenderFrame frame) {

    public static DecisionResponse sent(CropDecision decision, RenderFrame frame) {
        return new DecisionResponse(true, decision.action(), decision.rect(), frame);
    }

    public static DecisionResponse ignored(RenderFrame frame) {
        return new DecisionResponse(false, null, null, frame);
    }
}
