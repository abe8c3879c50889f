package com.example.interactivecrop.service.session;

public record CropDecision(String requestId, String targetId, DecisionAction action, CropBounds rect) {

    public static CropDecision crop(String requestId, String targetId, CropBounds rect) {
        return new CropDecision(requestId, targetId, DecisionAction.CONTINUE, rect);
    }

    public static CropDecision passthrough(String requestId, String targetId) {
        return new CropDecision(requestId, targetId, DecisionAction.PASSTHROUGH, null);
    }

    public static CropDecision cancel(String requestId, String targetId) {
        return new CropDecision(requestId, targetId, DecisionAction.CANCEL, null);
    }
}
