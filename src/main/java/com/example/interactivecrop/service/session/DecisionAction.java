package com.example.interactivecrop.service.session;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DecisionAction {
    CONTINUE,
    // also accepted as "skip"
    PASSTHROUGH,
    CANCEL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static DecisionAction fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision action is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("SKIP".equals(normalized)) {
            return PASSTHROUGH;
        }
        return DecisionAction.valueOf(normalized);
    }
}
