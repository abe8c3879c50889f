package com.example.interactivecrop.interaction;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DragMode {
    NONE,
    CREATING,
    MOVING,
    RESIZING;

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
