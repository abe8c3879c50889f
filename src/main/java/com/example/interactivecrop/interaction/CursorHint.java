package com.example.interactivecrop.interaction;

import com.example.interactivecrop.geometry.Handle;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CursorHint {
    NONE(""),
    CROSSHAIR("crosshair"),
    MOVE("move"),
    NWSE_RESIZE("nwse-resize"),
    NESW_RESIZE("nesw-resize"),
    NS_RESIZE("ns-resize"),
    EW_RESIZE("ew-resize");

    private final String css;

    CursorHint(String css) {
        this.css = css;
    }

    @JsonValue
    public String css() {
        return css;
    }

    public static CursorHint forHandle(Handle handle) {
        switch (handle) {
            case NW:
            case SE:
                return NWSE_RESIZE;
            case NE:
            case SW:
                return NESW_RESIZE;
            case N:
            case S:
                return NS_RESIZE;
            default:
                return EW_RESIZE;
        }
    }
}
