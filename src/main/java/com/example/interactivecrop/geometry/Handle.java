package com.example.interactivecrop.geometry;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Handle {
    NW("nw"),
    N("n"),
    NE("ne"),
    E("e"),
    SE("se"),
    S("s"),
    SW("sw"),
    W("w");

    private final String key;

    Handle(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isCorner() {
        return key.length() == 2;
    }

    public boolean movesLeftEdge() {
        return key.indexOf('w') >= 0;
    }

    public boolean movesRightEdge() {
        return key.indexOf('e') >= 0;
    }

    public boolean movesTopEdge() {
        return key.indexOf('n') >= 0;
    }

    public boolean movesBottomEdge() {
        return key.indexOf('s') >= 0;
    }
}
