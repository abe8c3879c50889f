package com.example.interactivecrop.interaction;

import com.example.interactivecrop.geometry.ScreenPoint;

public record PointerInput(ScreenPoint position, int buttons) {

    public static final int PRIMARY_BUTTON = 1;

    public static PointerInput at(double x, double y, int buttons) {
        return new PointerInput(new ScreenPoint(x, y), buttons);
    }

    public boolean hasPrimaryButton() {
        return buttons != 0 && (buttons & PRIMARY_BUTTON) == PRIMARY_BUTTON;
    }
}
