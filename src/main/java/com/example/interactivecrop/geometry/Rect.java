package com.example.interactivecrop.geometry;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Axis-aligned rectangle with its origin in the top-left corner")
public record Rect(
        @Schema(description = "X coordinate of the top-left corner", example = "100") double x,
        @Schema(description = "Y coordinate of the top-left corner", example = "100") double y,
        @Schema(description = "Rectangle width", example = "200") double w,
        @Schema(description = "Rectangle height", example = "200") double h) {

    public static Rect spanning(double x0, double y0, double x1, double y1) {
        return new Rect(Math.min(x0, x1), Math.min(y0, y1), Math.abs(x1 - x0), Math.abs(y1 - y0));
    }

    public double right() {
        return x + w;
    }

    public double bottom() {
        return y + h;
    }

    public boolean contains(double px, double py) {
        return px >= x && px <= x + w && py >= y && py <= y + h;
    }

    public Rect withOrigin(double newX, double newY) {
        return new Rect(newX, newY, w, h);
    }

    public Rect scaled(double factor) {
        return new Rect(x * factor, y * factor, w * factor, h * factor);
    }

    public Rect translated(double dx, double dy) {
        return new Rect(x + dx, y + dy, w, h);
    }
}
