package com.example.interactivecrop.geometry;

import java.util.List;
import java.util.Optional;

public final class RectGeometry {

    public static final double DEFAULT_MIN_SIZE = 2;

    // in the units of the rectangle being tested
    public static final double HANDLE_HALF_SIZE = 4;

    private RectGeometry() {
    }

    public static Rect normalize(Rect rect) {
        double x0 = Math.min(rect.x(), rect.x() + rect.w());
        double y0 = Math.min(rect.y(), rect.y() + rect.h());
        double x1 = Math.max(rect.x(), rect.x() + rect.w());
        double y1 = Math.max(rect.y(), rect.y() + rect.h());
        return new Rect(x0, y0, x1 - x0, y1 - y0);
    }

    /**
     * Fits {@code rect} into {@code [0, boxW] x [0, boxH]} with both sides at least
     * {@code minSize}. The result is fully contained whenever the box itself is at least
     * {@code minSize} on each axis.
     */
    public static Rect clampToBox(Rect rect, double boxW, double boxH, double minSize) {
        Rect r = normalize(rect);
        double x = clamp(r.x(), 0, boxW);
        double y = clamp(r.y(), 0, boxH);
        double w = clamp(r.w(), 0, boxW - x);
        double h = clamp(r.h(), 0, boxH - y);
        if (w < minSize) {
            w = minSize;
        }
        if (h < minSize) {
            h = minSize;
        }
        if (x + w > boxW) {
            x = Math.max(0, boxW - w);
        }
        if (y + h > boxH) {
            y = Math.max(0, boxH - h);
        }
        return new Rect(x, y, w, h);
    }

    public static Rect clampToBox(Rect rect, double boxW, double boxH) {
        return clampToBox(rect, boxW, boxH, DEFAULT_MIN_SIZE);
    }

    public static List<HandlePoint> handlesOf(Rect rect) {
        double x = rect.x();
        double y = rect.y();
        double cx = x + rect.w() / 2;
        double cy = y + rect.h() / 2;
        double right = rect.right();
        double bottom = rect.bottom();
        return List.of(
                new HandlePoint(Handle.NW, x, y),
                new HandlePoint(Handle.N, cx, y),
                new HandlePoint(Handle.NE, right, y),
                new HandlePoint(Handle.E, right, cy),
                new HandlePoint(Handle.SE, right, bottom),
                new HandlePoint(Handle.S, cx, bottom),
                new HandlePoint(Handle.SW, x, bottom),
                new HandlePoint(Handle.W, x, cy));
    }

    /**
     * Returns the first handle, in {@link Handle} declaration order, whose 8x8 hit box contains
     * the point. On near-minimum rectangles several boxes overlap and the earlier handle wins.
     */
    public static Optional<Handle> hitTestHandle(double px, double py, Rect rect) {
        for (HandlePoint handle : handlesOf(rect)) {
            if (Math.abs(px - handle.x()) <= HANDLE_HALF_SIZE && Math.abs(py - handle.y()) <= HANDLE_HALF_SIZE) {
                return Optional.of(handle.handle());
            }
        }
        return Optional.empty();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
