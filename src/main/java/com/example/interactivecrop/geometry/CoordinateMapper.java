package com.example.interactivecrop.geometry;

/**
 * Converts between display space and image space. This is the only place where a
 * {@link ScreenPoint} becomes an {@link ImagePoint}; everything else works in one space only.
 *
 * <p>The scale is the uniform factor {@code drawW / imgW} supplied by the host together with the
 * {@link DrawBox}. A non-positive scale (no layout yet) is treated as 1.</p>
 */
public final class CoordinateMapper {

    private CoordinateMapper() {
    }

    public static boolean isOverDrawBox(ScreenPoint pointer, DrawBox drawBox) {
        return drawBox != null && drawBox.contains(pointer);
    }

    /**
     * Position of {@code pointer} relative to the draw box origin, clamped into the draw box.
     * Handle and interior hit tests run against this point so hit boxes keep their on-screen
     * size at every zoom level.
     */
    public static ScreenPoint toDrawLocal(ScreenPoint pointer, DrawBox drawBox) {
        double localX = RectGeometry.clamp(pointer.x() - drawBox.x(), 0, drawBox.w());
        double localY = RectGeometry.clamp(pointer.y() - drawBox.y(), 0, drawBox.h());
        return new ScreenPoint(localX, localY);
    }

    /**
     * Maps a pointer position to image pixels. Pointers reported outside the draw box, as happens
     * during fast drags, land on the nearest image edge.
     */
    public static ImagePoint toImageSpace(ScreenPoint pointer, DrawBox drawBox, double scale) {
        ScreenPoint local = toDrawLocal(pointer, drawBox);
        double effectiveScale = effective(scale);
        return new ImagePoint(local.x() / effectiveScale, local.y() / effectiveScale);
    }

    public static Rect toDisplay(Rect imageRect, double scale) {
        return imageRect.scaled(effective(scale));
    }

    public static Rect toScreen(Rect imageRect, DrawBox drawBox, double scale) {
        return toDisplay(imageRect, scale).translated(drawBox.x(), drawBox.y());
    }

    private static double effective(double scale) {
        return scale > 0 ? scale : 1;
    }
}
