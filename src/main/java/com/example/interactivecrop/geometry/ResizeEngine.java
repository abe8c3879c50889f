package com.example.interactivecrop.geometry;

/**
 * Computes the rectangle produced by dragging one {@link Handle} to a cursor position. All values
 * are in image pixels.
 *
 * <p>Edge handles always move a single edge, even with the aspect lock on. Corner handles either
 * move both adjacent edges, or, when locked, keep the opposite corner fixed and project the cursor
 * through {@link AspectProjection} with ratio {@code imgW / imgH}.</p>
 */
public final class ResizeEngine {

    private static final double MIN_SIZE = RectGeometry.DEFAULT_MIN_SIZE;

    private ResizeEngine() {
    }

    public static Rect resize(Rect rect, Handle handle, ImagePoint cursor, double imgW, double imgH, boolean aspectLocked) {
        Rect base = RectGeometry.normalize(rect);
        double left = base.x();
        double top = base.y();
        double right = base.right();
        double bottom = base.bottom();

        double x0 = left;
        double y0 = top;
        double x1 = right;
        double y1 = bottom;

        if (aspectLocked && handle.isCorner()) {
            ImagePoint anchor = new ImagePoint(
                    handle.movesLeftEdge() ? right : left,
                    handle.movesTopEdge() ? bottom : top);
            ImagePoint end = AspectProjection.project(anchor, cursor, imgW / imgH, imgW, imgH);
            x0 = Math.min(anchor.x(), end.x());
            y0 = Math.min(anchor.y(), end.y());
            x1 = Math.max(anchor.x(), end.x());
            y1 = Math.max(anchor.y(), end.y());
        } else {
            if (handle.movesLeftEdge()) {
                x0 = cursor.x();
            }
            if (handle.movesRightEdge()) {
                x1 = cursor.x();
            }
            if (handle.movesTopEdge()) {
                y0 = cursor.y();
            }
            if (handle.movesBottomEdge()) {
                y1 = cursor.y();
            }
        }

        if (x1 - x0 < MIN_SIZE) {
            double mid = (x0 + x1) / 2;
            x0 = mid - MIN_SIZE / 2;
            x1 = mid + MIN_SIZE / 2;
        }
        if (y1 - y0 < MIN_SIZE) {
            double mid = (y0 + y1) / 2;
            y0 = mid - MIN_SIZE / 2;
            y1 = mid + MIN_SIZE / 2;
        }

        return RectGeometry.clampToBox(new Rect(x0, y0, x1 - x0, y1 - y0), imgW, imgH, MIN_SIZE);
    }
}
