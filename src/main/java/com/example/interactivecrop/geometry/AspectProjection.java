package com.example.interactivecrop.geometry;

/**
 * Projects a cursor onto the nearest point that, together with a fixed anchor, spans a rectangle
 * of the requested width/height ratio inside {@code [0, boxW] x [0, boxH]}.
 *
 * <p>The projection keeps the tighter of the two axis-driven candidates, clamps the endpoint into
 * the box, and then re-derives one axis from the other. The independent clamp can break the
 * ratio; the second pass restores it, possibly shrinking the rectangle further. The anchor is
 * expected to lie inside the box.</p>
 */
public final class AspectProjection {

    static final double EPSILON = 0.0001;

    private AspectProjection() {
    }

    public static ImagePoint project(ImagePoint anchor, ImagePoint cursor, double ratio, double boxW, double boxH) {
        double ax = anchor.x();
        double ay = anchor.y();
        double dx = cursor.x() - ax;
        double dy = cursor.y() - ay;

        double sx = signOf(dx);
        double sy = signOf(dy);
        double absDx = Math.abs(dx);
        double absDy = Math.abs(dy);

        double candH = absDx / ratio;
        double candW = absDy * ratio;

        double endX;
        double endY;
        if (candH <= absDy) {
            endX = ax + sx * absDx;
            endY = ay + sy * candH;
        } else {
            endX = ax + sx * candW;
            endY = ay + sy * absDy;
        }

        endX = RectGeometry.clamp(endX, 0, boxW);
        endY = RectGeometry.clamp(endY, 0, boxH);

        double ndx = endX - ax;
        double ndy = endY - ay;
        if (Math.abs(ndx) > EPSILON) {
            double targetY = ay + (Math.abs(ndx) / ratio) * signOf(ndy);
            endY = RectGeometry.clamp(targetY, 0, boxH);
            if (endY != targetY) {
                // both axes hit the box: pull the driving axis back onto the ratio
                endX = ax + Math.abs(endY - ay) * ratio * signOf(ndx);
            }
        } else {
            double targetX = ax + (Math.abs(ndy) * ratio) * signOf(ndx);
            endX = RectGeometry.clamp(targetX, 0, boxW);
            if (endX != targetX) {
                endY = ay + (Math.abs(endX - ax) / ratio) * signOf(ndy);
            }
        }
        return new ImagePoint(endX, endY);
    }

    private static double signOf(double value) {
        return value >= 0 ? 1 : -1;
    }
}
