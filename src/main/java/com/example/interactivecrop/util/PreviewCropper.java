package com.example.interactivecrop.util;

import com.example.interactivecrop.service.session.CropBounds;
import java.awt.image.BufferedImage;

public final class PreviewCropper {

    private PreviewCropper() {
    }

    /**
     * Crops {@code source} to {@code bounds}, given in pixels of an image of
     * {@code imageWidth x imageHeight}. Bounds are rescaled when the preview was delivered at a
     * different size.
     */
    public static BufferedImage crop(BufferedImage source, CropBounds bounds, double imageWidth, double imageHeight) {
        if (source == null) {
            throw new IllegalArgumentException("Preview image cannot be null");
        }
        double scaleX = imageWidth > 0 ? source.getWidth() / imageWidth : 1;
        double scaleY = imageHeight > 0 ? source.getHeight() / imageHeight : 1;

        int x = clamp((int) Math.round(bounds.x0() * scaleX), 0, source.getWidth() - 1);
        int y = clamp((int) Math.round(bounds.y0() * scaleY), 0, source.getHeight() - 1);
        int width = clamp((int) Math.round(bounds.width() * scaleX), 1, source.getWidth() - x);
        int height = clamp((int) Math.round(bounds.height() * scaleY), 1, source.getHeight() - y);
        return source.getSubimage(x, y, width, height);
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
