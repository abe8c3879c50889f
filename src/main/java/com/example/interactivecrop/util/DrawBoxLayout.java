package com.example.interactivecrop.util;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.geometry.RectGeometry;

public final class DrawBoxLayout {

    private DrawBoxLayout() {
    }

    public static PreviewLayout fit(double width, double height, double contentTop,
                                    double imageWidth, double imageHeight, CropProperties.Layout layout) {
        double padding = layout.padding();
        double availableWidth = Math.max(0, width - 2 * padding);
        double maxHeight = RectGeometry.clamp(height - contentTop - layout.textReserve(),
                layout.minPreviewHeight(), layout.maxPreviewHeight());

        double aspect = imageHeight > 0 ? imageWidth / imageHeight : 1;
        if (aspect <= 0) {
            aspect = 1;
        }

        double drawWidth = availableWidth;
        double drawHeight = Math.round(drawWidth / aspect);
        if (drawHeight > maxHeight) {
            drawHeight = maxHeight;
            drawWidth = Math.round(drawHeight * aspect);
        }

        double drawX = padding + Math.round((availableWidth - drawWidth) / 2);
        DrawBox drawBox = new DrawBox(drawX, contentTop, drawWidth, drawHeight);
        double scale = imageWidth > 0 ? drawWidth / imageWidth : 1;
        return new PreviewLayout(drawBox, scale);
    }

    public static PreviewLayout of(DrawBox drawBox, double imageWidth) {
        double scale = imageWidth > 0 ? drawBox.w() / imageWidth : 1;
        return new PreviewLayout(drawBox, scale);
    }
}
