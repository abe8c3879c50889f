package com.example.interactivecrop.interaction;

import com.example.interactivecrop.geometry.Handle;
import com.example.interactivecrop.geometry.ImagePoint;
import com.example.interactivecrop.geometry.Rect;

public class DragSession {

    private DragMode mode = DragMode.NONE;
    private Handle activeHandle;
    private Rect anchorRect;
    private double moveOffsetX;
    private double moveOffsetY;
    private ImagePoint startPoint;

    void startCreating(ImagePoint start) {
        reset();
        mode = DragMode.CREATING;
        startPoint = start;
    }

    void startMoving(double offsetX, double offsetY) {
        reset();
        mode = DragMode.MOVING;
        moveOffsetX = offsetX;
        moveOffsetY = offsetY;
    }

    void startResizing(Handle handle, Rect baseline) {
        reset();
        mode = DragMode.RESIZING;
        activeHandle = handle;
        anchorRect = baseline;
    }

    void reset() {
        mode = DragMode.NONE;
        activeHandle = null;
        anchorRect = null;
        moveOffsetX = 0;
        moveOffsetY = 0;
        startPoint = null;
    }

    public boolean isActive() {
        return mode != DragMode.NONE;
    }

    public DragMode mode() {
        return mode;
    }

    public Handle activeHandle() {
        return activeHandle;
    }

    public Rect anchorRect() {
        return anchorRect;
    }

    public double moveOffsetX() {
        return moveOffsetX;
    }

    public double moveOffsetY() {
        return moveOffsetY;
    }

    public ImagePoint startPoint() {
        return startPoint;
    }
}
