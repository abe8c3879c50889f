package com.example.interactivecrop.interaction;

import com.example.interactivecrop.geometry.AspectProjection;
import com.example.interactivecrop.geometry.CoordinateMapper;
import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.geometry.Handle;
import com.example.interactivecrop.geometry.ImagePoint;
import com.example.interactivecrop.geometry.Rect;
import com.example.interactivecrop.geometry.RectGeometry;
import com.example.interactivecrop.geometry.ResizeEngine;
import com.example.interactivecrop.geometry.ScreenPoint;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pointer-driven state machine that creates, moves and resizes one selection rectangle.
 *
 * <p>States are {@code Idle}, {@code Creating}, {@code Moving} and {@code Resizing(handle)}.
 * A drag holds the shared {@link DragLock} from pointer-down until pointer-up, a missed-release
 * check, a lost selection, or a forced release by the global safety net.</p>
 *
 * <p>The rectangle is kept in image pixels. Handle and interior hit tests run in display space
 * against the rectangle scaled by the current draw scale.</p>
 */
public class SelectionDragMachine {

    private static final Logger log = LoggerFactory.getLogger(SelectionDragMachine.class);

    private final String ownerId;
    private final DragLock dragLock;
    private final DragSession drag = new DragSession();

    private double imageWidth;
    private double imageHeight;
    private boolean aspectLocked;
    private Rect rect;

    public SelectionDragMachine(String ownerId, DragLock dragLock, double imageWidth, double imageHeight, boolean aspectLocked) {
        this.ownerId = ownerId;
        this.dragLock = dragLock;
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.aspectLocked = aspectLocked;
    }

    public boolean pointerDown(ScreenPoint pointer, DrawBox drawBox, double scale, boolean targetSelected) {
        if (drawBox == null || !targetSelected || !CoordinateMapper.isOverDrawBox(pointer, drawBox)) {
            return false;
        }
        ScreenPoint local = CoordinateMapper.toDrawLocal(pointer, drawBox);
        ImagePoint imagePoint = toImagePoint(pointer, drawBox, scale);

        dragLock.acquire(ownerId, this::cancelDrag);

        if (rect != null) {
            Rect onScreen = CoordinateMapper.toDisplay(rect, scale);
            Optional<Handle> handle = RectGeometry.hitTestHandle(local.x(), local.y(), onScreen);
            if (handle.isPresent()) {
                drag.startResizing(handle.get(), rect);
                log.debug("{}: resizing from handle {}", ownerId, handle.get().key());
                return true;
            }
            if (onScreen.contains(local.x(), local.y())) {
                drag.startMoving(imagePoint.x() - rect.x(), imagePoint.y() - rect.y());
                log.debug("{}: moving selection", ownerId);
                return true;
            }
        }

        drag.startCreating(imagePoint);
        rect = new Rect(imagePoint.x(), imagePoint.y(), 0, 0);
        log.debug("{}: creating selection at ({}, {})", ownerId, imagePoint.x(), imagePoint.y());
        return true;
    }

    /**
     * Updates the live drag. A move without the primary button ends the drag, which recovers from
     * release events the host never delivered; a move after the target lost selection
     * force-releases the lock.
     *
     * @return whether the event was claimed
     */
    public boolean pointerMove(PointerInput input, DrawBox drawBox, double scale, boolean targetSelected) {
        if (!drag.isActive() || drawBox == null) {
            return false;
        }
        if (!input.hasPrimaryButton()) {
            log.debug("{}: primary button no longer held, ending drag", ownerId);
            endDrag();
            return false;
        }
        if (!targetSelected) {
            log.debug("{}: target deselected mid-drag", ownerId);
            dragLock.forceRelease();
            return false;
        }

        ImagePoint cursor = toImagePoint(input.position(), drawBox, scale);
        switch (drag.mode()) {
            case MOVING:
                moveTo(cursor);
                return true;
            case RESIZING:
                resizeTo(cursor);
                return true;
            case CREATING:
                createTo(cursor);
                return true;
            default:
                return false;
        }
    }

    public boolean pointerUp() {
        if (!drag.isActive()) {
            return false;
        }
        endDrag();
        return true;
    }

    public CursorHint cursorAt(ScreenPoint pointer, DrawBox drawBox, double scale) {
        if (!CoordinateMapper.isOverDrawBox(pointer, drawBox)) {
            return CursorHint.NONE;
        }
        if (drag.isActive()) {
            if (drag.mode() == DragMode.RESIZING) {
                return CursorHint.forHandle(drag.activeHandle());
            }
            return drag.mode() == DragMode.MOVING ? CursorHint.MOVE : CursorHint.CROSSHAIR;
        }
        if (rect == null) {
            return CursorHint.CROSSHAIR;
        }
        ScreenPoint local = CoordinateMapper.toDrawLocal(pointer, drawBox);
        Rect onScreen = CoordinateMapper.toDisplay(rect, scale);
        Optional<Handle> handle = RectGeometry.hitTestHandle(local.x(), local.y(), onScreen);
        if (handle.isPresent()) {
            return CursorHint.forHandle(handle.get());
        }
        return onScreen.contains(local.x(), local.y()) ? CursorHint.MOVE : CursorHint.CROSSHAIR;
    }

    public void release() {
        if (dragLock.isHeldBy(ownerId)) {
            dragLock.forceRelease();
        } else {
            drag.reset();
        }
    }

    public void replaceImage(double width, double height) {
        release();
        imageWidth = width;
        imageHeight = height;
        rect = null;
    }

    // A rounded draw box can map a pixel or so past the image edge.
    private ImagePoint toImagePoint(ScreenPoint pointer, DrawBox drawBox, double scale) {
        ImagePoint mapped = CoordinateMapper.toImageSpace(pointer, drawBox, scale);
        return new ImagePoint(RectGeometry.clamp(mapped.x(), 0, imageWidth),
                RectGeometry.clamp(mapped.y(), 0, imageHeight));
    }

    private void moveTo(ImagePoint cursor) {
        if (rect == null) {
            return;
        }
        double newX = RectGeometry.clamp(cursor.x() - drag.moveOffsetX(), 0, imageWidth - rect.w());
        double newY = RectGeometry.clamp(cursor.y() - drag.moveOffsetY(), 0, imageHeight - rect.h());
        rect = rect.withOrigin(newX, newY);
    }

    private void resizeTo(ImagePoint cursor) {
        if (rect == null || drag.activeHandle() == null) {
            return;
        }
        Rect baseline = drag.anchorRect() != null ? drag.anchorRect() : rect;
        rect = ResizeEngine.resize(baseline, drag.activeHandle(), cursor, imageWidth, imageHeight, aspectLocked);
    }

    private void createTo(ImagePoint cursor) {
        ImagePoint start = drag.startPoint();
        ImagePoint end = cursor;
        if (aspectLocked) {
            end = AspectProjection.project(start, cursor, imageWidth / imageHeight, imageWidth, imageHeight);
        }
        rect = Rect.spanning(start.x(), start.y(), end.x(), end.y());
    }

    private void endDrag() {
        drag.reset();
        dragLock.release(ownerId);
    }

    private void cancelDrag() {
        drag.reset();
    }

    public Optional<Rect> selection() {
        return Optional.ofNullable(rect);
    }

    public DragMode dragMode() {
        return drag.mode();
    }

    public Handle activeHandle() {
        return drag.activeHandle();
    }

    public boolean isDragging() {
        return drag.isActive();
    }

    public boolean isAspectLocked() {
        return aspectLocked;
    }

    public void setAspectLocked(boolean aspectLocked) {
        this.aspectLocked = aspectLocked;
    }

    public double imageWidth() {
        return imageWidth;
    }

    public double imageHeight() {
        return imageHeight;
    }
}
