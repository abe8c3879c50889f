package com.example.interactivecrop.service.session;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.geometry.CoordinateMapper;
import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.geometry.HandlePoint;
import com.example.interactivecrop.geometry.Rect;
import com.example.interactivecrop.geometry.RectGeometry;
import com.example.interactivecrop.interaction.CursorHint;
import com.example.interactivecrop.interaction.DragLock;
import com.example.interactivecrop.interaction.PointerHandler;
import com.example.interactivecrop.interaction.PointerInput;
import com.example.interactivecrop.interaction.SelectionDragMachine;
import com.example.interactivecrop.interaction.TargetSelection;
import com.example.interactivecrop.model.CropRequest;
import com.example.interactivecrop.model.ImageRef;
import com.example.interactivecrop.model.LayoutRequest;
import com.example.interactivecrop.model.RenderFrame;
import com.example.interactivecrop.util.DrawBoxLayout;
import com.example.interactivecrop.util.PreviewLayout;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One pending crop decision for one target. Holds the selection machine, the current preview and
 * its layout, and the {@link SessionState} that guards against double submission.
 *
 * <p>Not thread safe. Callers serialize access, see
 * {@link com.example.interactivecrop.service.CropInteractionService}.</p>
 */
public class CropSession implements PointerHandler {

    private static final Logger log = LoggerFactory.getLogger(CropSession.class);

    private final String requestId;
    private final String targetId;
    private final ImageRef image;
    private final TargetSelection targetSelection;
    private final CropProperties.Layout layoutProperties;
    private final SelectionDragMachine machine;

    private SessionState state = SessionState.PENDING;
    private BufferedImage preview;
    private PreviewLayout layout;
    private LayoutRequest lastLayoutRequest;
    private CursorHint cursor = CursorHint.NONE;

    public CropSession(CropRequest request, DragLock dragLock, TargetSelection targetSelection,
                       CropProperties.Layout layoutProperties) {
        this.requestId = request.requestId();
        this.targetId = request.targetId();
        this.image = request.image();
        this.targetSelection = targetSelection;
        this.layoutProperties = layoutProperties;
        this.machine = new SelectionDragMachine(targetId, dragLock, request.width(), request.height(),
                request.forceOriginalRatio());
    }

    public void markReady(BufferedImage loadedPreview) {
        if (state != SessionState.PENDING) {
            return;
        }
        preview = loadedPreview;
        state = SessionState.ACTIVE;
        relayout();
        log.info("Crop session {} for request {} is ready", targetId, requestId);
    }

    public boolean isInteractive() {
        return state == SessionState.ACTIVE;
    }

    public void applyLayout(LayoutRequest request) {
        lastLayoutRequest = request;
        layout = DrawBoxLayout.fit(request.width(), request.height(), request.contentTop(),
                machine.imageWidth(), machine.imageHeight(), layoutProperties);
    }

    public void applyDrawBox(DrawBox drawBox) {
        lastLayoutRequest = null;
        layout = DrawBoxLayout.of(drawBox, machine.imageWidth());
    }

    @Override
    public boolean onPointerDown(PointerInput input) {
        if (!isInteractive() || layout == null) {
            return false;
        }
        boolean claimed = machine.pointerDown(input.position(), layout.drawBox(), layout.scale(),
                targetSelection.isSelected(targetId));
        updateCursor(input);
        return claimed;
    }

    @Override
    public boolean onPointerMove(PointerInput input) {
        if (!isInteractive() || layout == null) {
            cursor = CursorHint.NONE;
            return false;
        }
        boolean claimed = machine.pointerMove(input, layout.drawBox(), layout.scale(),
                targetSelection.isSelected(targetId));
        updateCursor(input);
        return claimed;
    }

    @Override
    public boolean onPointerUp(PointerInput input) {
        boolean claimed = machine.pointerUp();
        if (layout != null && isInteractive()) {
            updateCursor(input);
        }
        return claimed;
    }

    /**
     * Marks the session submitted and builds the decision to send. Returns empty when a decision
     * was already submitted or the preview never loaded. A continue without a selection of at
     * least 2x2 pixels becomes a passthrough.
     */
    public Optional<CropDecision> beginSubmission(DecisionAction requested) {
        if (state != SessionState.ACTIVE) {
            log.debug("Ignoring {} for session {} in state {}", requested.wireValue(), targetId, state);
            return Optional.empty();
        }
        state = SessionState.SUBMITTED;
        machine.release();
        cursor = CursorHint.NONE;

        if (requested == DecisionAction.CANCEL) {
            return Optional.of(CropDecision.cancel(requestId, targetId));
        }
        if (requested == DecisionAction.PASSTHROUGH) {
            return Optional.of(CropDecision.passthrough(requestId, targetId));
        }
        CropDecision decision = machine.selection()
                .filter(rect -> rect.w() >= RectGeometry.DEFAULT_MIN_SIZE && rect.h() >= RectGeometry.DEFAULT_MIN_SIZE)
                .map(rect -> CropDecision.crop(requestId, targetId, CropBounds.of(rect)))
                .orElseGet(() -> CropDecision.passthrough(requestId, targetId));
        return Optional.of(decision);
    }

    public void applyPreview(BufferedImage cropped, CropBounds bounds) {
        preview = cropped;
        machine.replaceImage(bounds.width(), bounds.height());
        relayout();
    }

    public void setAspectLock(boolean forceOriginalRatio) {
        machine.setAspectLocked(forceOriginalRatio);
    }

    public void close() {
        machine.release();
        cursor = CursorHint.NONE;
    }

    public RenderFrame toFrame() {
        Rect selection = machine.selection().orElse(null);
        DrawBox drawBox = layout != null ? layout.drawBox() : null;
        double scale = layout != null ? layout.scale() : 1;
        Rect onScreen = null;
        List<HandlePoint> handles = List.of();
        if (selection != null && drawBox != null) {
            onScreen = CoordinateMapper.toScreen(selection, drawBox, scale);
            handles = RectGeometry.handlesOf(onScreen);
        }
        return new RenderFrame(
                targetId,
                requestId,
                state,
                isInteractive(),
                (int) Math.round(machine.imageWidth()),
                (int) Math.round(machine.imageHeight()),
                machine.isAspectLocked(),
                drawBox,
                scale,
                selection,
                onScreen,
                handles,
                isInteractive() ? cursor : CursorHint.NONE,
                machine.dragMode());
    }

    private void relayout() {
        if (lastLayoutRequest != null) {
            applyLayout(lastLayoutRequest);
        } else if (layout != null) {
            // Keep the host's box but refresh the scale for the current image width.
            layout = DrawBoxLayout.of(layout.drawBox(), machine.imageWidth());
        }
    }

    private void updateCursor(PointerInput input) {
        cursor = machine.cursorAt(input.position(), layout.drawBox(), layout.scale());
    }

    public String requestId() {
        return requestId;
    }

    public String targetId() {
        return targetId;
    }

    public ImageRef image() {
        return image;
    }

    public SessionState state() {
        return state;
    }

    public Optional<BufferedImage> preview() {
        return Optional.ofNullable(preview);
    }

    public SelectionDragMachine machine() {
        return machine;
    }
}
