package com.example.interactivecrop.interaction;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.geometry.DrawBox;
import com.example.interactivecrop.geometry.Handle;
import com.example.interactivecrop.geometry.Rect;
import com.example.interactivecrop.geometry.ScreenPoint;
import com.example.interactivecrop.util.DrawBoxLayout;
import com.example.interactivecrop.util.PreviewLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SelectionDragMachineTest {

    private static final DrawBox FULL = new DrawBox(0, 0, 800, 600);
    private static final int PRIMARY = PointerInput.PRIMARY_BUTTON;

    private DragLock lock;
    private SelectionDragMachine machine;

    @BeforeEach
    void setUp() {
        lock = new DragLock();
        machine = new SelectionDragMachine("7", lock, 800, 600, false);
    }

    @Test
    void createsSelectionFromDrag() {
        DrawBox halfSize = new DrawBox(10, 20, 400, 300);

        assertThat(machine.pointerDown(new ScreenPoint(60, 70), halfSize, 0.5, true)).isTrue();
        assertThat(machine.pointerMove(PointerInput.at(160, 170, PRIMARY), halfSize, 0.5, true)).isTrue();
        assertThat(machine.pointerUp()).isTrue();

        assertThat(machine.selection()).contains(new Rect(100, 100, 200, 200));
        assertThat(machine.isDragging()).isFalse();
        assertThat(lock.owner()).isEmpty();
    }

    @Test
    void pointerDownHoldsLockUntilRelease() {
        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);

        assertThat(lock.isHeldBy("7")).isTrue();
        assertThat(machine.dragMode()).isEqualTo(DragMode.CREATING);
        assertThat(machine.selection()).contains(new Rect(100, 100, 0, 0));
    }

    @Test
    void ignoresPointerDownWhenTargetIsNotSelected() {
        assertThat(machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, false)).isFalse();

        assertThat(lock.owner()).isEmpty();
        assertThat(machine.selection()).isEmpty();
    }

    @Test
    void ignoresPointerDownOutsideDrawBox() {
        DrawBox box = new DrawBox(100, 100, 400, 300);

        assertThat(machine.pointerDown(new ScreenPoint(50, 50), box, 0.5, true)).isFalse();
        assertThat(machine.pointerDown(new ScreenPoint(100, 100), null, 0.5, true)).isFalse();
        assertThat(machine.isDragging()).isFalse();
    }

    @Test
    void movesSelectionAndClampsToImage() {
        drawSelection(100, 100, 300, 300);

        assertThat(machine.pointerDown(new ScreenPoint(200, 200), FULL, 1, true)).isTrue();
        assertThat(machine.dragMode()).isEqualTo(DragMode.MOVING);
        machine.pointerMove(PointerInput.at(900, 900, PRIMARY), FULL, 1, true);

        assertThat(machine.selection()).contains(new Rect(600, 400, 200, 200));
    }

    @Test
    void resizesFromCornerHandle() {
        drawSelection(100, 100, 300, 300);

        machine.pointerDown(new ScreenPoint(302, 301), FULL, 1, true);

        assertThat(machine.dragMode()).isEqualTo(DragMode.RESIZING);
        assertThat(machine.activeHandle()).isEqualTo(Handle.SE);
        machine.pointerMove(PointerInput.at(400, 350, PRIMARY), FULL, 1, true);
        assertThat(machine.selection()).contains(new Rect(100, 100, 300, 250));
    }

    @Test
    void handleHitBoxKeepsScreenSizeWhenZoomedOut() {
        drawSelection(100, 100, 300, 300);
        DrawBox quarter = new DrawBox(0, 0, 200, 150);

        // SE corner is at (75, 75) on screen
        machine.pointerDown(new ScreenPoint(78, 78), quarter, 0.25, true);

        assertThat(machine.dragMode()).isEqualTo(DragMode.RESIZING);
    }

    @Test
    void moveWithoutPrimaryButtonEndsDrag() {
        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);

        assertThat(machine.pointerMove(PointerInput.at(200, 200, 0), FULL, 1, true)).isFalse();

        assertThat(machine.isDragging()).isFalse();
        assertThat(lock.owner()).isEmpty();
        assertThat(machine.selection()).contains(new Rect(100, 100, 0, 0));
    }

    @Test
    void moveAfterDeselectReleasesLock() {
        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);

        assertThat(machine.pointerMove(PointerInput.at(200, 200, PRIMARY), FULL, 1, false)).isFalse();

        assertThat(machine.isDragging()).isFalse();
        assertThat(lock.owner()).isEmpty();
    }

    @Test
    void secondMachineTakesOverTheDrag() {
        SelectionDragMachine other = new SelectionDragMachine("9", lock, 800, 600, false);
        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);

        other.pointerDown(new ScreenPoint(50, 50), FULL, 1, true);

        assertThat(machine.isDragging()).isFalse();
        assertThat(other.isDragging()).isTrue();
        assertThat(lock.owner()).contains("9");
    }

    @Test
    void forcedReleaseEndsLiveDrag() {
        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);

        lock.forceRelease();

        assertThat(machine.isDragging()).isFalse();
        assertThat(machine.pointerMove(PointerInput.at(300, 300, PRIMARY), FULL, 1, true)).isFalse();
        assertThat(machine.selection()).contains(new Rect(100, 100, 0, 0));
    }

    @Test
    void aspectLockedCreateFollowsImageRatio() {
        machine.setAspectLocked(true);

        machine.pointerDown(new ScreenPoint(100, 100), FULL, 1, true);
        machine.pointerMove(PointerInput.at(500, 200, PRIMARY), FULL, 1, true);

        Rect rect = machine.selection().orElseThrow();
        assertThat(rect.h()).isCloseTo(100, within(1e-9));
        assertThat(rect.w() / rect.h()).isCloseTo(800.0 / 600.0, within(1e-9));
    }

    @Test
    void reportsCursorForPointerPosition() {
        drawSelection(100, 100, 300, 300);

        assertThat(machine.cursorAt(new ScreenPoint(200, 200), FULL, 1)).isEqualTo(CursorHint.MOVE);
        assertThat(machine.cursorAt(new ScreenPoint(300, 300), FULL, 1)).isEqualTo(CursorHint.NWSE_RESIZE);
        assertThat(machine.cursorAt(new ScreenPoint(300, 100), FULL, 1)).isEqualTo(CursorHint.NESW_RESIZE);
        assertThat(machine.cursorAt(new ScreenPoint(200, 100), FULL, 1)).isEqualTo(CursorHint.NS_RESIZE);
        assertThat(machine.cursorAt(new ScreenPoint(500, 500), FULL, 1)).isEqualTo(CursorHint.CROSSHAIR);
        assertThat(machine.cursorAt(new ScreenPoint(900, 900), FULL, 1)).isEqualTo(CursorHint.NONE);
    }

    @Test
    void replacingImageDropsSelection() {
        drawSelection(100, 100, 300, 300);

        machine.replaceImage(200, 200);

        assertThat(machine.selection()).isEmpty();
        assertThat(machine.imageWidth()).isEqualTo(200);
    }

    private void drawSelection(double x0, double y0, double x1, double y1) {
        machine.pointerDown(new ScreenPoint(x0, y0), FULL, 1, true);
        machine.pointerMove(PointerInput.at(x1, y1, PRIMARY), FULL, 1, true);
        machine.pointerUp();
    }

    @Test
    void createDragStaysInsideImageWhenDrawBoxIsRoundedUp() {
        SelectionDragMachine tall = new SelectionDragMachine("9", lock, 1000, 999, false);
        PreviewLayout layout = DrawBoxLayout.fit(116, 5000, 0, 1000, 999,
                new CropProperties.Layout(8, 48, 20, 2000));
        DrawBox box = layout.drawBox();
        assertThat(box.h() / layout.scale()).isGreaterThan(999);

        tall.pointerDown(new ScreenPoint(box.x() + 1, box.y() + 1), box, layout.scale(), true);
        tall.pointerMove(PointerInput.at(box.x() + 500, box.y() + 500, PRIMARY), box, layout.scale(), true);

        Rect selection = tall.selection().orElseThrow();
        assertThat(selection.x() + selection.w()).isLessThanOrEqualTo(1000);
        assertThat(selection.y() + selection.h()).isLessThanOrEqualTo(999);
        assertThat(selection.y() + selection.h()).isCloseTo(999, within(1e-9));
    }
}
