package com.example.interactivecrop.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResizeEngineTest {

    private static final Rect START = new Rect(100, 100, 200, 200);

    @Test
    void shouldMoveBothEdgesOfFreeCorner() {
        Rect resized = ResizeEngine.resize(START, Handle.SE, new ImagePoint(400, 350), 800, 600, false);

        assertThat(resized).isEqualTo(new Rect(100, 100, 300, 250));
    }

    @Test
    void cornerDraggedPastOppositeEdgeCollapsesToMinimum() {
        Rect resized = ResizeEngine.resize(START, Handle.NW, new ImagePoint(400, 500), 800, 600, false);

        assertThat(resized).isEqualTo(new Rect(349, 399, 2, 2));
    }

    @Test
    void edgeHandleIgnoresAspectLock() {
        Rect resized = ResizeEngine.resize(START, Handle.E, new ImagePoint(500, 590), 800, 600, true);

        assertThat(resized).isEqualTo(new Rect(100, 100, 400, 200));
    }

    @Test
    void lockedCornerKeepsImageRatio() {
        Rect start = new Rect(100, 100, 200, 150);

        Rect resized = ResizeEngine.resize(start, Handle.SE, new ImagePoint(500, 380), 800, 600, true);

        assertThat(resized.x()).isEqualTo(100);
        assertThat(resized.y()).isEqualTo(100);
        assertThat(resized.w() / resized.h()).isCloseTo(800.0 / 600.0, within(1e-9));
        assertThat(resized.right()).isLessThanOrEqualTo(800);
        assertThat(resized.bottom()).isLessThanOrEqualTo(600);
    }

    @Test
    void lockedCornerAnchorsOppositeCorner() {
        Rect start = new Rect(400, 300, 200, 150);

        Rect resized = ResizeEngine.resize(start, Handle.NW, new ImagePoint(0, 0), 800, 600, true);

        assertThat(resized.right()).isCloseTo(600, within(1e-9));
        assertThat(resized.bottom()).isCloseTo(450, within(1e-9));
        assertThat(resized.w() / resized.h()).isCloseTo(800.0 / 600.0, within(1e-9));
    }

    @Test
    void collapsedEdgeExpandsToMinimumAroundMidpoint() {
        Rect resized = ResizeEngine.resize(START, Handle.W, new ImagePoint(300, 150), 800, 600, false);

        assertThat(resized.w()).isCloseTo(2, within(1e-9));
        assertThat(resized.x()).isCloseTo(299, within(1e-9));
        assertThat(resized.h()).isEqualTo(200);
    }

    @Test
    void resizedRectStaysInsideImage() {
        Rect resized = ResizeEngine.resize(new Rect(700, 500, 98, 98), Handle.SE, new ImagePoint(800, 600), 800, 600, false);

        assertThat(resized).isEqualTo(new Rect(700, 500, 100, 100));
    }
}
