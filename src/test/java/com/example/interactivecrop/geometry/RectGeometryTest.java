package com.example.interactivecrop.geometry;

import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RectGeometryTest {

    @Test
    void shouldNormalizeNegativeSize() {
        Rect normalized = RectGeometry.normalize(new Rect(300, 250, -200, -150));

        assertThat(normalized).isEqualTo(new Rect(100, 100, 200, 150));
    }

    @Test
    void shouldExpandTinyRectToMinimumSize() {
        Rect clamped = RectGeometry.clampToBox(new Rect(50, 50, 0, 0), 800, 600);

        assertThat(clamped.w()).isEqualTo(2);
        assertThat(clamped.h()).isEqualTo(2);
    }

    @Test
    void shouldPushMinimumSizedRectBackInsideFarEdge() {
        Rect clamped = RectGeometry.clampToBox(new Rect(800, 600, 0, 0), 800, 600);

        assertThat(clamped).isEqualTo(new Rect(798, 598, 2, 2));
    }

    @Test
    void clampedRectAlwaysFitsTheBox() {
        Random random = new Random(42);
        for (int i = 0; i < 5_000; i++) {
            double boxW = 2 + random.nextDouble() * 2000;
            double boxH = 2 + random.nextDouble() * 2000;
            Rect input = new Rect(
                    random.nextDouble() * 4000 - 2000,
                    random.nextDouble() * 4000 - 2000,
                    random.nextDouble() * 6000 - 3000,
                    random.nextDouble() * 6000 - 3000);

            Rect clamped = RectGeometry.clampToBox(input, boxW, boxH, 2);

            assertThat(clamped.x()).as("x of %s in %sx%s", input, boxW, boxH).isGreaterThanOrEqualTo(0);
            assertThat(clamped.y()).as("y of %s in %sx%s", input, boxW, boxH).isGreaterThanOrEqualTo(0);
            assertThat(clamped.right()).as("right of %s in %sx%s", input, boxW, boxH).isLessThanOrEqualTo(boxW + 1e-9);
            assertThat(clamped.bottom()).as("bottom of %s in %sx%s", input, boxW, boxH).isLessThanOrEqualTo(boxH + 1e-9);
            assertThat(clamped.w()).isGreaterThanOrEqualTo(2);
            assertThat(clamped.h()).isGreaterThanOrEqualTo(2);
        }
    }

    @Test
    void shouldListHandlesInFixedOrder() {
        assertThat(RectGeometry.handlesOf(new Rect(10, 20, 100, 50)))
                .extracting(HandlePoint::handle)
                .containsExactly(Handle.NW, Handle.N, Handle.NE, Handle.E, Handle.SE, Handle.S, Handle.SW, Handle.W);
        assertThat(RectGeometry.handlesOf(new Rect(10, 20, 100, 50)).get(4))
                .isEqualTo(new HandlePoint(Handle.SE, 110, 70));
    }

    @Test
    void shouldHitHandleWithinFourUnits() {
        Rect rect = new Rect(100, 100, 200, 200);

        assertThat(RectGeometry.hitTestHandle(303, 297, rect)).contains(Handle.SE);
        assertThat(RectGeometry.hitTestHandle(200, 96, rect)).contains(Handle.N);
        assertThat(RectGeometry.hitTestHandle(96, 200, rect)).contains(Handle.W);
    }

    @Test
    void shouldMissHandlesAwayFromTheirHitBoxes() {
        Rect rect = new Rect(100, 100, 200, 200);

        assertThat(RectGeometry.hitTestHandle(200, 200, rect)).isEmpty();
        assertThat(RectGeometry.hitTestHandle(150, 100, rect)).isEmpty();
        assertThat(RectGeometry.hitTestHandle(305, 305, rect)).isEmpty();
    }

    @Test
    void pointsOutsideEveryHitBoxNeverHit() {
        Random random = new Random(7);
        for (int i = 0; i < 5_000; i++) {
            Rect rect = new Rect(random.nextDouble() * 500, random.nextDouble() * 500,
                    random.nextDouble() * 300, random.nextDouble() * 300);
            double px = random.nextDouble() * 1000;
            double py = random.nextDouble() * 1000;
            boolean nearAny = RectGeometry.handlesOf(rect).stream()
                    .anyMatch(h -> Math.abs(px - h.x()) <= 4 && Math.abs(py - h.y()) <= 4);
            if (!nearAny) {
                assertThat(RectGeometry.hitTestHandle(px, py, rect)).isEmpty();
            }
        }
    }

    @Test
    void earlierHandleWinsOnOverlappingHitBoxes() {
        Rect tiny = new Rect(0, 0, 2, 2);

        assertThat(RectGeometry.hitTestHandle(1, 1, tiny)).contains(Handle.NW);
        assertThat(RectGeometry.hitTestHandle(6, 1, tiny)).contains(Handle.NE);
    }
}
