package com.example.interactivecrop.geometry;

import java.util.Random;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AspectProjectionTest {

    @Test
    void heightDrivenProjectionKeepsRatio() {
        ImagePoint end = AspectProjection.project(new ImagePoint(0, 0), new ImagePoint(100, 20), 2, 1000, 1000);

        assertThat(end.x()).isCloseTo(40, within(1e-9));
        assertThat(end.y()).isCloseTo(20, within(1e-9));
    }

    @Test
    void clampedWidthReprojectsHeight() {
        ImagePoint end = AspectProjection.project(new ImagePoint(0, 0), new ImagePoint(100, 20), 2, 30, 1000);

        assertThat(end.x()).isCloseTo(30, within(1e-9));
        assertThat(end.y()).isCloseTo(15, within(1e-9));
    }

    @Test
    void widthDrivenProjectionTowardsTopLeft() {
        ImagePoint end = AspectProjection.project(new ImagePoint(500, 400), new ImagePoint(300, 100), 2, 1000, 1000);

        assertThat(end.x()).isCloseTo(300, within(1e-9));
        assertThat(end.y()).isCloseTo(300, within(1e-9));
    }

    @Test
    void cornerPastBothEdgesStaysInsideAndOnRatio() {
        ImagePoint end = AspectProjection.project(new ImagePoint(700, 500), new ImagePoint(2000, 2000), 4.0 / 3, 800, 600);

        assertThat(end.x()).isLessThanOrEqualTo(800);
        assertThat(end.y()).isLessThanOrEqualTo(600);
        assertThat((end.x() - 700) / (end.y() - 500)).isCloseTo(4.0 / 3, within(1e-6));
    }

    @Test
    void zeroDeltaCountsAsPositiveDirection() {
        ImagePoint end = AspectProjection.project(new ImagePoint(10, 10), new ImagePoint(10, 30), 1, 100, 100);

        assertThat(end.x()).isGreaterThanOrEqualTo(10);
        assertThat(end.y()).isGreaterThanOrEqualTo(10);
    }

    @Test
    void projectedEndpointStaysInBoxWithTargetRatio() {
        Random random = new Random(1234);
        for (int i = 0; i < 10_000; i++) {
            double boxW = 50 + random.nextDouble() * 2000;
            double boxH = 50 + random.nextDouble() * 2000;
            double ratio = 0.25 + random.nextDouble() * 3.75;
            ImagePoint anchor = new ImagePoint(1 + random.nextDouble() * (boxW - 2), 1 + random.nextDouble() * (boxH - 2));
            ImagePoint cursor = new ImagePoint(random.nextDouble() * boxW * 2 - boxW / 2,
                    random.nextDouble() * boxH * 2 - boxH / 2);

            ImagePoint end = AspectProjection.project(anchor, cursor, ratio, boxW, boxH);

            assertThat(end.x()).isBetween(0.0, boxW);
            assertThat(end.y()).isBetween(0.0, boxH);
            double height = Math.abs(end.y() - anchor.y());
            if (height >= 1) {
                double measured = Math.abs(end.x() - anchor.x()) / Math.max(height, 1e-6);
                assertThat(Math.abs(measured - ratio) / ratio)
                        .as("ratio for anchor %s cursor %s ratio %s box %sx%s", anchor, cursor, ratio, boxW, boxH)
                        .isLessThan(1e-3);
            }
        }
    }
}
