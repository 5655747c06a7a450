package com.pipeline.alignment.storage;

import com.pipeline.alignment.model.Point;
import com.pipeline.alignment.model.PointValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerSnapshotTest {

    private static final long T0 = 1_700_000_000_000_000_000L;

    private static Point point(double elapsed, double value) {
        return new Point(PointValue.ofNumber(value), T0 + Math.round(elapsed * 1e9), elapsed);
    }

    /** 升序、含重复值的点序列，超过二分查找阈值 */
    private static List<Point> orderedPoints(int size, long seed) {
        Random random = new Random(seed);
        List<Point> points = new ArrayList<>();
        double elapsed = 0.0;
        for (int i = 0; i < size; i++) {
            // 步长取 0 / 0.01 / 0.02，产生重复时刻
            elapsed = Math.round((elapsed + random.nextInt(3) * 0.01) * 100) / 100.0;
            points.add(point(elapsed, i));
        }
        return points;
    }

    private static Point nearestByScan(List<Point> points, double target, double tolerance) {
        Point closest = null;
        double minDiff = Double.POSITIVE_INFINITY;
        for (Point p : points) {
            double diff = Math.abs(p.getElapsed() - target);
            if (diff < minDiff && diff <= tolerance) {
                minDiff = diff;
                closest = p;
            }
        }
        return closest;
    }

    @Test
    void shouldFlagCountThatDisagreesWithPoints() {
        // Given
        Point[] points = {point(0.0, 1), point(1.0, 2)};

        // When
        LedgerSnapshot mismatched = new LedgerSnapshot("ch", points, 3, true);
        LedgerSnapshot projected = mismatched.reproject(p -> p.getElapsed() + 10.0);

        // Then
        assertThat(mismatched.isConsistent()).isFalse();
        assertThat(projected.isConsistent()).isFalse();
        assertThat(projected.isTruncated()).isTrue();
        assertThat(projected.first().getElapsed()).isEqualTo(10.0);
        assertThat(LedgerSnapshot.of("ch", List.of(points)).isConsistent()).isTrue();
    }

    @Test
    void shouldPreferEarlierPointOnEquidistantTie() {
        // Given
        LedgerSnapshot small = LedgerSnapshot.of("ch", List.of(point(0.0, 1), point(1.0, 2)));

        // When
        Point nearest = small.nearest(0.5, 1.0);

        // Then
        assertThat(nearest.getValue().asDouble()).isEqualTo(1.0);
    }

    @Test
    void shouldReturnNullWhenNothingWithinTolerance() {
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", List.of(point(0.0, 1), point(1.0, 2)));

        assertThat(snapshot.nearest(0.5, 0.4)).isNull();
        assertThat(LedgerSnapshot.empty("ch").nearest(0.0, 10.0)).isNull();
    }

    @Test
    void shouldMatchLinearScanWhenUsingBinarySearch() {
        // Given
        List<Point> points = orderedPoints(400, 7L);
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", points);
        assertThat(snapshot.size()).isGreaterThan(LedgerSnapshot.NEAREST_LINEAR_LIMIT);

        // When / Then
        double last = points.get(points.size() - 1).getElapsed();
        for (double target = -0.05; target <= last + 0.05; target += 0.005) {
            double rounded = Math.round(target * 1000) / 1000.0;
            assertThat(snapshot.nearest(rounded, 0.015))
                    .as("nearest at %s", rounded)
                    .isSameAs(nearestByScan(points, rounded, 0.015));
        }
    }

    @Test
    void shouldReturnSameRangeForLinearAndBinaryPaths() {
        // Given
        List<Point> points = orderedPoints(300, 11L);
        LedgerSnapshot large = LedgerSnapshot.of("ch", points);

        // When
        List<Point> slice = large.range(0.5, 1.0);

        // Then
        List<Point> expected = new ArrayList<>();
        for (Point p : points) {
            if (p.getElapsed() >= 0.5 && p.getElapsed() <= 1.0) {
                expected.add(p);
            }
        }
        assertThat(slice).containsExactlyElementsOf(expected);
        assertThat(large.range(2.0, 1.0)).isEmpty();
    }

    @Test
    void shouldBracketTargetWithinTolerance() {
        // Given
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", List.of(point(0.0, 0), point(1.0, 100)));

        // When
        LedgerSnapshot.Bracket both = snapshot.bracket(0.5, 1.0);
        LedgerSnapshot.Bracket onlyBefore = snapshot.bracket(1.5, 1.0);
        LedgerSnapshot.Bracket none = snapshot.bracket(5.0, 1.0);

        // Then
        assertThat(both.isComplete()).isTrue();
        assertThat(both.getBefore().getElapsed()).isEqualTo(0.0);
        assertThat(both.getAfter().getElapsed()).isEqualTo(1.0);
        assertThat(onlyBefore.getBefore().getElapsed()).isEqualTo(1.0);
        assertThat(onlyBefore.getAfter()).isNull();
        assertThat(none.isEmpty()).isTrue();
    }

    @Test
    void shouldBracketIdenticallyOnLargeSnapshots() {
        // Given
        List<Point> points = orderedPoints(200, 3L);
        LedgerSnapshot large = LedgerSnapshot.of("ch", points);
        LedgerSnapshot small = LedgerSnapshot.of("ch", points.subList(0, 40));

        // When / Then
        double target = points.get(20).getElapsed() + 0.005;
        LedgerSnapshot.Bracket fromLarge = large.bracket(target, 0.05);
        LedgerSnapshot.Bracket fromSmall = small.bracket(target, 0.05);
        assertThat(fromLarge.getBefore()).isSameAs(fromSmall.getBefore());
        assertThat(fromLarge.getAfter()).isSameAs(fromSmall.getAfter());
    }

    @Test
    void shouldMatchAbsoluteTimestampWithinNanosecondTolerance() {
        // Given
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            points.add(new Point(PointValue.ofNumber(i), T0 + i * 1_000_000L, i * 0.001));
        }
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", points);

        // When / Then
        assertThat(snapshot.matchTimestamp(T0 + 42_000_000L + 500, 1_000).getValue().asDouble()).isEqualTo(42.0);
        assertThat(snapshot.matchTimestamp(T0 + 42_000_000L + 5_000, 1_000)).isNull();
        assertThat(LedgerSnapshot.of("ch", points.subList(0, 10)).matchTimestamp(T0 + 3_000_000L, 0))
                .isSameAs(points.get(3));
    }

    @Test
    void shouldFallBackToScanWhenElapsedIsOutOfOrder() {
        // Given
        List<Point> points = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            points.add(point(i * 0.1, i));
        }
        points.set(40, point(100.0, -1));
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", points);

        // When
        Point nearest = snapshot.nearest(100.0, 0.5);

        // Then
        assertThat(nearest.getValue().asDouble()).isEqualTo(-1.0);
    }

    @Test
    void shouldReprojectElapsedFromTimestamps() {
        // Given
        LedgerSnapshot snapshot = LedgerSnapshot.of("ch", List.of(
                new Point(PointValue.ofNumber(1), T0, 999_999.0),
                new Point(PointValue.ofNumber(2), T0 + 2_000_000_000L, 1_000_001.0)));

        // When
        LedgerSnapshot projected = snapshot.reproject(p -> (p.getTimestamp() - T0) / 1e9);

        // Then
        assertThat(projected.first().getElapsed()).isEqualTo(0.0);
        assertThat(projected.last().getElapsed()).isEqualTo(2.0);
        assertThat(projected.isConsistent()).isTrue();
    }
}
