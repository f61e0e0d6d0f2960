package io.voterelay.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class UpstreamCountsTest {

    @Test
    void trailingZerosDoNotCountTowardsDepth() {
        UpstreamCounts counts = UpstreamCounts.of(1, 0, 2, 0, 0);
        Assertions.assertEquals(3, counts.depth());
        Assertions.assertEquals(0, counts.count(2));
        Assertions.assertEquals(2, counts.count(3));
        Assertions.assertEquals(0, counts.count(9));
        Assertions.assertEquals(UpstreamCounts.of(1, 0, 2), counts);
        Assertions.assertTrue(UpstreamCounts.of(0, 0).isEmpty());
        Assertions.assertEquals(0, UpstreamCounts.empty().depth());
    }

    @Test
    void throughEdgeAddsTheSignerOneStepAhead() {
        Assertions.assertEquals(UpstreamCounts.of(1), UpstreamCounts.empty().throughEdge());
        Assertions.assertEquals(UpstreamCounts.of(1, 2, 1), UpstreamCounts.of(2, 1).throughEdge());
    }

    @Test
    void plusAndMinusShiftTheOtherCounts() {
        UpstreamCounts carried = UpstreamCounts.of(1, 1);
        UpstreamCounts linked = UpstreamCounts.of(1).plus(carried, 1);
        Assertions.assertEquals(UpstreamCounts.of(1, 1, 1), linked);
        Assertions.assertEquals(UpstreamCounts.of(1), linked.minus(carried, 1));
        Assertions.assertTrue(carried.minus(carried, 0).isEmpty());
    }

    @Test
    void rejectsNegativeCounts() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> UpstreamCounts.of(1, -1));
        Assertions.assertThrows(IllegalStateException.class, () -> UpstreamCounts.of(1).minus(UpstreamCounts.of(2), 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> UpstreamCounts.of(1).count(0));
    }
}
