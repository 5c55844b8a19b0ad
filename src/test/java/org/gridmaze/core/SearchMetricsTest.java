package org.gridmaze.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SearchMetrics Tests")
class SearchMetricsTest {

    @Test
    @DisplayName("Fresh metrics are zeroed and unevaluated")
    void testFreshState() {
        SearchMetrics metrics = new SearchMetrics();

        assertEquals(0, metrics.expanded());
        assertEquals(0, metrics.generated());
        assertEquals(0, metrics.peakStructures());
        assertFalse(metrics.found());
        assertNull(metrics.complete());
        assertNull(metrics.optimal());
    }

    @Test
    @DisplayName("Peaks only grow and are tracked independently")
    void testPeaks() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.observeFrontier(3);
        metrics.observeFrontier(1);
        metrics.observeExplored(2);
        metrics.observeExplored(5);
        metrics.observeExplored(4);

        assertEquals(3, metrics.peakFrontier());
        assertEquals(5, metrics.peakExplored());
        assertEquals(8, metrics.peakStructures());
    }

    @Test
    @DisplayName("Elapsed time is never negative")
    void testElapsed() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordElapsed(-5L);
        assertEquals(0L, metrics.elapsedNanos());

        metrics.recordElapsed(2_500_000L);
        assertEquals(2.5d, metrics.elapsedMillis(), 1e-9);
    }

    @Test
    @DisplayName("Counter comparison ignores elapsed time")
    void testSameCounters() {
        SearchMetrics a = new SearchMetrics();
        SearchMetrics b = new SearchMetrics();
        for (SearchMetrics m : new SearchMetrics[]{a, b}) {
            m.recordGenerated();
            m.recordExpanded();
            m.observeFrontier(2);
            m.recordOutcome(true, 3, 3);
            m.recordEvaluation(true, true);
        }
        a.recordElapsed(10L);
        b.recordElapsed(99_999L);

        assertTrue(a.sameCounters(b));
        b.recordEvaluation(true, false);
        assertFalse(a.sameCounters(b));
        assertFalse(a.sameCounters(null));
    }

    @Test
    @DisplayName("toString lists the reported columns")
    void testToString() {
        SearchMetrics metrics = new SearchMetrics();
        metrics.recordOutcome(true, 4, 4);

        String text = metrics.toString();

        assertTrue(text.contains("expanded=0"));
        assertTrue(text.contains("found=true"));
        assertTrue(text.contains("cost=4"));
        assertTrue(text.contains("optimal=null"));
    }
}
