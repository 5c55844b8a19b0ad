package org.gridmaze.heuristic;

import org.gridmaze.grid.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Heuristics Tests")
class HeuristicsTest {

    @ParameterizedTest
    @CsvSource({
            "4, 0, 0, 4, 8",
            "0, 0, 0, 0, 0",
            "2, 3, 5, 1, 5",
            "1, 1, 1, 4, 3"
    })
    @DisplayName("Manhattan distance is |dr| + |dc|")
    void testManhattan(int fr, int fc, int tr, int tc, int expected) {
        Position from = new Position(fr, fc);
        Position to = new Position(tr, tc);

        assertEquals(expected, Heuristics.manhattan(from, to));
        assertEquals(expected, Heuristics.MANHATTAN.estimate(from, to), 0.0d);
    }

    @Test
    @DisplayName("Euclidean distance is the straight-line distance")
    void testEuclidean() {
        assertEquals(5.0d, Heuristics.euclidean(new Position(0, 0), new Position(3, 4)), 1e-12);
        assertEquals(Math.sqrt(32.0d), Heuristics.EUCLIDEAN.estimate(new Position(4, 0), new Position(0, 4)), 1e-12);
        assertEquals(0.0d, Heuristics.euclidean(new Position(2, 2), new Position(2, 2)), 0.0d);
    }

    @Test
    @DisplayName("Zero heuristic is always zero")
    void testZero() {
        assertEquals(0.0d, Heuristics.ZERO.estimate(new Position(0, 0), new Position(9, 9)), 0.0d);
    }

    @Test
    @DisplayName("Euclidean never exceeds Manhattan")
    void testEuclideanDominatedByManhattan() {
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                Position from = new Position(r, c);
                Position to = new Position(0, 5);
                assertTrue(Heuristics.euclidean(from, to) <= Heuristics.manhattan(from, to) + 1e-12);
            }
        }
    }
}
