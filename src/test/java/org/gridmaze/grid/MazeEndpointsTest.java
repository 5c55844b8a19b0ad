package org.gridmaze.grid;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazeEndpoints Configuration Tests")
class MazeEndpointsTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(MazeEndpoints.PROP_START_ROW);
        System.clearProperty(MazeEndpoints.PROP_START_COL);
        System.clearProperty(MazeEndpoints.PROP_GOAL_ROW);
        System.clearProperty(MazeEndpoints.PROP_GOAL_COL);
    }

    @Test
    @DisplayName("Defaults to (4,0) -> (0,4) without properties")
    void testDefaults() {
        MazeEndpoints endpoints = MazeEndpoints.defaults();

        assertEquals(MazeEndpoints.DEFAULT_START, endpoints.start());
        assertEquals(MazeEndpoints.DEFAULT_GOAL, endpoints.goal());
    }

    @Test
    @DisplayName("System properties override the fixed coordinates")
    void testPropertyOverride() {
        System.setProperty(MazeEndpoints.PROP_START_ROW, "2");
        System.setProperty(MazeEndpoints.PROP_START_COL, " 0 ");
        System.setProperty(MazeEndpoints.PROP_GOAL_ROW, "0");
        System.setProperty(MazeEndpoints.PROP_GOAL_COL, "2");

        assertEquals(MazeEndpoints.of(2, 0, 0, 2), MazeEndpoints.defaults());
    }

    @Test
    @DisplayName("Malformed or negative values fall back per coordinate")
    void testMalformedFallback() {
        System.setProperty(MazeEndpoints.PROP_START_ROW, "four");
        System.setProperty(MazeEndpoints.PROP_GOAL_COL, "-3");
        System.setProperty(MazeEndpoints.PROP_GOAL_ROW, "1");

        MazeEndpoints endpoints = MazeEndpoints.defaults();

        assertEquals(new Position(4, 0), endpoints.start());
        assertEquals(new Position(1, 4), endpoints.goal());
    }

    @Test
    @DisplayName("Rejects null coordinates")
    void testRejectsNull() {
        assertThrows(NullPointerException.class, () -> new MazeEndpoints(null, new Position(0, 0)));
        assertThrows(NullPointerException.class, () -> new MazeEndpoints(new Position(0, 0), null));
    }
}
