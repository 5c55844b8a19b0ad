package org.gridmaze.core;

import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.testutil.MazeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Depth-First Planner Tests")
class DepthFirstPlannerTest {

    private final SearchPlanner planner = new DepthFirstPlanner();

    @Test
    @DisplayName("3x3 walled maze: follows north first, exact counters")
    void testThreeByThreeScenario() {
        GridGraph graph = MazeFixtures.threeByThreeWithWalls();
        SearchMetrics metrics = new SearchMetrics();

        List<Position> path = planner.plan(graph, null, metrics);

        assertEquals(List.of(
                new Position(2, 0), new Position(1, 0), new Position(0, 0),
                new Position(0, 1), new Position(0, 2)
        ), path);
        assertEquals(4, metrics.expanded());
        assertEquals(7, metrics.generated());
        assertEquals(3, metrics.peakFrontier());
        assertEquals(7, metrics.peakExplored());
    }

    @Test
    @DisplayName("Open grid: dives north before turning east")
    void testNorthFirstDive() {
        GridGraph graph = MazeFixtures.open(4, 4);

        List<Position> path = planner.plan(graph, null, new SearchMetrics());

        assertEquals(new Position(2, 0), path.get(1));
        assertEquals(new Position(1, 0), path.get(2));
        assertEquals(new Position(0, 0), path.get(3));
        assertEquals(graph.goal(), path.get(path.size() - 1));
        assertEquals(path.size() - 1, graph.pathCost(path));
    }

    @Test
    @DisplayName("Single corridor is found completely")
    void testSerpentine() {
        GridGraph graph = MazeFixtures.serpentine();

        List<Position> path = planner.plan(graph, null, new SearchMetrics());

        assertEquals(24, graph.pathCost(path));
    }

    @Test
    @DisplayName("One-way edge and walled start report no path")
    void testNoPath() {
        Position a = new Position(0, 0);
        Position b = new Position(0, 1);

        assertTrue(planner.plan(MazeFixtures.oneWay(b, a), null, new SearchMetrics()).isEmpty());
        assertTrue(planner.plan(MazeFixtures.walledStart(), null, new SearchMetrics()).isEmpty());
        assertEquals(List.of(a, b), planner.plan(MazeFixtures.oneWay(a, b), null, new SearchMetrics()));
    }
}
