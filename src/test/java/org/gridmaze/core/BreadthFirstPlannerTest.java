package org.gridmaze.core;

import org.gridmaze.grid.CellWalls;
import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.MazeEndpoints;
import org.gridmaze.grid.Position;
import org.gridmaze.testutil.MazeFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Breadth-First Planner Tests")
class BreadthFirstPlannerTest {

    private final SearchPlanner planner = new BreadthFirstPlanner();

    @Test
    @DisplayName("3x3 walled maze: 4-edge path and exact counters")
    void testThreeByThreeScenario() {
        GridGraph graph = MazeFixtures.threeByThreeWithWalls();
        SearchMetrics metrics = new SearchMetrics();

        List<Position> path = planner.plan(graph, null, metrics);

        assertEquals(List.of(
                new Position(2, 0), new Position(1, 0), new Position(0, 0),
                new Position(0, 1), new Position(0, 2)
        ), path);
        assertEquals(4, graph.pathCost(path));
        assertEquals(9, metrics.generated(), "start plus every reachable cell");
        assertEquals(8, metrics.expanded(), "goal pop is not an expansion");
        assertEquals(3, metrics.peakFrontier());
        assertEquals(9, metrics.peakExplored());
        assertEquals(12, metrics.peakStructures());
    }

    @Test
    @DisplayName("Serpentine corridor at default endpoints")
    void testSerpentine() {
        GridGraph graph = MazeFixtures.serpentine();
        SearchMetrics metrics = new SearchMetrics();

        List<Position> path = planner.plan(graph, null, metrics);

        assertEquals(25, path.size());
        assertEquals(24, graph.pathCost(path));
        assertEquals(graph.start(), path.get(0));
        assertEquals(graph.goal(), path.get(path.size() - 1));
        assertEquals(1, metrics.peakFrontier(), "a corridor never holds more than one frontier cell");
    }

    @Test
    @DisplayName("One-way edge is not traversed backwards")
    void testOneWayRefused() {
        Position a = new Position(0, 0);
        Position b = new Position(0, 1);
        SearchMetrics backward = new SearchMetrics();
        SearchMetrics forward = new SearchMetrics();

        assertTrue(planner.plan(MazeFixtures.oneWay(b, a), null, backward).isEmpty());
        assertEquals(List.of(a, b), planner.plan(MazeFixtures.oneWay(a, b), null, forward));
        assertEquals(1, backward.generated());
        assertEquals(1, backward.expanded());
    }

    @Test
    @DisplayName("Walled-off start yields an empty path")
    void testWalledStart() {
        SearchMetrics metrics = new SearchMetrics();

        List<Position> path = planner.plan(MazeFixtures.walledStart(), null, metrics);

        assertTrue(path.isEmpty());
        assertEquals(1, metrics.generated());
        assertEquals(1, metrics.expanded());
        assertEquals(1, metrics.peakExplored());
    }

    @Test
    @DisplayName("Start equal to goal returns the single-cell path")
    void testStartIsGoal() {
        GridGraph graph = GridGraph.builder(2, 2)
                .fill(CellWalls.open())
                .endpoints(MazeEndpoints.of(1, 1, 1, 1))
                .build();
        SearchMetrics metrics = new SearchMetrics();

        List<Position> path = planner.plan(graph, null, metrics);

        assertEquals(List.of(new Position(1, 1)), path);
        assertEquals(0, metrics.expanded());
        assertEquals(1, metrics.generated());
    }
}
