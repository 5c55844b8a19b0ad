package org.gridmaze.core;

import org.gridmaze.grid.GridGraph;
import org.gridmaze.grid.Position;
import org.gridmaze.heuristic.Heuristic;
import org.gridmaze.heuristic.HeuristicConfigurationException;
import org.gridmaze.heuristic.HeuristicFactory;
import org.gridmaze.heuristic.HeuristicType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main search entry point.
 *
 * <p>The engine validates requests before any search starts. Execution flow:</p>
 * <ul>
 * <li>Validate graph/request presence and algorithm/heuristic compatibility.</li>
 * <li>Resolve the heuristic (stock type through {@link HeuristicFactory}, or a custom instance).</li>
 * <li>Run the planner on a fresh {@link SearchMetrics}, timing the planner call only.</li>
 * <li>Record path cost/length, then optionally ask the {@link OptimalityOracle} for a verdict.</li>
 * </ul>
 *
 * <p>The engine holds no per-search state; one instance may serve concurrent callers as
 * long as each call uses its own request.</p>
 */
public final class MazeSearchEngine {
    private static final Logger log = LoggerFactory.getLogger(MazeSearchEngine.class);

    public static final String REASON_GRAPH_REQUIRED = "SEARCH_GRAPH_REQUIRED";
    public static final String REASON_REQUEST_REQUIRED = "SEARCH_REQUEST_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "SEARCH_ALGORITHM_REQUIRED";
    public static final String REASON_HEURISTIC_REQUIRED = "SEARCH_HEURISTIC_REQUIRED";
    public static final String REASON_HEURISTIC_NOT_SUPPORTED = "SEARCH_HEURISTIC_NOT_SUPPORTED";
    public static final String REASON_HEURISTIC_CONFIGURATION_FAILED = "SEARCH_HEURISTIC_CONFIGURATION_FAILED";
    public static final String REASON_HEURISTIC_LIST_REQUIRED = "SEARCH_HEURISTIC_LIST_REQUIRED";

    private final SearchOptions defaults;
    private final OptimalityOracle oracle;
    private final Map<SearchAlgorithm, SearchPlanner> planners = new EnumMap<>(SearchAlgorithm.class);

    /**
     * Creates an engine using {@link SearchOptions#defaults()}.
     */
    public MazeSearchEngine() {
        this(SearchOptions.defaults());
    }

    /**
     * @param defaults instrumentation defaults for requests that leave flags unset.
     */
    public MazeSearchEngine(SearchOptions defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
        this.oracle = new OptimalityOracle();
        planners.put(SearchAlgorithm.BFS, new BreadthFirstPlanner());
        planners.put(SearchAlgorithm.DFS, new DepthFirstPlanner());
        planners.put(SearchAlgorithm.A_STAR, BestFirstPlanner.aStar());
        planners.put(SearchAlgorithm.GREEDY, BestFirstPlanner.greedy());
    }

    /**
     * Executes one search request.
     *
     * @param graph maze to search.
     * @param request algorithm, heuristic and instrumentation flags.
     * @return path plus optional metrics. An unreachable goal is a normal result with an empty path.
     * @throws MazeSearchException when request contracts fail.
     */
    public SearchResult search(GridGraph graph, SearchRequest request) {
        if (graph == null) {
            throw new MazeSearchException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (request == null) {
            throw new MazeSearchException(REASON_REQUEST_REQUIRED, "search request must be provided");
        }
        SearchAlgorithm algorithm = request.getAlgorithm();
        if (algorithm == null) {
            throw new MazeSearchException(REASON_ALGORITHM_REQUIRED, "algorithm must be specified");
        }

        HeuristicType heuristicType = resolveHeuristicType(algorithm, request);
        Heuristic heuristic = resolveHeuristic(heuristicType, request);
        boolean computeOptimality = flag(request.getComputeOptimality(), defaults.isComputeOptimality());
        boolean withMetrics = computeOptimality || flag(request.getWithMetrics(), defaults.isWithMetrics());

        SearchMetrics metrics = new SearchMetrics();
        long startedAt = System.nanoTime();
        List<Position> path = planners.get(algorithm).plan(graph, heuristic, metrics);
        metrics.recordElapsed(System.nanoTime() - startedAt);

        boolean found = !path.isEmpty();
        metrics.recordOutcome(found, graph.pathCost(path), found ? path.size() - 1 : 0);
        if (computeOptimality) {
            oracle.evaluate(graph, metrics);
        }

        log.debug("{}({}) on {} -> {}", algorithm.getDisplayName(), heuristicType, graph, metrics);

        return SearchResult.builder()
                .algorithm(algorithm)
                .heuristicType(heuristicType)
                .path(path)
                .metrics(withMetrics ? metrics : null)
                .build();
    }

    /**
     * Breadth-first path, without metrics.
     */
    public List<Position> bfs(GridGraph graph) {
        return pathOnly(graph, SearchAlgorithm.BFS, null);
    }

    /**
     * Depth-first path, without metrics.
     */
    public List<Position> dfs(GridGraph graph) {
        return pathOnly(graph, SearchAlgorithm.DFS, null);
    }

    /**
     * A* path guided by {@code heuristic}, without metrics.
     */
    public List<Position> aStar(GridGraph graph, Heuristic heuristic) {
        return pathOnly(graph, SearchAlgorithm.A_STAR, Objects.requireNonNull(heuristic, "heuristic"));
    }

    /**
     * Greedy best-first path guided by {@code heuristic}, without metrics.
     */
    public List<Position> greedy(GridGraph graph, Heuristic heuristic) {
        return pathOnly(graph, SearchAlgorithm.GREEDY, Objects.requireNonNull(heuristic, "heuristic"));
    }

    /**
     * Runs every strategy with metrics and optimality, in report order: BFS, DFS, then A* for
     * each heuristic, then Greedy for each heuristic.
     *
     * @param graph maze to search.
     * @param heuristicTypes heuristics for the informed strategies, in column order.
     * @return one result per run, in report order.
     */
    public List<SearchResult> compareAll(GridGraph graph, List<HeuristicType> heuristicTypes) {
        if (heuristicTypes == null || heuristicTypes.isEmpty()) {
            throw new MazeSearchException(
                    REASON_HEURISTIC_LIST_REQUIRED,
                    "at least one heuristic type is required for informed strategies"
            );
        }
        List<SearchResult> results = new ArrayList<>(2 + 2 * heuristicTypes.size());
        results.add(search(graph, evaluated(SearchAlgorithm.BFS, null)));
        results.add(search(graph, evaluated(SearchAlgorithm.DFS, null)));
        for (HeuristicType type : heuristicTypes) {
            results.add(search(graph, evaluated(SearchAlgorithm.A_STAR, type)));
        }
        for (HeuristicType type : heuristicTypes) {
            results.add(search(graph, evaluated(SearchAlgorithm.GREEDY, type)));
        }
        return results;
    }

    private List<Position> pathOnly(GridGraph graph, SearchAlgorithm algorithm, Heuristic heuristic) {
        return search(graph, SearchRequest.builder()
                .algorithm(algorithm)
                .heuristic(heuristic)
                .withMetrics(false)
                .computeOptimality(false)
                .build()).getPath();
    }

    private static SearchRequest evaluated(SearchAlgorithm algorithm, HeuristicType heuristicType) {
        return SearchRequest.builder()
                .algorithm(algorithm)
                .heuristicType(heuristicType)
                .withMetrics(true)
                .computeOptimality(true)
                .build();
    }

    /**
     * Validates algorithm/heuristic compatibility and returns the effective type.
     */
    private static HeuristicType resolveHeuristicType(SearchAlgorithm algorithm, SearchRequest request) {
        if (!algorithm.isInformed()) {
            boolean typed = request.getHeuristicType() != null && request.getHeuristicType() != HeuristicType.NONE;
            if (typed || request.getHeuristic() != null) {
                throw new MazeSearchException(
                        REASON_HEURISTIC_NOT_SUPPORTED,
                        algorithm.getDisplayName() + " is uninformed and takes no heuristic"
                );
            }
            return HeuristicType.NONE;
        }
        if (request.getHeuristic() != null) {
            return HeuristicType.CUSTOM;
        }
        if (request.getHeuristicType() == null) {
            throw new MazeSearchException(
                    REASON_HEURISTIC_REQUIRED,
                    algorithm.getDisplayName() + " requires a heuristic type or instance"
            );
        }
        return request.getHeuristicType();
    }

    private static Heuristic resolveHeuristic(HeuristicType type, SearchRequest request) {
        if (type == HeuristicType.CUSTOM && request.getHeuristic() != null) {
            return request.getHeuristic();
        }
        try {
            return HeuristicFactory.create(type);
        } catch (HeuristicConfigurationException ex) {
            throw new MazeSearchException(
                    REASON_HEURISTIC_CONFIGURATION_FAILED,
                    "heuristic could not be resolved: " + ex.getMessage(),
                    ex
            );
        }
    }

    private static boolean flag(Boolean requested, boolean fallback) {
        return requested != null ? requested : fallback;
    }
}
