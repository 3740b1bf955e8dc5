package org.paneltwin.routing.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.paneltwin.config.RoutingConfig;
import org.paneltwin.core.geometry.GridCoordinate;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.routing.grid.OccupancyGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shortest axis-aligned path search on an {@link OccupancyGrid}.
 *
 * <p>A* with unit step cost and the Manhattan distance as heuristic, which is admissible and
 * consistent on a 6-connected grid, so the first time the goal is popped its path is a shortest
 * one. Neighbours are generated in the fixed order {@code +x, -x, +y, -y, +z, -z}; ties on
 * {@code f} are broken LIFO by {@link FrontierQueue}. Together these make the returned path a
 * pure function of the grid and the endpoints.</p>
 *
 * <p>The engine keeps no per-query state between calls and never mutates the grid. Failures
 * are reported as {@link PathResult#unroutable(UnroutableReason, int)}, never thrown.</p>
 */
public final class PathSearchEngine {
    private static final Logger log = LoggerFactory.getLogger(PathSearchEngine.class);

    private static final int UNSEEN = Integer.MAX_VALUE;
    private static final int NO_PARENT = -1;

    private static final int[] DX = {1, -1, 0, 0, 0, 0};
    private static final int[] DY = {0, 0, 1, -1, 0, 0};
    private static final int[] DZ = {0, 0, 0, 0, 1, -1};

    private final SearchBudget budget;

    /**
     * Creates an engine bounded by {@link RoutingConfig#defaults()}.
     */
    public PathSearchEngine() {
        this(RoutingConfig.defaults());
    }

    public PathSearchEngine(RoutingConfig config) {
        this.budget = SearchBudget.from(config);
    }

    /**
     * @param maxExpandedCells bound on cells expanded per search; {@code <= 0} means unbounded.
     */
    public PathSearchEngine(int maxExpandedCells) {
        this.budget = SearchBudget.of(maxExpandedCells);
    }

    /**
     * Finds a path between two world points, each mapped to the cell containing it.
     */
    public PathResult findPath(OccupancyGrid grid, Vec3 startWorld, Vec3 goalWorld) {
        if (!startWorld.allFinite() || !goalWorld.allFinite()) {
            log.debug("Endpoint not finite: {} -> {}", startWorld, goalWorld);
            return PathResult.unroutable(UnroutableReason.OUT_OF_BOUNDS);
        }
        return findPath(grid, grid.worldToGrid(startWorld), grid.worldToGrid(goalWorld));
    }

    /**
     * Finds a path between two grid cells.
     */
    public PathResult findPath(OccupancyGrid grid, GridCoordinate start, GridCoordinate goal) {
        if (!grid.inBounds(start) || !grid.inBounds(goal)) {
            log.debug("Endpoint outside {}: {} -> {}", grid, start, goal);
            return PathResult.unroutable(UnroutableReason.OUT_OF_BOUNDS);
        }
        int startIndex = grid.indexOf(start);
        int goalIndex = grid.indexOf(goal);
        if (grid.isBlocked(startIndex) || grid.isBlocked(goalIndex)) {
            log.debug("Endpoint blocked: {} -> {}", start, goal);
            return PathResult.unroutable(UnroutableReason.ENDPOINT_BLOCKED);
        }
        if (startIndex == goalIndex) {
            return PathResult.routed(List.of(grid.gridToWorld(start)), List.of(start), 0);
        }

        try {
            return search(grid, startIndex, goalIndex, goal);
        } catch (SearchBudget.BudgetExceededException ex) {
            log.warn("[{}] {} -> {} on {}: {}", ex.reasonCode(), start, goal, grid, ex.getMessage());
            return PathResult.unroutable(UnroutableReason.SEARCH_LIMIT_EXCEEDED, budget.maxExpandedCells());
        }
    }

    private PathResult search(OccupancyGrid grid, int startIndex, int goalIndex, GridCoordinate goal) {
        int cellCount = grid.cellCount();
        int cellsX = grid.cellsX();
        int layerSize = cellsX * grid.cellsY();

        int[] gScore = new int[cellCount];
        Arrays.fill(gScore, UNSEEN);
        int[] parent = new int[cellCount];
        VisitedSet closed = new VisitedSet(cellCount);
        FrontierQueue open = new FrontierQueue(cellCount);

        gScore[startIndex] = 0;
        parent[startIndex] = NO_PARENT;
        open.insertOrDecrease(startIndex, heuristic(startIndex, cellsX, layerSize, goal));

        int expanded = 0;
        while (!open.isEmpty()) {
            int current = open.extractMin();
            if (current == goalIndex) {
                return buildResult(grid, parent, goalIndex, expanded, open.peakSize());
            }
            closed.markVisited(current);
            expanded++;
            budget.checkExpandedCells(expanded);

            int z = current / layerSize;
            int rest = current - z * layerSize;
            int y = rest / cellsX;
            int x = rest - y * cellsX;
            int nextG = gScore[current] + 1;

            for (int dir = 0; dir < DX.length; dir++) {
                int nx = x + DX[dir];
                int ny = y + DY[dir];
                int nz = z + DZ[dir];
                if (!grid.inBounds(nx, ny, nz)) {
                    continue;
                }
                int neighbor = nx + ny * cellsX + nz * layerSize;
                if (closed.isVisited(neighbor) || grid.isBlocked(neighbor)) {
                    continue;
                }
                if (nextG < gScore[neighbor]) {
                    gScore[neighbor] = nextG;
                    parent[neighbor] = current;
                    open.insertOrDecrease(neighbor, nextG + heuristic(neighbor, cellsX, layerSize, goal));
                }
            }
        }

        log.debug("No path to {} on {} after {} expansions", goal, grid, expanded);
        return PathResult.unroutable(UnroutableReason.NO_PATH, expanded);
    }

    private static int heuristic(int index, int cellsX, int layerSize, GridCoordinate goal) {
        int z = index / layerSize;
        int rest = index - z * layerSize;
        int y = rest / cellsX;
        int x = rest - y * cellsX;
        return Math.abs(x - goal.x()) + Math.abs(y - goal.y()) + Math.abs(z - goal.z());
    }

    private static PathResult buildResult(
            OccupancyGrid grid,
            int[] parent,
            int goalIndex,
            int expanded,
            int frontierPeak
    ) {
        IntArrayList reversed = new IntArrayList();
        int cursor = goalIndex;
        while (cursor != NO_PARENT) {
            reversed.add(cursor);
            cursor = parent[cursor];
        }

        List<GridCoordinate> cells = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            cells.add(grid.coordinateOf(reversed.getInt(i)));
        }

        List<GridCoordinate> corners = WaypointReducer.reduce(cells);
        List<Vec3> waypoints = new ArrayList<>(corners.size());
        for (GridCoordinate corner : corners) {
            waypoints.add(grid.gridToWorld(corner));
        }
        log.debug("Path of {} steps ({} waypoints) after {} expansions, frontier peak {}",
                cells.size() - 1, waypoints.size(), expanded, frontierPeak);
        return PathResult.routed(waypoints, cells, expanded);
    }
}
