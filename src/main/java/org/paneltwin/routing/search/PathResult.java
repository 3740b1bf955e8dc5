package org.paneltwin.routing.search;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.paneltwin.core.geometry.GridCoordinate;
import org.paneltwin.core.geometry.Vec3;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one path search: either a routed polyline or an unroutable reason.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PathResult {
    boolean routed;
    UnroutableReason reason;
    /** Reduced polyline in world coordinates; empty when unroutable. */
    List<Vec3> waypoints;
    /** Every cell of the found path, start and goal included; empty when unroutable. */
    List<GridCoordinate> cells;
    /** Number of unit moves between start and goal. */
    int gridSteps;
    /** Cells popped from the open set before the search ended. */
    int expandedCells;

    public static PathResult routed(List<Vec3> waypoints, List<GridCoordinate> cells, int expandedCells) {
        Objects.requireNonNull(waypoints, "waypoints");
        Objects.requireNonNull(cells, "cells");
        if (cells.isEmpty()) {
            throw new IllegalArgumentException("routed path must contain at least one cell");
        }
        return new PathResult(true, null, List.copyOf(waypoints), List.copyOf(cells), cells.size() - 1, expandedCells);
    }

    public static PathResult unroutable(UnroutableReason reason, int expandedCells) {
        return new PathResult(false, Objects.requireNonNull(reason, "reason"), List.of(), List.of(), 0, expandedCells);
    }

    public static PathResult unroutable(UnroutableReason reason) {
        return unroutable(reason, 0);
    }

    public boolean isEffectivelyNoPath() {
        return !routed && reason.isEffectivelyNoPath();
    }
}
