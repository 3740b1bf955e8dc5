package org.paneltwin.routing.search;

import lombok.experimental.UtilityClass;
import org.paneltwin.core.geometry.GridCoordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses straight runs of a cell path to their end points.
 *
 * <p>Works on integer cells so that direction comparisons are exact.</p>
 */
@UtilityClass
public final class WaypointReducer {

    /**
     * Keeps the first cell, the last cell and every cell where the step direction changes.
     */
    public static List<GridCoordinate> reduce(List<GridCoordinate> path) {
        if (path.size() <= 2) {
            return List.copyOf(path);
        }
        List<GridCoordinate> kept = new ArrayList<>();
        kept.add(path.get(0));
        for (int i = 1; i < path.size() - 1; i++) {
            GridCoordinate prev = path.get(i - 1);
            GridCoordinate cur = path.get(i);
            GridCoordinate next = path.get(i + 1);
            if (!sameDirection(prev, cur, next)) {
                kept.add(cur);
            }
        }
        kept.add(path.get(path.size() - 1));
        return kept;
    }

    private static boolean sameDirection(GridCoordinate a, GridCoordinate b, GridCoordinate c) {
        return b.x() - a.x() == c.x() - b.x()
                && b.y() - a.y() == c.y() - b.y()
                && b.z() - a.z() == c.z() - b.z();
    }
}
