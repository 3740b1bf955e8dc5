package org.paneltwin.routing.search;

import java.util.BitSet;

/**
 * Closed set of grid cells, one bit per cell.
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. Each search owns its own
 * instance.
 * </p>
 */
public class VisitedSet {

    private final BitSet visited;

    /**
     * @param cellCount number of cells in the grid being searched.
     */
    public VisitedSet(int cellCount) {
        this.visited = new BitSet(cellCount);
    }

    /**
     * Marks a cell as visited.
     *
     * @param cellIndex flat cell index.
     * @return {@code true} if the cell was not visited before.
     */
    public boolean markVisited(int cellIndex) {
        if (visited.get(cellIndex)) {
            return false;
        }
        visited.set(cellIndex);
        return true;
    }

    public boolean isVisited(int cellIndex) {
        return visited.get(cellIndex);
    }
}
