package org.paneltwin.core.geometry;

/**
 * Integer cell address inside an occupancy grid.
 */
public record GridCoordinate(int x, int y, int z) {

    public static GridCoordinate of(int x, int y, int z) {
        return new GridCoordinate(x, y, z);
    }

    /**
     * Manhattan (L1) distance in cells.
     */
    public int manhattanDistance(GridCoordinate other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y) + Math.abs(z - other.z);
    }

    public GridCoordinate offset(int dx, int dy, int dz) {
        return new GridCoordinate(x + dx, y + dy, z + dz);
    }
}
