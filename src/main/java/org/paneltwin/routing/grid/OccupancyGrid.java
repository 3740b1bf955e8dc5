package org.paneltwin.routing.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.paneltwin.core.geometry.CellRange;
import org.paneltwin.core.geometry.GeometryUtils;
import org.paneltwin.core.geometry.GridCoordinate;
import org.paneltwin.core.geometry.Vec3;

import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Discretized enclosure volume with one blocked bit per cell.
 *
 * <p>Cells live in a flat array indexed by {@code x + y*W + z*W*H}. The grid carries no
 * search state, so the same instance may be searched any number of times. Not thread-safe.</p>
 */
public final class OccupancyGrid {
    @Getter
    @Accessors(fluent = true)
    private final int cellsX;
    @Getter
    @Accessors(fluent = true)
    private final int cellsY;
    @Getter
    @Accessors(fluent = true)
    private final int cellsZ;
    @Getter
    @Accessors(fluent = true)
    private final double resolution;
    @Getter
    @Accessors(fluent = true)
    private final Vec3 origin;

    private final int layerSize;
    private final int cellCount;
    private final BitSet blocked;
    // owner id -> clipped padded footprint, in registration order
    private final Map<String, CellRange> footprints = new LinkedHashMap<>();

    /**
     * Creates an all-free grid.
     *
     * @param cellsX cells along x; must be {@code > 0}.
     * @param cellsY cells along y; must be {@code > 0}.
     * @param cellsZ cells along z; must be {@code > 0}.
     * @param resolution cell edge length in millimetres.
     * @param origin world position of cell {@code (0,0,0)}'s minimum corner.
     */
    public OccupancyGrid(int cellsX, int cellsY, int cellsZ, double resolution, Vec3 origin) {
        if (cellsX <= 0 || cellsY <= 0 || cellsZ <= 0) {
            throw new IllegalArgumentException(
                    "grid dimensions must be > 0, got " + cellsX + "x" + cellsY + "x" + cellsZ
            );
        }
        long total = (long) cellsX * cellsY * cellsZ;
        if (total > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("grid cell count overflows int: " + total);
        }
        if (!Double.isFinite(resolution) || resolution <= 0.0d) {
            throw new IllegalArgumentException("resolution must be finite and > 0, got " + resolution);
        }
        this.cellsX = cellsX;
        this.cellsY = cellsY;
        this.cellsZ = cellsZ;
        this.resolution = resolution;
        this.origin = Objects.requireNonNull(origin, "origin");
        this.layerSize = cellsX * cellsY;
        this.cellCount = (int) total;
        this.blocked = new BitSet(cellCount);
    }

    public int cellCount() {
        return cellCount;
    }

    public boolean inBounds(GridCoordinate cell) {
        return inBounds(cell.x(), cell.y(), cell.z());
    }

    public boolean inBounds(int x, int y, int z) {
        return x >= 0 && x < cellsX && y >= 0 && y < cellsY && z >= 0 && z < cellsZ;
    }

    /**
     * Flat index of an in-bounds cell.
     *
     * @throws IndexOutOfBoundsException when the cell lies outside the grid.
     */
    public int indexOf(GridCoordinate cell) {
        return indexOf(cell.x(), cell.y(), cell.z());
    }

    public int indexOf(int x, int y, int z) {
        if (!inBounds(x, y, z)) {
            throw new IndexOutOfBoundsException(
                    "cell (" + x + "," + y + "," + z + ") outside " + cellsX + "x" + cellsY + "x" + cellsZ
            );
        }
        return x + y * cellsX + z * layerSize;
    }

    public GridCoordinate coordinateOf(int index) {
        if (index < 0 || index >= cellCount) {
            throw new IndexOutOfBoundsException("cell index " + index + " outside [0," + cellCount + ")");
        }
        int z = index / layerSize;
        int rest = index - z * layerSize;
        int y = rest / cellsX;
        int x = rest - y * cellsX;
        return new GridCoordinate(x, y, z);
    }

    public boolean isBlocked(GridCoordinate cell) {
        return blocked.get(indexOf(cell));
    }

    public boolean isBlocked(int index) {
        return blocked.get(index);
    }

    public int blockedCount() {
        return blocked.cardinality();
    }

    /**
     * Blocks an owner's already-clipped footprint and remembers which cells it covers.
     */
    void blockFootprint(String ownerId, CellRange range) {
        Objects.requireNonNull(ownerId, "ownerId");
        footprints.merge(ownerId, range, (a, b) -> {
            throw new IllegalArgumentException("footprint of " + ownerId + " already registered");
        });
        if (range.isEmpty()) {
            return;
        }
        for (int z = range.minZ(); z <= range.maxZ(); z++) {
            for (int y = range.minY(); y <= range.maxY(); y++) {
                int rowStart = range.minX() + y * cellsX + z * layerSize;
                blocked.set(rowStart, rowStart + (range.maxX() - range.minX()) + 1);
            }
        }
    }

    /**
     * Marks a single cell as blocked.
     */
    public void block(GridCoordinate cell) {
        blocked.set(indexOf(cell));
    }

    /**
     * Frees a terminal cell and the straight corridor in {@code +z} (towards the door) while it
     * stays inside the owner's own footprint, so a route can leave a pin that sits inside its
     * component's padded box.
     *
     * <p>The corridor stops at the first cell that is already free, leaves the owner's
     * footprint, or is also covered by another owner's footprint. Cells of other components are
     * never freed; a pin covered by another component stays blocked.</p>
     *
     * @param terminal cell holding the pin; ignored when outside the grid.
     * @param ownerId id of the component the pin belongs to.
     * @return number of cells that were freed.
     */
    public int openTerminalAccess(GridCoordinate terminal, String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        CellRange own = footprints.get(ownerId);
        if (own == null || !inBounds(terminal)) {
            return 0;
        }
        int x = terminal.x();
        int y = terminal.y();
        int freed = 0;
        for (int z = terminal.z(); z < cellsZ && own.contains(x, y, z); z++) {
            int index = indexOf(x, y, z);
            if (!blocked.get(index) || coveredByOther(ownerId, x, y, z)) {
                break;
            }
            blocked.clear(index);
            freed++;
        }
        return freed;
    }

    private boolean coveredByOther(String ownerId, int x, int y, int z) {
        for (Map.Entry<String, CellRange> entry : footprints.entrySet()) {
            if (!entry.getKey().equals(ownerId) && entry.getValue().contains(x, y, z)) {
                return true;
            }
        }
        return false;
    }

    public GridCoordinate worldToGrid(Vec3 point) {
        return GeometryUtils.worldToGrid(point, resolution, origin);
    }

    public Vec3 gridToWorld(GridCoordinate cell) {
        return GeometryUtils.gridToWorld(cell, resolution, origin);
    }

    @Override
    public String toString() {
        return "OccupancyGrid{" + cellsX + "x" + cellsY + "x" + cellsZ
                + ", resolution=" + resolution
                + ", blocked=" + blockedCount() + "/" + cellCount + '}';
    }
}
