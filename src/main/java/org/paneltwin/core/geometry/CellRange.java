package org.paneltwin.core.geometry;

/**
 * Inclusive cell index range covered by a box, already clipped to grid bounds.
 */
public record CellRange(int minX, int minY, int minZ, int maxX, int maxY, int maxZ) {

    public boolean isEmpty() {
        return minX > maxX || minY > maxY || minZ > maxZ;
    }

    public boolean contains(int x, int y, int z) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY && z >= minZ && z <= maxZ;
    }

    public long cellCount() {
        if (isEmpty()) {
            return 0L;
        }
        return (long) (maxX - minX + 1) * (maxY - minY + 1) * (maxZ - minZ + 1);
    }
}
