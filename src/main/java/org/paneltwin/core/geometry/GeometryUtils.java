package org.paneltwin.core.geometry;

import lombok.experimental.UtilityClass;

import java.util.Objects;
import java.util.Optional;

/**
 * Pure geometry helpers shared by grid construction, placement and snapping.
 */
@UtilityClass
public final class GeometryUtils {

    /**
     * Strict axis-aligned overlap test; touching boxes do not intersect.
     */
    public static boolean boxesIntersect(BoundingBox a, BoundingBox b) {
        return a.intersects(b);
    }

    /**
     * Inclusive point-in-box test.
     */
    public static boolean pointInBox(Vec3 point, BoundingBox box) {
        return box.contains(point);
    }

    /**
     * Maps a world point to the grid cell containing it using floor division.
     *
     * @param point world position.
     * @param resolution cell edge length in millimetres.
     * @param origin world position of the grid's minimum corner.
     * @return cell coordinate, possibly outside the grid.
     */
    public static GridCoordinate worldToGrid(Vec3 point, double resolution, Vec3 origin) {
        requireResolution(resolution);
        return new GridCoordinate(
                floorToCell(point.x() - origin.x(), resolution),
                floorToCell(point.y() - origin.y(), resolution),
                floorToCell(point.z() - origin.z(), resolution)
        );
    }

    /**
     * Maps a cell to the world position of its centre. Inverse of {@link #worldToGrid}.
     */
    public static Vec3 gridToWorld(GridCoordinate cell, double resolution, Vec3 origin) {
        requireResolution(resolution);
        return new Vec3(
                origin.x() + (cell.x() + 0.5d) * resolution,
                origin.y() + (cell.y() + 0.5d) * resolution,
                origin.z() + (cell.z() + 0.5d) * resolution
        );
    }

    /**
     * Returns the inclusive range of cells whose interior a box overlaps, clipped to
     * {@code [0, cells)} on each axis.
     *
     * <p>A box face that lies exactly on a cell boundary does not claim the neighbouring
     * cell, matching the strict semantics of {@link #boxesIntersect}.</p>
     */
    public static CellRange boxToCellRange(
            BoundingBox box,
            double resolution,
            Vec3 origin,
            int cellsX,
            int cellsY,
            int cellsZ
    ) {
        requireResolution(resolution);
        Vec3 lo = box.min().minus(origin);
        Vec3 hi = box.max().minus(origin);
        return new CellRange(
                Math.max(0, floorToCell(lo.x(), resolution)),
                Math.max(0, floorToCell(lo.y(), resolution)),
                Math.max(0, floorToCell(lo.z(), resolution)),
                Math.min(cellsX - 1, ceilToCell(hi.x(), resolution) - 1),
                Math.min(cellsY - 1, ceilToCell(hi.y(), resolution) - 1),
                Math.min(cellsZ - 1, ceilToCell(hi.z(), resolution) - 1)
        );
    }

    /**
     * Quantizes a position onto a rail at whole-module increments.
     *
     * <p>The position qualifies when its distance to the rail line on each perpendicular
     * axis is at most {@code snapTolerance}. The along-rail offset is rounded to the
     * nearest module and the slot is clamped to {@code [0, maxModules - 1]}.</p>
     *
     * @return snapped position and slot, or empty when the rail is too far away.
     */
    public static Optional<RailSnap> quantizeToRail(
            Vec3 position,
            MountingRail rail,
            double moduleWidth,
            double snapTolerance
    ) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(rail, "rail");
        if (!Double.isFinite(moduleWidth) || moduleWidth <= 0.0d) {
            throw new IllegalArgumentException("moduleWidth must be > 0, got " + moduleWidth);
        }
        if (!Double.isFinite(snapTolerance) || snapTolerance < 0.0d) {
            throw new IllegalArgumentException("snapTolerance must be >= 0, got " + snapTolerance);
        }

        Axis along = rail.getOrientation().alongAxis();
        Vec3 anchor = rail.getAnchor();
        for (Axis axis : Axis.values()) {
            if (axis == along) {
                continue;
            }
            if (Math.abs(position.component(axis) - anchor.component(axis)) > snapTolerance) {
                return Optional.empty();
            }
        }

        double offset = position.component(along) - anchor.component(along);
        long rounded = Math.round(offset / moduleWidth);
        int slot = (int) Math.max(0L, Math.min(rail.getMaxModules() - 1L, rounded));
        Vec3 snapped = anchor.withComponent(along, anchor.component(along) + slot * moduleWidth);
        return Optional.of(new RailSnap(rail.getId(), snapped, slot));
    }

    private static int floorToCell(double offset, double resolution) {
        return (int) Math.floor(offset / resolution);
    }

    private static int ceilToCell(double offset, double resolution) {
        return (int) Math.ceil(offset / resolution);
    }

    private static void requireResolution(double resolution) {
        if (!Double.isFinite(resolution) || resolution <= 0.0d) {
            throw new IllegalArgumentException("resolution must be finite and > 0, got " + resolution);
        }
    }
}
