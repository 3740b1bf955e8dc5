package org.paneltwin.routing.grid;

import org.paneltwin.config.RoutingConfig;
import org.paneltwin.core.geometry.BoundingBox;
import org.paneltwin.core.geometry.CellRange;
import org.paneltwin.core.geometry.GeometryUtils;
import org.paneltwin.model.ComponentInstance;
import org.paneltwin.model.Enclosure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;

/**
 * Rasterizes placed component footprints into an {@link OccupancyGrid}.
 *
 * <p>Each placed instance blocks every cell its padded footprint overlaps. The blocked set is
 * a union of boxes, so the result does not depend on instance order.</p>
 */
public final class OccupancyGridBuilder {
    private static final Logger log = LoggerFactory.getLogger(OccupancyGridBuilder.class);

    private final double clearance;
    private final int maxGridCells;

    /**
     * @param clearance padding in millimetres around each footprint; must be {@code >= 0}.
     * @param maxGridCells largest accepted cell count; {@code <= 0} means unbounded.
     */
    public OccupancyGridBuilder(double clearance, int maxGridCells) {
        if (!Double.isFinite(clearance) || clearance < 0.0d) {
            throw new IllegalArgumentException("clearance must be finite and >= 0, got " + clearance);
        }
        this.clearance = clearance;
        this.maxGridCells = maxGridCells <= 0 ? Integer.MAX_VALUE : maxGridCells;
    }

    public OccupancyGridBuilder(RoutingConfig config) {
        this(config.getClearanceMm(), config.getMaxGridCells());
    }

    /**
     * Builds a fresh grid for the enclosure.
     *
     * @param enclosure panel volume; every dimension must be {@code > 0}.
     * @param instances candidate obstacles; unplaced instances are skipped.
     * @param resolution cell edge length in millimetres; must be {@code > 0}.
     * @throws InvalidGridParametersException on malformed enclosure or resolution.
     */
    public OccupancyGrid build(Enclosure enclosure, Collection<ComponentInstance> instances, double resolution) {
        Objects.requireNonNull(enclosure, "enclosure");
        Objects.requireNonNull(instances, "instances");
        if (!Double.isFinite(resolution) || resolution <= 0.0d) {
            throw new InvalidGridParametersException(
                    InvalidGridParametersException.REASON_RESOLUTION_INVALID,
                    "resolution must be finite and > 0, got " + resolution
            );
        }
        if (!enclosure.hasVolume()) {
            throw new InvalidGridParametersException(
                    InvalidGridParametersException.REASON_DIMENSION_INVALID,
                    "enclosure " + enclosure.getId() + " dimensions must be > 0, got "
                            + enclosure.getWidth() + "x" + enclosure.getHeight() + "x" + enclosure.getDepth()
            );
        }

        long cellsX = cellsAlong(enclosure.getWidth(), resolution);
        long cellsY = cellsAlong(enclosure.getHeight(), resolution);
        long cellsZ = cellsAlong(enclosure.getDepth(), resolution);
        // double product cannot overflow for absurd extent/resolution ratios
        double total = (double) cellsX * cellsY * cellsZ;
        if (total > maxGridCells) {
            throw new InvalidGridParametersException(
                    InvalidGridParametersException.REASON_TOO_MANY_CELLS,
                    "grid of " + cellsX + "x" + cellsY + "x" + cellsZ + " = " + (long) total
                            + " cells exceeds limit " + maxGridCells + " at resolution " + resolution
            );
        }

        OccupancyGrid grid = new OccupancyGrid(
                (int) cellsX,
                (int) cellsY,
                (int) cellsZ,
                resolution,
                enclosure.getOrigin()
        );
        int obstacles = 0;
        for (ComponentInstance instance : instances) {
            if (!instance.isPhysicallyPlaced()) {
                continue;
            }
            BoundingBox box = instance.paddedBounds(clearance);
            CellRange range = GeometryUtils.boxToCellRange(
                    box,
                    resolution,
                    grid.origin(),
                    grid.cellsX(),
                    grid.cellsY(),
                    grid.cellsZ()
            );
            grid.blockFootprint(instance.getInstanceId(), range);
            obstacles++;
        }
        log.debug("Built {} from {} obstacle(s)", grid, obstacles);
        return grid;
    }

    private static long cellsAlong(double extent, double resolution) {
        return Math.max(1L, (long) Math.ceil(extent / resolution));
    }
}
