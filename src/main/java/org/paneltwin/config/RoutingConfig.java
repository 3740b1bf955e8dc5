package org.paneltwin.config;

import lombok.Builder;
import lombok.Value;
import org.paneltwin.model.Wire;

/**
 * Runtime tunables for grid construction, search bounds and placement.
 *
 * <p>{@link #defaults()} reads {@code paneltwin.*} system properties once; missing or
 * unparsable values fall back to the built-in defaults.</p>
 */
@Value
@Builder(toBuilder = true)
public class RoutingConfig {
    public static final String PROP_RESOLUTION_MM = "paneltwin.routing.resolutionMm";
    public static final String PROP_CLEARANCE_MM = "paneltwin.routing.clearanceMm";
    public static final String PROP_MAX_EXPANDED_CELLS = "paneltwin.routing.maxExpandedCells";
    public static final String PROP_MAX_GRID_CELLS = "paneltwin.routing.maxGridCells";
    public static final String PROP_MODULE_WIDTH_MM = "paneltwin.placement.moduleWidthMm";
    public static final String PROP_SNAP_TOLERANCE_MM = "paneltwin.placement.snapToleranceMm";
    public static final String PROP_WIRE_THICKNESS_MM = "paneltwin.wire.thicknessMm";

    public static final double DEFAULT_RESOLUTION_MM = 10.0d;
    public static final double DEFAULT_CLEARANCE_MM = 5.0d;
    public static final int DEFAULT_MAX_EXPANDED_CELLS = 2_000_000;
    public static final int DEFAULT_MAX_GRID_CELLS = 8_000_000;
    public static final double DEFAULT_MODULE_WIDTH_MM = 17.5d;
    public static final double DEFAULT_SNAP_TOLERANCE_MM = 30.0d;

    /** Grid cell edge length used when callers do not pass one. */
    @Builder.Default
    double resolutionMm = DEFAULT_RESOLUTION_MM;
    /** Padding added around every placed component when marking obstacles. */
    @Builder.Default
    double clearanceMm = DEFAULT_CLEARANCE_MM;
    /** Search budget; values {@code <= 0} mean unbounded. */
    @Builder.Default
    int maxExpandedCells = DEFAULT_MAX_EXPANDED_CELLS;
    /** Upper bound on cells per grid; larger grids are rejected. */
    @Builder.Default
    int maxGridCells = DEFAULT_MAX_GRID_CELLS;
    /** Width of one DIN module. */
    @Builder.Default
    double moduleWidthMm = DEFAULT_MODULE_WIDTH_MM;
    /** Maximum perpendicular distance at which a component snaps onto a rail. */
    @Builder.Default
    double snapToleranceMm = DEFAULT_SNAP_TOLERANCE_MM;
    /** Diameter given to new wires. */
    @Builder.Default
    double wireThicknessMm = Wire.DEFAULT_THICKNESS_MM;

    /**
     * Loads configuration from system properties.
     */
    public static RoutingConfig defaults() {
        return RoutingConfig.builder()
                .resolutionMm(readDouble(PROP_RESOLUTION_MM, DEFAULT_RESOLUTION_MM))
                .clearanceMm(readDouble(PROP_CLEARANCE_MM, DEFAULT_CLEARANCE_MM))
                .maxExpandedCells(readInt(PROP_MAX_EXPANDED_CELLS, DEFAULT_MAX_EXPANDED_CELLS))
                .maxGridCells(readInt(PROP_MAX_GRID_CELLS, DEFAULT_MAX_GRID_CELLS))
                .moduleWidthMm(readDouble(PROP_MODULE_WIDTH_MM, DEFAULT_MODULE_WIDTH_MM))
                .snapToleranceMm(readDouble(PROP_SNAP_TOLERANCE_MM, DEFAULT_SNAP_TOLERANCE_MM))
                .wireThicknessMm(readDouble(PROP_WIRE_THICKNESS_MM, Wire.DEFAULT_THICKNESS_MM))
                .build();
    }

    private static double readDouble(String property, double fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
