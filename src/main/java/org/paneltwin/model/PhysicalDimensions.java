package org.paneltwin.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.paneltwin.core.geometry.Vec3;

/**
 * Outer footprint of a component in millimetres.
 */
@Value
public class PhysicalDimensions {
    double width;
    double height;
    double depth;
    /** Width expressed in DIN modules (informational, may be fractional). */
    double dinModules;

    @Builder
    @Jacksonized
    public PhysicalDimensions(double width, double height, double depth, double dinModules) {
        this.width = requirePositive(width, "width");
        this.height = requirePositive(height, "height");
        this.depth = requirePositive(depth, "depth");
        if (!Double.isFinite(dinModules) || dinModules < 0.0d) {
            throw new IllegalArgumentException("dinModules must be >= 0, got " + dinModules);
        }
        this.dinModules = dinModules;
    }

    public static PhysicalDimensions of(double width, double height, double depth) {
        return new PhysicalDimensions(width, height, depth, 0.0d);
    }

    /**
     * Extents as a vector {@code (width, height, depth)}.
     */
    public Vec3 asSize() {
        return new Vec3(width, height, depth);
    }

    private static double requirePositive(double value, String field) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(field + " must be finite and > 0, got " + value);
        }
        return value;
    }
}
