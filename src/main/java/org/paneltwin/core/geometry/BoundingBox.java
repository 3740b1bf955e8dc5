package org.paneltwin.core.geometry;

import java.util.Objects;

/**
 * Axis-aligned box in world millimetres.
 *
 * @param min minimum corner (inclusive).
 * @param max maximum corner (inclusive).
 */
public record BoundingBox(Vec3 min, Vec3 max) {

    public BoundingBox {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.x() > max.x() || min.y() > max.y() || min.z() > max.z()) {
            throw new IllegalArgumentException("min corner must not exceed max corner: " + min + " > " + max);
        }
    }

    /**
     * Creates a box from its minimum corner and positive extents.
     */
    public static BoundingBox ofCorner(Vec3 corner, Vec3 size) {
        if (size.x() < 0.0d || size.y() < 0.0d || size.z() < 0.0d) {
            throw new IllegalArgumentException("box size must be >= 0 on every axis: " + size);
        }
        return new BoundingBox(corner, corner.plus(size));
    }

    /**
     * Returns this box grown by {@code margin} on every side.
     */
    public BoundingBox padded(double margin) {
        if (margin < 0.0d || !Double.isFinite(margin)) {
            throw new IllegalArgumentException("margin must be finite and >= 0, got " + margin);
        }
        Vec3 pad = new Vec3(margin, margin, margin);
        return new BoundingBox(min.minus(pad), max.plus(pad));
    }

    /**
     * Strict overlap test; boxes that only share a face, edge or corner do not intersect.
     */
    public boolean intersects(BoundingBox other) {
        return min.x() < other.max.x() && max.x() > other.min.x()
                && min.y() < other.max.y() && max.y() > other.min.y()
                && min.z() < other.max.z() && max.z() > other.min.z();
    }

    /**
     * Inclusive containment test.
     */
    public boolean contains(Vec3 point) {
        return point.x() >= min.x() && point.x() <= max.x()
                && point.y() >= min.y() && point.y() <= max.y()
                && point.z() >= min.z() && point.z() <= max.z();
    }

    public Vec3 size() {
        return max.minus(min);
    }
}
