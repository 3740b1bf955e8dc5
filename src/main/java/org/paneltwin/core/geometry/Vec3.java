package org.paneltwin.core.geometry;

/**
 * Immutable 3D point or offset in world millimetres.
 *
 * @param x x coordinate (enclosure width axis).
 * @param y y coordinate (enclosure height axis).
 * @param z z coordinate (enclosure depth axis, {@code +z} faces the door).
 */
public record Vec3(double x, double y, double z) {
    public static final Vec3 ZERO = new Vec3(0.0d, 0.0d, 0.0d);

    public Vec3 plus(Vec3 other) {
        return new Vec3(x + other.x, y + other.y, z + other.z);
    }

    public Vec3 minus(Vec3 other) {
        return new Vec3(x - other.x, y - other.y, z - other.z);
    }

    /**
     * Euclidean distance to another point.
     */
    public double distanceTo(Vec3 other) {
        double dx = other.x - x;
        double dy = other.y - y;
        double dz = other.z - z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Returns the coordinate on one axis.
     */
    public double component(Axis axis) {
        return switch (axis) {
            case X -> x;
            case Y -> y;
            case Z -> z;
        };
    }

    /**
     * Returns a copy with one axis replaced.
     */
    public Vec3 withComponent(Axis axis, double value) {
        return switch (axis) {
            case X -> new Vec3(value, y, z);
            case Y -> new Vec3(x, value, z);
            case Z -> new Vec3(x, y, value);
        };
    }

    /**
     * Returns whether all three coordinates are finite.
     */
    public boolean allFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
