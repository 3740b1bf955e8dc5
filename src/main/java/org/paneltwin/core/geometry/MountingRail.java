package org.paneltwin.core.geometry;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * Linear DIN-style track onto which components snap at fixed module increments.
 *
 * <p>The anchor is the rail's start point; the rail extends {@code length} millimetres along
 * its orientation axis. Rails are only read by snapping and are never mutated.</p>
 */
@Value
public class MountingRail {
    /** Rail identifier, unique within an enclosure. */
    String id;
    /** Start point of the rail in world space. */
    Vec3 anchor;
    /** Rail length in millimetres. */
    double length;
    /** Axis the rail runs along. */
    RailOrientation orientation;
    /** Maximum number of modules the rail can carry. */
    int maxModules;

    @Builder
    @Jacksonized
    public MountingRail(String id, Vec3 anchor, double length, RailOrientation orientation, int maxModules) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("rail id must be non-blank");
        }
        this.id = id;
        this.anchor = Objects.requireNonNull(anchor, "anchor");
        if (!anchor.allFinite()) {
            throw new IllegalArgumentException("rail " + id + ": anchor must be finite");
        }
        if (!Double.isFinite(length) || length <= 0.0d) {
            throw new IllegalArgumentException("rail " + id + ": length must be > 0, got " + length);
        }
        this.length = length;
        this.orientation = Objects.requireNonNull(orientation, "orientation");
        if (maxModules <= 0) {
            throw new IllegalArgumentException("rail " + id + ": maxModules must be > 0, got " + maxModules);
        }
        this.maxModules = maxModules;
    }

    /**
     * Returns the far end of the rail.
     */
    public Vec3 endPoint() {
        Axis axis = orientation.alongAxis();
        return anchor.withComponent(axis, anchor.component(axis) + length);
    }
}
