package org.paneltwin.model;

import org.paneltwin.core.geometry.Vec3;

import java.util.Objects;

/**
 * One vertex of a wire polyline.
 */
public record Waypoint(Vec3 position, WaypointKind kind) {

    public Waypoint {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(kind, "kind");
    }

    public static Waypoint computed(Vec3 position) {
        return new Waypoint(position, WaypointKind.COMPUTED);
    }

    public static Waypoint anchored(Vec3 position) {
        return new Waypoint(position, WaypointKind.USER_ANCHORED);
    }
}
