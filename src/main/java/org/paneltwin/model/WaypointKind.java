package org.paneltwin.model;

/**
 * Origin of a wire waypoint.
 */
public enum WaypointKind {
    /** Produced by the path search engine. */
    COMPUTED,
    /** Placed by the user; survives snapshots. */
    USER_ANCHORED
}
