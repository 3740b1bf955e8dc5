package org.paneltwin.model;

/**
 * How a wire's current waypoints were obtained.
 */
public enum RoutingMethod {
    /** Orthogonal grid search. */
    MANHATTAN,
    /** User-supplied waypoints. */
    MANUAL
}
