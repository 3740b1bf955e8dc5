package org.paneltwin.core.geometry;

/**
 * World-space axes. Routing only ever moves along one of these at a time.
 */
public enum Axis {
    X,
    Y,
    Z
}
