package org.paneltwin.model;

/**
 * 2D position on the schematic canvas. Opaque to the routing core.
 */
public record SchematicPoint(double x, double y) {
    public static final SchematicPoint ORIGIN = new SchematicPoint(0.0d, 0.0d);
}
