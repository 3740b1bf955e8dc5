package org.paneltwin.core.geometry;

/**
 * Direction in which a mounting rail runs.
 */
public enum RailOrientation {
    /** Rail runs along the x axis. */
    HORIZONTAL,
    /** Rail runs along the y axis. */
    VERTICAL;

    /**
     * Axis along which modules are stacked.
     */
    public Axis alongAxis() {
        return switch (this) {
            case HORIZONTAL -> Axis.X;
            case VERTICAL -> Axis.Y;
        };
    }
}
