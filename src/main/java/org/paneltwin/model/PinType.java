package org.paneltwin.model;

/**
 * Electrical role of a terminal.
 */
public enum PinType {
    POWER,
    GROUND,
    NEUTRAL,
    INPUT,
    OUTPUT
}
