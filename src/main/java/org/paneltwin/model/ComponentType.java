package org.paneltwin.model;

/**
 * Catalog component families. Used as the label prefix for new instances.
 */
public enum ComponentType {
    MCB,
    RELAY,
    CONTACTOR,
    PLC,
    TIMER,
    SENSOR,
    TERMINAL,
    POWER_SUPPLY,
    MOTOR
}
