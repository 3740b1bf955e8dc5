package org.paneltwin.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Objects;

/**
 * Named terminal of a component definition.
 *
 * <p>{@code normalizedX}/{@code normalizedY} locate the terminal on the component's front
 * face as fractions of width and height.</p>
 */
@Value
public class LogicalPin {
    String name;
    PinType type;
    double normalizedX;
    double normalizedY;

    @Builder
    @Jacksonized
    public LogicalPin(String name, PinType type, double normalizedX, double normalizedY) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("pin name must be non-blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.normalizedX = requireUnit(normalizedX, name, "normalizedX");
        this.normalizedY = requireUnit(normalizedY, name, "normalizedY");
    }

    private static double requireUnit(double value, String pin, String field) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw new IllegalArgumentException("pin " + pin + ": " + field + " must be within [0, 1], got " + value);
        }
        return value;
    }
}
