package org.paneltwin.model;

import java.util.Objects;

/**
 * Wire classification; drives rendering color.
 */
public enum WireType {
    POWER,
    SIGNAL,
    GROUND;

    /**
     * Rendering color as {@code #RRGGBB}.
     */
    public String color() {
        return switch (this) {
            case POWER -> "#FF0000";
            case SIGNAL -> "#0000FF";
            case GROUND -> "#00FF00";
        };
    }

    /**
     * Derives a wire type from the two terminal types it joins.
     *
     * <p>Ground wins over power, power (or neutral) wins over signal.</p>
     */
    public static WireType between(PinType a, PinType b) {
        Objects.requireNonNull(a, "a");
        Objects.requireNonNull(b, "b");
        if (a == PinType.GROUND || b == PinType.GROUND) {
            return GROUND;
        }
        if (carriesPower(a) || carriesPower(b)) {
            return POWER;
        }
        return SIGNAL;
    }

    private static boolean carriesPower(PinType type) {
        return switch (type) {
            case POWER, NEUTRAL -> true;
            case GROUND, INPUT, OUTPUT -> false;
        };
    }
}
