package org.paneltwin.model;

import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Unordered electrical link between two pins.
 */
@Value
public class LogicalConnection {
    String id;
    PinRef fromPin;
    PinRef toPin;
    WireType wireType;
    /** Optional wire label, for example {@code L1} or {@code 24VDC}. */
    String label;

    @Builder
    public LogicalConnection(String id, PinRef fromPin, PinRef toPin, WireType wireType, String label) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("connection id must be non-blank");
        }
        this.id = id;
        this.fromPin = Objects.requireNonNull(fromPin, "fromPin");
        this.toPin = Objects.requireNonNull(toPin, "toPin");
        this.wireType = Objects.requireNonNull(wireType, "wireType");
        this.label = label;
    }

    /**
     * Returns whether either end belongs to the given instance.
     */
    public boolean references(String instanceId) {
        return fromPin.instanceId().equals(instanceId) || toPin.instanceId().equals(instanceId);
    }

    /**
     * Returns whether both connections join the same two pins, in either direction. Id, wire
     * type and label are ignored.
     */
    public boolean equalsIgnoringOrder(LogicalConnection other) {
        if (other == null) {
            return false;
        }
        return (fromPin.equals(other.fromPin) && toPin.equals(other.toPin))
                || (fromPin.equals(other.toPin) && toPin.equals(other.fromPin));
    }
}
