package org.paneltwin.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.paneltwin.core.geometry.Vec3;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable catalog template shared by every instance of a part.
 */
@Value
public class ComponentDefinition {
    String id;
    ComponentType type;
    String manufacturer;
    String modelNumber;
    String displayName;
    PhysicalDimensions dimensions;
    boolean railMountable;
    List<LogicalPin> pins;

    @Builder
    @Jacksonized
    public ComponentDefinition(
            String id,
            ComponentType type,
            String manufacturer,
            String modelNumber,
            String displayName,
            PhysicalDimensions dimensions,
            boolean railMountable,
            @Singular List<LogicalPin> pins
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("definition id must be non-blank");
        }
        this.id = id;
        this.type = Objects.requireNonNull(type, "type");
        this.manufacturer = manufacturer;
        this.modelNumber = modelNumber;
        this.displayName = displayName == null ? id : displayName;
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        this.railMountable = railMountable;
        this.pins = List.copyOf(Objects.requireNonNull(pins, "pins"));

        Set<String> seen = new HashSet<>();
        for (LogicalPin pin : this.pins) {
            if (!seen.add(pin.getName())) {
                throw new IllegalArgumentException("definition " + id + ": duplicate pin name " + pin.getName());
            }
        }
    }

    /**
     * Looks up a pin by name.
     */
    public Optional<LogicalPin> findPin(String pinName) {
        for (LogicalPin pin : pins) {
            if (pin.getName().equals(pinName)) {
                return Optional.of(pin);
            }
        }
        return Optional.empty();
    }

    /**
     * Offset of a pin from the instance's physical position (minimum footprint corner).
     * Pins sit on the front ({@code +z}) face.
     */
    public Vec3 pinOffset(LogicalPin pin) {
        return new Vec3(
                pin.getNormalizedX() * dimensions.getWidth(),
                pin.getNormalizedY() * dimensions.getHeight(),
                dimensions.getDepth()
        );
    }
}
