package org.paneltwin.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;
import org.paneltwin.core.geometry.BoundingBox;
import org.paneltwin.core.geometry.Vec3;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One occurrence of a component definition in the design.
 *
 * <p>Instances are immutable. Every position change produces a new value whose physical pins
 * were recomputed in the same step, so a pin can never lag behind its instance.</p>
 */
@Value
@Builder(access = AccessLevel.PRIVATE, toBuilder = true)
public class ComponentInstance {
    String instanceId;
    String definitionId;
    String label;
    SchematicPoint schematicPosition;
    /** Minimum corner of the component footprint in world space. */
    Vec3 physicalPosition;
    boolean physicallyPlaced;
    /** Footprint extents copied from the definition. */
    Vec3 size;
    /** Rail the instance is mounted on, or {@code null} when free-floating. */
    String railId;
    /** Module slot on {@link #railId}, or {@code null} when free-floating. */
    Integer railSlot;
    List<PhysicalPin> physicalPins;

    /**
     * Creates an unplaced instance at the origin sentinel.
     */
    public static ComponentInstance create(
            String instanceId,
            ComponentDefinition definition,
            String label,
            SchematicPoint schematicPosition
    ) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(definition, "definition");
        List<PhysicalPin> pins = new ArrayList<>(definition.getPins().size());
        for (LogicalPin pin : definition.getPins()) {
            Vec3 offset = definition.pinOffset(pin);
            pins.add(new PhysicalPin(PinRef.of(instanceId, pin.getName()), pin.getType(), offset, offset));
        }
        return ComponentInstance.builder()
                .instanceId(instanceId)
                .definitionId(definition.getId())
                .label(label)
                .schematicPosition(schematicPosition == null ? SchematicPoint.ORIGIN : schematicPosition)
                .physicalPosition(Vec3.ZERO)
                .physicallyPlaced(false)
                .size(definition.getDimensions().asSize())
                .physicalPins(List.copyOf(pins))
                .build();
    }

    /**
     * Returns a copy moved to {@code position} with every pin recomputed.
     *
     * @param position new minimum-corner position.
     * @param railId rail id for rail-mounted placement, or {@code null}.
     * @param railSlot slot on the rail, or {@code null}.
     */
    public ComponentInstance movedTo(Vec3 position, String railId, Integer railSlot) {
        Objects.requireNonNull(position, "position");
        if (!position.allFinite()) {
            throw new IllegalArgumentException("physical position must be finite: " + position);
        }
        List<PhysicalPin> pins = new ArrayList<>(physicalPins.size());
        for (PhysicalPin pin : physicalPins) {
            pins.add(pin.anchoredAt(position));
        }
        return toBuilder()
                .physicalPosition(position)
                .railId(railId)
                .railSlot(railSlot)
                .physicalPins(List.copyOf(pins))
                .build();
    }

    public ComponentInstance withPhysicallyPlaced(boolean placed) {
        return toBuilder().physicallyPlaced(placed).build();
    }

    public ComponentInstance withSchematicPosition(SchematicPoint position) {
        return toBuilder().schematicPosition(Objects.requireNonNull(position, "position")).build();
    }

    /**
     * Footprint box, without clearance.
     */
    public BoundingBox bounds() {
        return BoundingBox.ofCorner(physicalPosition, size);
    }

    /**
     * Footprint box grown by {@code clearance} on every side.
     */
    public BoundingBox paddedBounds(double clearance) {
        return bounds().padded(clearance);
    }

    public Optional<PhysicalPin> findPin(String pinName) {
        for (PhysicalPin pin : physicalPins) {
            if (pin.ref().pinName().equals(pinName)) {
                return Optional.of(pin);
            }
        }
        return Optional.empty();
    }
}
