package org.paneltwin.twin.snapshot;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.model.ComponentDefinition;
import org.paneltwin.model.Enclosure;
import org.paneltwin.model.RoutingMethod;
import org.paneltwin.model.SchematicPoint;
import org.paneltwin.model.WireType;

import java.util.List;

/**
 * Whole-state persistence record of a digital twin.
 *
 * <p>Physical pins are not stored; they are derived from the definitions on load. Computed
 * waypoints are not stored either, only those of manually routed wires.</p>
 */
@Value
@Builder
@Jacksonized
public class TwinSnapshot {
    public static final int CURRENT_FORMAT_VERSION = 1;

    @Builder.Default
    int formatVersion = CURRENT_FORMAT_VERSION;
    Enclosure enclosure;
    String catalogId;
    @Singular
    List<ComponentDefinition> definitions;
    @Singular
    List<InstanceRecord> instances;
    @Singular
    List<ConnectionRecord> connections;
    @Singular
    List<WireRecord> wires;

    public record InstanceRecord(
            String instanceId,
            String definitionId,
            String label,
            SchematicPoint schematicPosition,
            Vec3 physicalPosition,
            boolean physicallyPlaced,
            String railId,
            Integer railSlot
    ) {
    }

    /**
     * @param fromPin pin reference in {@code <instanceId>:<pinName>} form.
     * @param toPin pin reference in {@code <instanceId>:<pinName>} form.
     */
    public record ConnectionRecord(
            String id,
            String fromPin,
            String toPin,
            WireType wireType,
            String label
    ) {
    }

    /**
     * @param manualWaypoints user-anchored polyline; empty for {@link RoutingMethod#MANHATTAN} wires.
     */
    public record WireRecord(
            String id,
            String connectionId,
            double thickness,
            RoutingMethod routingMethod,
            List<Vec3> manualWaypoints
    ) {
    }
}
