package org.paneltwin.model;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Physical realization of exactly one logical connection.
 *
 * <p>A wire with fewer than two waypoints is unrouted: it has no geometry yet and reports no
 * length.</p>
 */
@Value
@Builder(access = AccessLevel.PRIVATE, toBuilder = true)
public class Wire {
    public static final double DEFAULT_THICKNESS_MM = 2.0d;

    String id;
    String connectionId;
    WireType wireType;
    String color;
    /** Conductor diameter in millimetres. */
    double thickness;
    RoutingMethod routingMethod;
    List<Waypoint> waypoints;

    /**
     * Creates the empty, unrouted wire that accompanies a new connection.
     */
    public static Wire unrouted(String id, LogicalConnection connection, double thickness) {
        Objects.requireNonNull(connection, "connection");
        if (!Double.isFinite(thickness) || thickness <= 0.0d) {
            throw new IllegalArgumentException("thickness must be > 0, got " + thickness);
        }
        return Wire.builder()
                .id(Objects.requireNonNull(id, "id"))
                .connectionId(connection.getId())
                .wireType(connection.getWireType())
                .color(connection.getWireType().color())
                .thickness(thickness)
                .routingMethod(RoutingMethod.MANHATTAN)
                .waypoints(List.of())
                .build();
    }

    /**
     * Returns a copy carrying new waypoints and routing method.
     */
    public Wire withRoute(List<Waypoint> newWaypoints, RoutingMethod method) {
        return toBuilder()
                .waypoints(List.copyOf(newWaypoints))
                .routingMethod(Objects.requireNonNull(method, "method"))
                .build();
    }

    public boolean isRouted() {
        return waypoints.size() >= 2;
    }

    /**
     * Total polyline length, or empty when the wire is unrouted.
     */
    public OptionalDouble length() {
        if (!isRouted()) {
            return OptionalDouble.empty();
        }
        double total = 0.0d;
        for (int i = 1; i < waypoints.size(); i++) {
            total += waypoints.get(i - 1).position().distanceTo(waypoints.get(i).position());
        }
        return OptionalDouble.of(total);
    }
}
