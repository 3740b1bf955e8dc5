package org.paneltwin.placement;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.paneltwin.config.RoutingConfig;
import org.paneltwin.core.geometry.BoundingBox;
import org.paneltwin.core.geometry.GeometryUtils;
import org.paneltwin.core.geometry.MountingRail;
import org.paneltwin.core.geometry.RailSnap;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.model.ComponentInstance;
import org.paneltwin.model.Enclosure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Overlap checks between placed components and snapping onto mounting rails.
 *
 * <p>Stateless apart from its configuration; all inputs are passed per call.</p>
 */
public final class PlacementService {
    @Getter
    @Accessors(fluent = true)
    private final double clearance;
    @Getter
    @Accessors(fluent = true)
    private final double moduleWidth;
    @Getter
    @Accessors(fluent = true)
    private final double snapTolerance;

    public PlacementService() {
        this(RoutingConfig.defaults());
    }

    public PlacementService(RoutingConfig config) {
        this(config.getClearanceMm(), config.getModuleWidthMm(), config.getSnapToleranceMm());
    }

    /**
     * @param clearance padding applied to the candidate footprint; must be {@code >= 0}.
     * @param moduleWidth rail module width; must be {@code > 0}.
     * @param snapTolerance perpendicular snap distance; must be {@code >= 0}.
     */
    public PlacementService(double clearance, double moduleWidth, double snapTolerance) {
        if (!Double.isFinite(clearance) || clearance < 0.0d) {
            throw new IllegalArgumentException("clearance must be finite and >= 0, got " + clearance);
        }
        if (!Double.isFinite(moduleWidth) || moduleWidth <= 0.0d) {
            throw new IllegalArgumentException("moduleWidth must be finite and > 0, got " + moduleWidth);
        }
        if (!Double.isFinite(snapTolerance) || snapTolerance < 0.0d) {
            throw new IllegalArgumentException("snapTolerance must be finite and >= 0, got " + snapTolerance);
        }
        this.clearance = clearance;
        this.moduleWidth = moduleWidth;
        this.snapTolerance = snapTolerance;
    }

    /**
     * Returns whether the candidate's padded footprint overlaps any other placed instance.
     * Unplaced instances never collide, on either side.
     */
    public boolean checkCollision(ComponentInstance candidate, Collection<ComponentInstance> others) {
        Objects.requireNonNull(candidate, "candidate");
        if (!candidate.isPhysicallyPlaced()) {
            return false;
        }
        BoundingBox padded = candidate.paddedBounds(clearance);
        for (ComponentInstance other : others) {
            if (collides(candidate, padded, other)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the ids of all placed instances the candidate overlaps, in input order.
     */
    public List<String> findCollisions(ComponentInstance candidate, Collection<ComponentInstance> others) {
        Objects.requireNonNull(candidate, "candidate");
        if (!candidate.isPhysicallyPlaced()) {
            return List.of();
        }
        BoundingBox padded = candidate.paddedBounds(clearance);
        List<String> hits = new ArrayList<>();
        for (ComponentInstance other : others) {
            if (collides(candidate, padded, other)) {
                hits.add(other.getInstanceId());
            }
        }
        return hits;
    }

    /**
     * Snaps onto the first rail, in input order, that is within tolerance.
     * The first qualifying rail wins even when a later one is closer.
     */
    public Optional<RailSnap> snapToNearestRail(
            Vec3 position,
            List<MountingRail> rails,
            double moduleWidth,
            double tolerance
    ) {
        Objects.requireNonNull(position, "position");
        for (MountingRail rail : rails) {
            Optional<RailSnap> snap = GeometryUtils.quantizeToRail(position, rail, moduleWidth, tolerance);
            if (snap.isPresent()) {
                return snap;
            }
        }
        return Optional.empty();
    }

    /**
     * Snaps onto one of the enclosure's rails with the configured module width and tolerance.
     */
    public Optional<RailSnap> snapToNearestRail(Vec3 position, Enclosure enclosure) {
        return snapToNearestRail(position, enclosure.getRails(), moduleWidth, snapTolerance);
    }

    private static boolean collides(ComponentInstance candidate, BoundingBox padded, ComponentInstance other) {
        if (other.getInstanceId().equals(candidate.getInstanceId()) || !other.isPhysicallyPlaced()) {
            return false;
        }
        return GeometryUtils.boxesIntersect(padded, other.bounds());
    }
}
