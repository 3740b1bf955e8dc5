package org.paneltwin.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.paneltwin.core.geometry.BoundingBox;
import org.paneltwin.core.geometry.MountingRail;
import org.paneltwin.core.geometry.RailOrientation;
import org.paneltwin.core.geometry.Vec3;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Panel volume that hosts every placed component.
 *
 * <p>{@code origin} is the world position of the enclosure's minimum corner. When omitted,
 * the enclosure is centred on x and z with the floor at {@code y = 0}, i.e.
 * {@code (-width/2, 0, -depth/2)}.</p>
 *
 * <p>Dimensions are only required to be finite here; positivity is a routing precondition
 * checked by the grid builder. An enclosure with rails must have a proper volume, since
 * every rail has to lie inside it.</p>
 */
@Value
public class Enclosure {
    String id;
    double width;
    double height;
    double depth;
    Vec3 origin;
    List<MountingRail> rails;

    @Builder
    @Jacksonized
    public Enclosure(
            String id,
            double width,
            double height,
            double depth,
            Vec3 origin,
            @Singular List<MountingRail> rails
    ) {
        this.id = id == null ? "enclosure" : id;
        this.width = requireFinite(width, "width");
        this.height = requireFinite(height, "height");
        this.depth = requireFinite(depth, "depth");
        this.origin = origin == null ? new Vec3(-width / 2.0d, 0.0d, -depth / 2.0d) : origin;
        if (!this.origin.allFinite()) {
            throw new IllegalArgumentException("enclosure origin must be finite");
        }
        this.rails = List.copyOf(Objects.requireNonNull(rails, "rails"));

        if (this.rails.isEmpty()) {
            return;
        }
        if (!hasVolume()) {
            throw new IllegalArgumentException("enclosure with rails must have positive dimensions");
        }
        BoundingBox volume = bounds();
        Set<String> railIds = new HashSet<>();
        for (MountingRail rail : this.rails) {
            if (!railIds.add(rail.getId())) {
                throw new IllegalArgumentException("duplicate rail id " + rail.getId());
            }
            if (!volume.contains(rail.getAnchor()) || !volume.contains(rail.endPoint())) {
                throw new IllegalArgumentException(
                        "rail " + rail.getId() + " must lie inside the enclosure volume " + volume
                );
            }
        }
    }

    /**
     * Returns whether all three dimensions are strictly positive.
     */
    public boolean hasVolume() {
        return width > 0.0d && height > 0.0d && depth > 0.0d;
    }

    /**
     * Enclosure volume in world space.
     *
     * @throws IllegalArgumentException when the enclosure has no volume.
     */
    public BoundingBox bounds() {
        return BoundingBox.ofCorner(origin, new Vec3(width, height, depth));
    }

    /**
     * Standard 800x600x200 mm panel with three horizontal rails 100 mm apart.
     */
    public static Enclosure standardPanel() {
        return Enclosure.builder()
                .id("panel-1")
                .width(800.0d)
                .height(600.0d)
                .depth(200.0d)
                .rail(standardRail("dinrail-1", 200.0d))
                .rail(standardRail("dinrail-2", 100.0d))
                .rail(standardRail("dinrail-3", 0.0d))
                .build();
    }

    private static MountingRail standardRail(String id, double y) {
        return MountingRail.builder()
                .id(id)
                .anchor(new Vec3(-350.0d, y, -50.0d))
                .length(700.0d)
                .orientation(RailOrientation.HORIZONTAL)
                .maxModules(40)
                .build();
    }

    private static double requireFinite(double value, String field) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("enclosure " + field + " must be finite, got " + value);
        }
        return value;
    }
}
