package org.paneltwin.testutil;

import org.paneltwin.config.RoutingConfig;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.model.ComponentDefinition;
import org.paneltwin.model.ComponentInstance;
import org.paneltwin.model.ComponentType;
import org.paneltwin.model.Enclosure;
import org.paneltwin.model.LogicalPin;
import org.paneltwin.model.PhysicalDimensions;
import org.paneltwin.model.PinType;
import org.paneltwin.model.SchematicPoint;
import org.paneltwin.model.catalog.ComponentCatalog;

import java.util.List;

/**
 * Shared definitions, enclosures and configs for tests that exercise the twin end to end.
 */
public final class PanelFixtures {
    public static final String MCB_ID = "test-mcb";
    public static final String RELAY_ID = "test-relay";
    public static final String TERMINAL_ID = "test-terminal";

    private PanelFixtures() {
    }

    /**
     * 20x80x60 breaker with power in on top and power out at the bottom.
     */
    public static ComponentDefinition mcb() {
        return ComponentDefinition.builder()
                .id(MCB_ID)
                .type(ComponentType.MCB)
                .manufacturer("Test")
                .modelNumber("MCB-1")
                .dimensions(PhysicalDimensions.of(20.0d, 80.0d, 60.0d))
                .railMountable(true)
                .pin(pin("L1", PinType.POWER, 0.5d, 1.0d))
                .pin(pin("OUT", PinType.POWER, 0.5d, 0.0d))
                .build();
    }

    /**
     * 30x80x60 relay with a coil pair and one output contact.
     */
    public static ComponentDefinition relay() {
        return ComponentDefinition.builder()
                .id(RELAY_ID)
                .type(ComponentType.RELAY)
                .dimensions(PhysicalDimensions.of(30.0d, 80.0d, 60.0d))
                .railMountable(true)
                .pin(pin("A1", PinType.INPUT, 0.25d, 1.0d))
                .pin(pin("A2", PinType.NEUTRAL, 0.75d, 1.0d))
                .pin(pin("11", PinType.OUTPUT, 0.5d, 0.0d))
                .build();
    }

    /**
     * 10x50x40 protective-earth terminal.
     */
    public static ComponentDefinition terminal() {
        return ComponentDefinition.builder()
                .id(TERMINAL_ID)
                .type(ComponentType.TERMINAL)
                .dimensions(PhysicalDimensions.of(10.0d, 50.0d, 40.0d))
                .railMountable(true)
                .pin(pin("PE", PinType.GROUND, 0.5d, 0.5d))
                .build();
    }

    /**
     * Plain box with no pins, for obstacle tests.
     */
    public static ComponentDefinition block(String id, double width, double height, double depth) {
        return ComponentDefinition.builder()
                .id(id)
                .type(ComponentType.SENSOR)
                .dimensions(PhysicalDimensions.of(width, height, depth))
                .pins(List.of())
                .build();
    }

    public static ComponentCatalog catalog() {
        return ComponentCatalog.of("test-catalog", List.of(mcb(), relay(), terminal()));
    }

    /**
     * 800x600x200 enclosure, centred on x and z, without rails.
     */
    public static Enclosure emptyPanel() {
        return Enclosure.builder()
                .id("panel-test")
                .width(800.0d)
                .height(600.0d)
                .depth(200.0d)
                .build();
    }

    public static RoutingConfig config(double clearance) {
        return RoutingConfig.builder()
                .resolutionMm(10.0d)
                .clearanceMm(clearance)
                .build();
    }

    public static RoutingConfig config() {
        return config(RoutingConfig.DEFAULT_CLEARANCE_MM);
    }

    /**
     * Placed instance of a definition with its minimum corner at {@code position}.
     */
    public static ComponentInstance placed(String instanceId, ComponentDefinition definition, Vec3 position) {
        return ComponentInstance.create(instanceId, definition, instanceId, SchematicPoint.ORIGIN)
                .movedTo(position, null, null)
                .withPhysicallyPlaced(true);
    }

    public static LogicalPin pin(String name, PinType type, double normalizedX, double normalizedY) {
        return LogicalPin.builder()
                .name(name)
                .type(type)
                .normalizedX(normalizedX)
                .normalizedY(normalizedY)
                .build();
    }
}
