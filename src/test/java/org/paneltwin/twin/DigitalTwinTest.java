package org.paneltwin.twin;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.paneltwin.core.geometry.BoundingBox;
import org.paneltwin.core.geometry.GridCoordinate;
import org.paneltwin.core.geometry.RailSnap;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.model.ComponentInstance;
import org.paneltwin.model.Enclosure;
import org.paneltwin.model.LogicalConnection;
import org.paneltwin.model.PhysicalPin;
import org.paneltwin.model.PinRef;
import org.paneltwin.model.RoutingMethod;
import org.paneltwin.model.SchematicPoint;
import org.paneltwin.model.Waypoint;
import org.paneltwin.model.WaypointKind;
import org.paneltwin.model.Wire;
import org.paneltwin.model.WireType;
import org.paneltwin.routing.grid.InvalidGridParametersException;
import org.paneltwin.routing.grid.OccupancyGrid;
import org.paneltwin.routing.grid.OccupancyGridBuilder;
import org.paneltwin.routing.search.PathResult;
import org.paneltwin.routing.search.UnroutableReason;
import org.paneltwin.testutil.PanelFixtures;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Digital Twin Tests")
class DigitalTwinTest {

    private DigitalTwin twin;

    @BeforeEach
    void setUp() {
        twin = new DigitalTwin(PanelFixtures.config(), PanelFixtures.catalog(), Enclosure.standardPanel());
    }

    private String addMcb() {
        return twin.addComponentInstance(PanelFixtures.MCB_ID, new SchematicPoint(10, 20));
    }

    private String addRelay() {
        return twin.addComponentInstance(PanelFixtures.RELAY_ID, SchematicPoint.ORIGIN);
    }

    private void place(String instanceId, Vec3 position) {
        twin.updatePhysicalPosition(instanceId, position);
        twin.setPhysicallyPlaced(instanceId, true);
    }

    @Nested
    @DisplayName("1. Components")
    class ComponentTests {

        @Test
        @DisplayName("New instances are unplaced, labelled per definition, with pins at their offsets")
        void testAddComponent() {
            String first = addMcb();
            String second = addMcb();
            String relay = addRelay();

            assertEquals("MCB_1", first);
            assertEquals("MCB_2", second);
            assertEquals("RELAY_1", relay);

            ComponentInstance instance = twin.getComponent(second).orElseThrow();
            assertEquals("MCB 2", instance.getLabel());
            assertEquals("RELAY 1", twin.getComponent(relay).orElseThrow().getLabel());
            assertFalse(instance.isPhysicallyPlaced());
            assertEquals(Vec3.ZERO, instance.getPhysicalPosition());
            assertEquals(new SchematicPoint(10, 20), instance.getSchematicPosition());
            for (PhysicalPin pin : instance.getPhysicalPins()) {
                assertEquals(pin.offset(), pin.world());
            }
        }

        @Test
        @DisplayName("Unknown definition id is rejected")
        void testUnknownDefinition() {
            DigitalTwinException ex = assertThrows(DigitalTwinException.class,
                    () -> twin.addComponentInstance("nope", SchematicPoint.ORIGIN));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_DEFINITION, ex.getReasonCode());
            assertTrue(twin.components().isEmpty());
        }

        @Test
        @DisplayName("Adding by definition registers it in the catalog")
        void testAddByDefinition() {
            String id = twin.addComponentInstance(PanelFixtures.block("custom-box", 40, 40, 40), null);
            assertEquals("SENSOR_1", id);
            assertTrue(twin.getDefinition("custom-box").isPresent());
            assertEquals(SchematicPoint.ORIGIN, twin.getComponent(id).orElseThrow().getSchematicPosition());
        }

        @Test
        @DisplayName("Pins follow every physical move")
        void testPinInvariant() {
            String id = addRelay();
            Vec3[] moves = {new Vec3(-200, 100, -50), new Vec3(0, 0, 0), new Vec3(157.3, 412.9, -20.1)};
            for (Vec3 move : moves) {
                twin.updatePhysicalPosition(id, move);
                ComponentInstance instance = twin.getComponent(id).orElseThrow();
                assertEquals(move, instance.getPhysicalPosition());
                for (PhysicalPin pin : instance.getPhysicalPins()) {
                    assertEquals(move.plus(pin.offset()), pin.world(), "pin " + pin.ref());
                }
            }
        }

        @Test
        @DisplayName("Moving keeps the placed flag as it was")
        void testMoveKeepsPlacedFlag() {
            String id = addMcb();
            twin.updatePhysicalPosition(id, new Vec3(-200, 100, -50));
            assertFalse(twin.getComponent(id).orElseThrow().isPhysicallyPlaced());

            twin.setPhysicallyPlaced(id, true);
            twin.updatePhysicalPosition(id, new Vec3(-150, 100, -50));
            assertTrue(twin.getComponent(id).orElseThrow().isPhysicallyPlaced());

            twin.setPhysicallyPlaced(id, false);
            twin.updatePhysicalPosition(id, new Vec3(-350, 200, -50), "dinrail-1", 0);
            ComponentInstance parked = twin.getComponent(id).orElseThrow();
            assertFalse(parked.isPhysicallyPlaced());
            assertEquals("dinrail-1", parked.getRailId());
        }

        @Test
        @DisplayName("Rail slot must name a real rail and slot")
        void testRailSlotValidation() {
            String id = addMcb();
            ComponentInstance before = twin.getComponent(id).orElseThrow();

            DigitalTwinException unknownRail = assertThrows(DigitalTwinException.class,
                    () -> twin.updatePhysicalPosition(id, Vec3.ZERO, "dinrail-9", 0));
            assertEquals(DigitalTwinException.REASON_INVALID_ARGUMENT, unknownRail.getReasonCode());
            assertThrows(DigitalTwinException.class, () -> twin.updatePhysicalPosition(id, Vec3.ZERO, "dinrail-1", 40));
            assertThrows(DigitalTwinException.class, () -> twin.updatePhysicalPosition(id, Vec3.ZERO, null, 3));
            assertThrows(DigitalTwinException.class, () -> twin.updatePhysicalPosition(id, new Vec3(Double.NaN, 0, 0)));
            assertEquals(before, twin.getComponent(id).orElseThrow());

            ComponentInstance onRail = twin.updatePhysicalPosition(id, new Vec3(-350, 200, -50), "dinrail-1", 0);
            assertEquals("dinrail-1", onRail.getRailId());
            assertEquals(0, onRail.getRailSlot());
        }

        @Test
        @DisplayName("Placing near a rail snaps to a module slot")
        void testPlaceOnRail() {
            String id = addMcb();
            Optional<RailSnap> snap = twin.placeOnRail(id, new Vec3(-280, 95, -40));
            assertTrue(snap.isPresent());
            ComponentInstance instance = twin.getComponent(id).orElseThrow();
            assertEquals("dinrail-2", instance.getRailId());
            assertEquals(4, instance.getRailSlot());
            assertEquals(new Vec3(-350 + 4 * 17.5, 100, -50), instance.getPhysicalPosition());
            assertTrue(instance.isPhysicallyPlaced());

            Optional<RailSnap> free = twin.placeOnRail(id, new Vec3(0, 400, 0));
            assertTrue(free.isEmpty());
            ComponentInstance floating = twin.getComponent(id).orElseThrow();
            assertNull(floating.getRailId());
            assertEquals(new Vec3(0, 400, 0), floating.getPhysicalPosition());
        }

        @Test
        @DisplayName("Collision check covers stored instances")
        void testCollision() {
            String a = addMcb();
            String b = addMcb();
            twin.updatePhysicalPosition(a, new Vec3(0, 100, 0));
            twin.setPhysicallyPlaced(a, true);
            twin.updatePhysicalPosition(b, new Vec3(10, 100, 0));
            assertFalse(twin.checkCollision(a), "unplaced neighbour never collides");

            twin.setPhysicallyPlaced(b, true);
            assertTrue(twin.checkCollision(a));
            assertEquals(List.of(b), twin.findCollisions(a));

            twin.setPhysicallyPlaced(b, false);
            assertFalse(twin.checkCollision(a));
        }

        @Test
        @DisplayName("Unknown component ids are rejected")
        void testUnknownComponent() {
            DigitalTwinException ex = assertThrows(DigitalTwinException.class,
                    () -> twin.updatePhysicalPosition("MCB_99", Vec3.ZERO));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_COMPONENT, ex.getReasonCode());
            assertTrue(ex.getMessage().startsWith("[TWIN_UNKNOWN_COMPONENT]"));
            assertThrows(DigitalTwinException.class, () -> twin.removeComponentInstance("MCB_99"));
            assertThrows(DigitalTwinException.class, () -> twin.checkCollision(null));
        }
    }

    @Nested
    @DisplayName("2. Connections")
    class ConnectionTests {

        @Test
        @DisplayName("New connection comes with an empty unrouted wire")
        void testEmptyWire() {
            String mcb = addMcb();
            String relay = addRelay();
            String connectionId = twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of(relay, "A1"));

            Wire wire = twin.getWireForConnection(connectionId).orElseThrow();
            assertEquals("CONN_1", connectionId);
            assertEquals("WIRE_1", wire.getId());
            assertTrue(wire.getWaypoints().isEmpty());
            assertFalse(wire.isRouted());
            assertEquals(WireType.POWER, wire.getWireType());
            assertEquals("#FF0000", wire.getColor());
            assertEquals(2.0d, wire.getThickness());
        }

        @Test
        @DisplayName("Wire type is derived from pin types unless given")
        void testWireTypes() {
            String relay = addRelay();
            String terminal = twin.addComponentInstance(PanelFixtures.TERMINAL_ID, SchematicPoint.ORIGIN);
            String relay2 = addRelay();

            String ground = twin.addLogicalConnection(PinRef.of(relay, "A2"), PinRef.of(terminal, "PE"));
            String signal = twin.addLogicalConnection(PinRef.of(relay, "11"), PinRef.of(relay2, "A1"));
            String labelled = twin.addLogicalConnection(
                    PinRef.of(relay2, "11"), PinRef.of(relay, "A1"), WireType.POWER, "24VDC");

            assertEquals(WireType.GROUND, twin.getConnection(ground).orElseThrow().getWireType());
            assertEquals(WireType.SIGNAL, twin.getConnection(signal).orElseThrow().getWireType());
            LogicalConnection explicit = twin.getConnection(labelled).orElseThrow();
            assertEquals(WireType.POWER, explicit.getWireType());
            assertEquals("24VDC", explicit.getLabel());
        }

        @Test
        @DisplayName("Unknown pins are rejected without changing state")
        void testUnknownPin() {
            String mcb = addMcb();
            String relay = addRelay();
            twin.addLogicalConnection(PinRef.of(mcb, "OUT"), PinRef.of(relay, "A1"));
            List<LogicalConnection> connectionsBefore = twin.connections();
            List<Wire> wiresBefore = twin.wires();

            DigitalTwinException badPin = assertThrows(DigitalTwinException.class,
                    () -> twin.addLogicalConnection(PinRef.of(mcb, "L9"), PinRef.of(relay, "A1")));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_PIN, badPin.getReasonCode());
            DigitalTwinException badInstance = assertThrows(DigitalTwinException.class,
                    () -> twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of("RELAY_7", "A1")));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_PIN, badInstance.getReasonCode());
            DigitalTwinException selfLoop = assertThrows(DigitalTwinException.class,
                    () -> twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of(mcb, "L1")));
            assertEquals(DigitalTwinException.REASON_INVALID_ARGUMENT, selfLoop.getReasonCode());

            assertEquals(connectionsBefore, twin.connections());
            assertEquals(wiresBefore, twin.wires());
            assertEquals("CONN_2", twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of(relay, "A2")));
        }

        @Test
        @DisplayName("Removing a component with two connections removes both connections and wires")
        void testCascadeRemoval() {
            String mcb = addMcb();
            String relay = addRelay();
            String terminal = twin.addComponentInstance(PanelFixtures.TERMINAL_ID, SchematicPoint.ORIGIN);
            String first = twin.addLogicalConnection(PinRef.of(mcb, "OUT"), PinRef.of(relay, "A1"));
            String second = twin.addLogicalConnection(PinRef.of(relay, "A2"), PinRef.of(terminal, "PE"));
            String untouched = twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of(terminal, "PE"));
            String firstWire = twin.getWireForConnection(first).orElseThrow().getId();
            String secondWire = twin.getWireForConnection(second).orElseThrow().getId();

            RemovalReport report = twin.removeComponentInstance(relay);

            assertEquals(relay, report.getInstanceId());
            assertEquals(List.of(first, second), report.getRemovedConnectionIds());
            assertEquals(List.of(firstWire, secondWire), report.getRemovedWireIds());
            assertTrue(twin.getComponent(relay).isEmpty());
            for (LogicalConnection connection : twin.connections()) {
                assertFalse(connection.references(relay), "dangling connection " + connection.getId());
            }
            for (Wire wire : twin.wires()) {
                assertTrue(twin.getConnection(wire.getConnectionId()).isPresent(), "orphan wire " + wire.getId());
            }
            assertEquals(1, twin.connections().size());
            assertEquals(1, twin.wires().size());
            assertTrue(twin.getConnection(untouched).isPresent());
        }

        @Test
        @DisplayName("Removing a connection removes its wire")
        void testRemoveConnection() {
            String mcb = addMcb();
            String relay = addRelay();
            String connectionId = twin.addLogicalConnection(PinRef.of(mcb, "OUT"), PinRef.of(relay, "A1"));
            twin.removeLogicalConnection(connectionId);
            assertTrue(twin.connections().isEmpty());
            assertTrue(twin.wires().isEmpty());

            DigitalTwinException ex = assertThrows(DigitalTwinException.class,
                    () -> twin.removeLogicalConnection(connectionId));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_CONNECTION, ex.getReasonCode());
        }

        @Test
        @DisplayName("Read accessors hand out copies")
        void testReadOnlyViews() {
            addMcb();
            List<ComponentInstance> components = twin.components();
            assertThrows(UnsupportedOperationException.class, () -> components.remove(0));
            addRelay();
            assertEquals(1, components.size());
            assertEquals(2, twin.components().size());
        }
    }

    @Nested
    @DisplayName("3. Routing")
    class RoutingTests {

        private String mcb;
        private String relay;
        private String connectionId;

        @BeforeEach
        void placeParts() {
            mcb = addMcb();
            relay = addRelay();
            place(mcb, new Vec3(-200, 100, -50));
            place(relay, new Vec3(100, 100, -50));
            connectionId = twin.addLogicalConnection(PinRef.of(mcb, "L1"), PinRef.of(relay, "A1"));
        }

        @Test
        @DisplayName("Routed wire runs from pin cell to pin cell through free cells only")
        void testRouteWire() {
            PathResult result = twin.routeWire(connectionId);

            assertTrue(result.isRouted());
            assertEquals(31, result.getGridSteps());

            Wire wire = twin.getWireForConnection(connectionId).orElseThrow();
            assertTrue(wire.isRouted());
            assertEquals(RoutingMethod.MANHATTAN, wire.getRoutingMethod());
            assertEquals(result.getWaypoints().size(), wire.getWaypoints().size());
            assertEquals(new Vec3(-185, 185, 15), wire.getWaypoints().get(0).position());
            assertEquals(new Vec3(105, 185, 15), wire.getWaypoints().get(wire.getWaypoints().size() - 1).position());
            for (Waypoint waypoint : wire.getWaypoints()) {
                assertEquals(WaypointKind.COMPUTED, waypoint.kind());
            }

            OccupancyGrid grid = new OccupancyGridBuilder(twin.config())
                    .build(twin.enclosure(), twin.components(), twin.config().getResolutionMm());
            grid.openTerminalAccess(result.getCells().get(0), mcb);
            grid.openTerminalAccess(result.getCells().get(result.getCells().size() - 1), relay);
            for (GridCoordinate cell : result.getCells()) {
                assertFalse(grid.isBlocked(cell), "blocked cell on route: " + cell);
            }
        }

        @Test
        @DisplayName("Pin covered by a neighbouring component is reported blocked, not routed through it")
        void testPinCoveredByNeighbour() {
            place(mcb, new Vec3(-200, 100, -100));
            String shield = twin.addComponentInstance(PanelFixtures.block("shield", 80, 160, 40), null);
            place(shield, new Vec3(-230, 60, -34));
            assertFalse(twin.checkCollision(mcb));
            assertFalse(twin.checkCollision(shield));

            PathResult result = twin.routeWire(connectionId);

            assertFalse(result.isRouted());
            assertEquals(UnroutableReason.ENDPOINT_BLOCKED, result.getReason());
            assertTrue(twin.getWireForConnection(connectionId).orElseThrow().getWaypoints().isEmpty());
        }

        @Test
        @DisplayName("Terminal corridor stops at a neighbouring component and the route goes around it")
        void testRouteAvoidsComponentInFrontOfPin() {
            place(mcb, new Vec3(-200, 100, -100));
            String shield = twin.addComponentInstance(PanelFixtures.block("shield", 80, 160, 40), null);
            place(shield, new Vec3(-230, 60, -20));

            PathResult result = twin.routeWire(connectionId);

            assertTrue(result.isRouted());
            BoundingBox shieldBox = twin.getComponent(shield).orElseThrow().bounds();
            OccupancyGrid grid = new OccupancyGridBuilder(twin.config())
                    .build(twin.enclosure(), twin.components(), twin.config().getResolutionMm());
            grid.openTerminalAccess(result.getCells().get(0), mcb);
            grid.openTerminalAccess(result.getCells().get(result.getCells().size() - 1), relay);
            for (GridCoordinate cell : result.getCells()) {
                assertFalse(grid.isBlocked(cell), "blocked cell on route: " + cell);
                assertFalse(shieldBox.contains(grid.gridToWorld(cell)), "route enters shield at " + cell);
            }
        }

        @Test
        @DisplayName("Routing twice without changes gives identical waypoints")
        void testIdempotent() {
            twin.routeWire(connectionId);
            List<Waypoint> first = twin.getWireForConnection(connectionId).orElseThrow().getWaypoints();
            twin.routeWire(connectionId);
            List<Waypoint> second = twin.getWireForConnection(connectionId).orElseThrow().getWaypoints();
            assertEquals(first, second);
        }

        @Test
        @DisplayName("Moving a component does not re-route its wires")
        void testNoAutoReroute() {
            twin.routeWire(connectionId);
            Wire routed = twin.getWireForConnection(connectionId).orElseThrow();
            twin.updatePhysicalPosition(relay, new Vec3(150, 300, -50));
            assertEquals(routed, twin.getWireForConnection(connectionId).orElseThrow());
        }

        @Test
        @DisplayName("Unroutable outcome clears the wire and reports the reason")
        void testUnroutableClearsWire() {
            twin.routeWire(connectionId);
            twin.updatePhysicalPosition(relay, new Vec3(500, 100, -50));

            PathResult result = twin.routeWire(connectionId);

            assertFalse(result.isRouted());
            assertEquals(UnroutableReason.OUT_OF_BOUNDS, result.getReason());
            assertTrue(twin.getWireForConnection(connectionId).orElseThrow().getWaypoints().isEmpty());
        }

        @Test
        @DisplayName("Invalid grid parameters abort routing and leave the wire alone")
        void testInvalidGrid() {
            twin.routeWire(connectionId);
            Wire before = twin.getWireForConnection(connectionId).orElseThrow();

            InvalidGridParametersException ex = assertThrows(InvalidGridParametersException.class,
                    () -> twin.routeWire(connectionId, twin.enclosure(), 0));
            assertEquals(InvalidGridParametersException.REASON_RESOLUTION_INVALID, ex.getReasonCode());
            assertEquals(before, twin.getWireForConnection(connectionId).orElseThrow());
        }

        @Test
        @DisplayName("Unknown connection cannot be routed")
        void testUnknownConnection() {
            DigitalTwinException ex = assertThrows(DigitalTwinException.class, () -> twin.routeWire("CONN_42"));
            assertEquals(DigitalTwinException.REASON_UNKNOWN_CONNECTION, ex.getReasonCode());
        }

        @Test
        @DisplayName("Manual wires are skipped by bulk routing until routed explicitly")
        void testManualWaypoints() {
            String other = twin.addLogicalConnection(PinRef.of(mcb, "OUT"), PinRef.of(relay, "A2"));
            List<Vec3> points = List.of(new Vec3(-190, 100, 10), new Vec3(-190, 50, 10), new Vec3(122.5, 50, 10));
            Wire manual = twin.setManualWaypoints(other, points);
            assertEquals(RoutingMethod.MANUAL, manual.getRoutingMethod());
            assertEquals(WaypointKind.USER_ANCHORED, manual.getWaypoints().get(0).kind());

            Map<String, PathResult> results = twin.routeAllWires();
            assertEquals(List.of(connectionId), List.copyOf(results.keySet()));
            assertEquals(manual, twin.getWireForConnection(other).orElseThrow());

            twin.routeWire(other);
            assertEquals(RoutingMethod.MANHATTAN, twin.getWireForConnection(other).orElseThrow().getRoutingMethod());
        }
    }
}
