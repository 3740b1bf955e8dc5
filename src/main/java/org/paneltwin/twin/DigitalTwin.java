package org.paneltwin.twin;

import org.paneltwin.config.RoutingConfig;
import org.paneltwin.core.geometry.GridCoordinate;
import org.paneltwin.core.geometry.MountingRail;
import org.paneltwin.core.geometry.RailSnap;
import org.paneltwin.core.geometry.Vec3;
import org.paneltwin.core.id.IdGenerator;
import org.paneltwin.model.ComponentDefinition;
import org.paneltwin.model.ComponentInstance;
import org.paneltwin.model.Enclosure;
import org.paneltwin.model.LogicalConnection;
import org.paneltwin.model.PhysicalPin;
import org.paneltwin.model.PinRef;
import org.paneltwin.model.RoutingMethod;
import org.paneltwin.model.SchematicPoint;
import org.paneltwin.model.Waypoint;
import org.paneltwin.model.Wire;
import org.paneltwin.model.WireType;
import org.paneltwin.model.catalog.CatalogLoadException;
import org.paneltwin.model.catalog.ComponentCatalog;
import org.paneltwin.placement.PlacementService;
import org.paneltwin.routing.grid.InvalidGridParametersException;
import org.paneltwin.routing.grid.OccupancyGrid;
import org.paneltwin.routing.grid.OccupancyGridBuilder;
import org.paneltwin.routing.search.PathResult;
import org.paneltwin.routing.search.PathSearchEngine;
import org.paneltwin.twin.snapshot.TwinSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Single source of truth for the design: component instances, logical connections and the
 * wires that realize them.
 *
 * <p>Every mutation validates its arguments first and throws {@link DigitalTwinException}
 * before touching state, so a failed call leaves the twin unchanged. Instances and wires are
 * immutable values replaced on each change; everything handed out is a snapshot that later
 * calls will not modify.</p>
 *
 * <p>Position updates never re-route. Routing happens only on {@link #routeWire(String)},
 * {@link #routeAllWires()} and after {@link #loadSnapshot(TwinSnapshot)}.</p>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; the owner is the sole writer.</p>
 */
public final class DigitalTwin {
    private static final Logger log = LoggerFactory.getLogger(DigitalTwin.class);

    static final String CONNECTION_ID_PREFIX = "CONN";
    static final String WIRE_ID_PREFIX = "WIRE";

    private final RoutingConfig config;
    private final IdGenerator ids;
    private final OccupancyGridBuilder gridBuilder;
    private final PathSearchEngine searchEngine;
    private final PlacementService placement;

    private ComponentCatalog catalog;
    private Enclosure enclosure;
    private Map<String, ComponentInstance> components = new LinkedHashMap<>();
    private Map<String, LogicalConnection> connections = new LinkedHashMap<>();
    // keyed by connection id; exactly one wire per connection
    private Map<String, Wire> wires = new LinkedHashMap<>();

    /**
     * Creates a twin on the standard panel with the bundled catalog and system-property config.
     */
    public DigitalTwin() {
        this(RoutingConfig.defaults(), ComponentCatalog.loadDefault(), Enclosure.standardPanel());
    }

    public DigitalTwin(RoutingConfig config, ComponentCatalog catalog, Enclosure enclosure) {
        this(config, catalog, enclosure, IdGenerator.sequential());
    }

    public DigitalTwin(RoutingConfig config, ComponentCatalog catalog, Enclosure enclosure, IdGenerator ids) {
        this.config = Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog").copy();
        this.enclosure = Objects.requireNonNull(enclosure, "enclosure");
        this.ids = Objects.requireNonNull(ids, "ids");
        this.gridBuilder = new OccupancyGridBuilder(config);
        this.searchEngine = new PathSearchEngine(config);
        this.placement = new PlacementService(config);
    }

    // ------------------------------------------------------------------ components

    /**
     * Adds an unplaced instance of a definition, registering the definition if the catalog
     * does not know its id yet.
     *
     * @return new instance id.
     */
    public String addComponentInstance(ComponentDefinition definition, SchematicPoint schematicPosition) {
        Objects.requireNonNull(definition, "definition");
        ComponentDefinition registered = catalog.register(definition);
        return insertInstance(registered, schematicPosition);
    }

    /**
     * Adds an unplaced instance of a catalog definition.
     *
     * @throws DigitalTwinException {@code TWIN_UNKNOWN_DEFINITION} when the catalog lacks the id.
     */
    public String addComponentInstance(String definitionId, SchematicPoint schematicPosition) {
        ComponentDefinition definition = catalog.find(definitionId).orElseThrow(() -> new DigitalTwinException(
                DigitalTwinException.REASON_UNKNOWN_DEFINITION,
                "no definition '" + definitionId + "' in catalog " + catalog.catalogId()
        ));
        return insertInstance(definition, schematicPosition);
    }

    private String insertInstance(ComponentDefinition definition, SchematicPoint schematicPosition) {
        String instanceId = ids.next(definition.getType().name());
        String label = definition.getType().name() + " " + (countInstancesOf(definition.getId()) + 1);
        ComponentInstance instance = ComponentInstance.create(instanceId, definition, label, schematicPosition);
        components.put(instanceId, instance);
        log.debug("Added {} ({}) as '{}'", instanceId, definition.getId(), label);
        return instanceId;
    }

    private int countInstancesOf(String definitionId) {
        int count = 0;
        for (ComponentInstance instance : components.values()) {
            if (instance.getDefinitionId().equals(definitionId)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Removes an instance together with every connection touching it and those connections'
     * wires. All three removals are applied in one step, so no reader can observe a
     * connection that points at a missing instance.
     *
     * @throws DigitalTwinException {@code TWIN_UNKNOWN_COMPONENT} for an unknown id.
     */
    public RemovalReport removeComponentInstance(String instanceId) {
        requireComponent(instanceId);

        RemovalReport.RemovalReportBuilder report = RemovalReport.builder().instanceId(instanceId);
        List<String> doomedConnections = new ArrayList<>();
        for (LogicalConnection connection : connections.values()) {
            if (connection.references(instanceId)) {
                doomedConnections.add(connection.getId());
            }
        }

        components.remove(instanceId);
        for (String connectionId : doomedConnections) {
            connections.remove(connectionId);
            report.removedConnectionId(connectionId);
        }
        // sweep every wire whose connection is gone, not only the ones found above
        List<String> orphanedWires = new ArrayList<>();
        for (String connectionId : wires.keySet()) {
            if (!connections.containsKey(connectionId)) {
                orphanedWires.add(connectionId);
            }
        }
        for (String connectionId : orphanedWires) {
            report.removedWireId(wires.remove(connectionId).getId());
        }

        RemovalReport result = report.build();
        log.debug("Removed {} with {} connections and {} wires",
                instanceId, result.getRemovedConnectionIds().size(), result.getRemovedWireIds().size());
        return result;
    }

    /**
     * Moves an instance to a free-floating position. Pins follow in the same step; the placed
     * flag is left as it is and wires are not re-routed.
     */
    public ComponentInstance updatePhysicalPosition(String instanceId, Vec3 position) {
        return updatePhysicalPosition(instanceId, position, null, null);
    }

    /**
     * Moves an instance, optionally recording the rail slot it occupies. The placed flag is
     * only changed by {@link #setPhysicallyPlaced(String, boolean)} and {@link #placeOnRail}.
     *
     * @param railId rail id, or {@code null} for a free-floating position.
     * @param railSlot slot on {@code railId}; {@code null} exactly when {@code railId} is.
     * @throws DigitalTwinException {@code TWIN_UNKNOWN_COMPONENT} or {@code TWIN_INVALID_ARGUMENT}.
     */
    public ComponentInstance updatePhysicalPosition(String instanceId, Vec3 position, String railId, Integer railSlot) {
        ComponentInstance current = requireComponent(instanceId);
        requireFinitePosition(position);
        requireRailSlot(railId, railSlot);

        ComponentInstance moved = current.movedTo(position, railId, railSlot);
        components.put(instanceId, moved);
        return moved;
    }

    public ComponentInstance updateSchematicPosition(String instanceId, SchematicPoint position) {
        ComponentInstance current = requireComponent(instanceId);
        if (position == null || !Double.isFinite(position.x()) || !Double.isFinite(position.y())) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "schematic position must be finite: " + position
            );
        }
        ComponentInstance updated = current.withSchematicPosition(position);
        components.put(instanceId, updated);
        return updated;
    }

    /**
     * Toggles whether an instance takes part in collision checks and grid obstacles.
     */
    public ComponentInstance setPhysicallyPlaced(String instanceId, boolean placed) {
        ComponentInstance updated = requireComponent(instanceId).withPhysicallyPlaced(placed);
        components.put(instanceId, updated);
        return updated;
    }

    /**
     * Snaps a dropped position onto the first enclosure rail within tolerance, moves the
     * instance there and marks it placed. Without a qualifying rail the instance is placed
     * free-floating at {@code position}.
     *
     * @return the snap that was applied, or empty when the position stayed free-floating.
     */
    public Optional<RailSnap> placeOnRail(String instanceId, Vec3 position) {
        requireComponent(instanceId);
        requireFinitePosition(position);
        Optional<RailSnap> snap = placement.snapToNearestRail(position, enclosure);
        if (snap.isPresent()) {
            RailSnap applied = snap.get();
            updatePhysicalPosition(instanceId, applied.position(), applied.railId(), applied.slot());
            log.debug("Snapped {} to {} slot {}", instanceId, applied.railId(), applied.slot());
        } else {
            updatePhysicalPosition(instanceId, position);
        }
        setPhysicallyPlaced(instanceId, true);
        return snap;
    }

    /**
     * Returns whether a stored instance overlaps any other placed instance.
     */
    public boolean checkCollision(String instanceId) {
        return placement.checkCollision(requireComponent(instanceId), components.values());
    }

    /**
     * Ids of the placed instances a stored instance overlaps.
     */
    public List<String> findCollisions(String instanceId) {
        return placement.findCollisions(requireComponent(instanceId), components.values());
    }

    // ----------------------------------------------------------------- connections

    /**
     * Connects two pins, deriving the wire type from the pin types, and creates the empty
     * wire for the connection.
     *
     * @return new connection id.
     * @throws DigitalTwinException {@code TWIN_UNKNOWN_PIN} when either pin does not resolve.
     */
    public String addLogicalConnection(PinRef fromPin, PinRef toPin) {
        return addLogicalConnection(fromPin, toPin, null, null);
    }

    /**
     * @param wireType explicit wire type, or {@code null} to derive it from the pin types.
     * @param label optional wire label.
     */
    public String addLogicalConnection(PinRef fromPin, PinRef toPin, WireType wireType, String label) {
        PhysicalPin from = requirePin(fromPin);
        PhysicalPin to = requirePin(toPin);
        if (fromPin.equals(toPin)) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "cannot connect pin " + fromPin + " to itself"
            );
        }
        WireType type = wireType == null ? WireType.between(from.type(), to.type()) : wireType;

        LogicalConnection connection = LogicalConnection.builder()
                .id(ids.next(CONNECTION_ID_PREFIX))
                .fromPin(fromPin)
                .toPin(toPin)
                .wireType(type)
                .label(label)
                .build();
        Wire wire = Wire.unrouted(ids.next(WIRE_ID_PREFIX), connection, config.getWireThicknessMm());
        for (LogicalConnection existing : connections.values()) {
            if (existing.equalsIgnoringOrder(connection)) {
                log.warn("{} joins the same pins as {}", connection.getId(), existing.getId());
                break;
            }
        }
        connections.put(connection.getId(), connection);
        wires.put(connection.getId(), wire);
        log.debug("Connected {} -> {} as {} ({})", fromPin, toPin, connection.getId(), type);
        return connection.getId();
    }

    /**
     * Removes a connection and its wire.
     */
    public void removeLogicalConnection(String connectionId) {
        requireConnection(connectionId);
        connections.remove(connectionId);
        wires.remove(connectionId);
    }

    // --------------------------------------------------------------------- routing

    /**
     * Routes a wire inside the twin's enclosure at the configured resolution.
     */
    public PathResult routeWire(String connectionId) {
        return routeWire(connectionId, enclosure, config.getResolutionMm());
    }

    /**
     * Routes one wire on a freshly built grid.
     *
     * <p>Both terminal cells get a free corridor towards the door before the search, since a
     * pin sits inside its own component's padded footprint. The corridor never crosses another
     * component, so a pin covered by a neighbour reports
     * {@link org.paneltwin.routing.search.UnroutableReason#ENDPOINT_BLOCKED}. On success the wire receives the
     * computed waypoints and becomes {@link RoutingMethod#MANHATTAN}; otherwise its waypoints
     * are cleared and the reason is returned.</p>
     *
     * @throws DigitalTwinException {@code TWIN_UNKNOWN_CONNECTION} for an unknown id.
     * @throws InvalidGridParametersException when the enclosure or resolution cannot be
     * discretized; the wire is left untouched.
     */
    public PathResult routeWire(String connectionId, Enclosure routingEnclosure, double resolution) {
        LogicalConnection connection = requireConnection(connectionId);
        Objects.requireNonNull(routingEnclosure, "routingEnclosure");
        Vec3 startWorld = requirePin(connection.getFromPin()).world();
        Vec3 goalWorld = requirePin(connection.getToPin()).world();

        OccupancyGrid grid = gridBuilder.build(routingEnclosure, components.values(), resolution);
        GridCoordinate start = grid.worldToGrid(startWorld);
        GridCoordinate goal = grid.worldToGrid(goalWorld);
        grid.openTerminalAccess(start, connection.getFromPin().instanceId());
        grid.openTerminalAccess(goal, connection.getToPin().instanceId());

        PathResult result = searchEngine.findPath(grid, start, goal);
        Wire wire = wires.get(connectionId);
        if (result.isRouted()) {
            List<Waypoint> route = new ArrayList<>(result.getWaypoints().size());
            for (Vec3 point : result.getWaypoints()) {
                route.add(Waypoint.computed(point));
            }
            wires.put(connectionId, wire.withRoute(route, RoutingMethod.MANHATTAN));
            log.debug("Routed {} in {} steps, {} waypoints", connectionId, result.getGridSteps(), route.size());
        } else {
            wires.put(connectionId, wire.withRoute(List.of(), RoutingMethod.MANHATTAN));
            log.warn("Wire {} for {} is unroutable: {}", wire.getId(), connectionId, result.getReason());
        }
        return result;
    }

    /**
     * Routes every {@link RoutingMethod#MANHATTAN} wire in connection order. Manual wires are
     * left alone.
     *
     * @return per-connection outcome in connection order.
     */
    public Map<String, PathResult> routeAllWires() {
        Map<String, PathResult> results = new LinkedHashMap<>();
        for (String connectionId : new ArrayList<>(connections.keySet())) {
            if (wires.get(connectionId).getRoutingMethod() == RoutingMethod.MANHATTAN) {
                results.put(connectionId, routeWire(connectionId));
            }
        }
        return Collections.unmodifiableMap(results);
    }

    /**
     * Replaces a wire's route with user-anchored points and marks it {@link RoutingMethod#MANUAL}.
     */
    public Wire setManualWaypoints(String connectionId, List<Vec3> points) {
        requireConnection(connectionId);
        Objects.requireNonNull(points, "points");
        List<Waypoint> route = new ArrayList<>(points.size());
        for (Vec3 point : points) {
            requireFinitePosition(point);
            route.add(Waypoint.anchored(point));
        }
        Wire updated = wires.get(connectionId).withRoute(route, RoutingMethod.MANUAL);
        wires.put(connectionId, updated);
        return updated;
    }

    // ------------------------------------------------------------------- accessors

    public Optional<ComponentInstance> getComponent(String instanceId) {
        return Optional.ofNullable(components.get(instanceId));
    }

    public Optional<ComponentDefinition> getDefinition(String definitionId) {
        return catalog.find(definitionId);
    }

    public Optional<LogicalConnection> getConnection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<Wire> getWireForConnection(String connectionId) {
        return Optional.ofNullable(wires.get(connectionId));
    }

    public List<ComponentInstance> components() {
        return List.copyOf(components.values());
    }

    public List<LogicalConnection> connections() {
        return List.copyOf(connections.values());
    }

    public List<Wire> wires() {
        return List.copyOf(wires.values());
    }

    public Enclosure enclosure() {
        return enclosure;
    }

    public RoutingConfig config() {
        return config;
    }

    /**
     * Swaps the enclosure. Existing routes are kept until the next routing call.
     */
    public void setEnclosure(Enclosure newEnclosure) {
        this.enclosure = Objects.requireNonNull(newEnclosure, "newEnclosure");
    }

    // ------------------------------------------------------------------- snapshots

    /**
     * Captures the whole state. Computed waypoints are left out; manual ones are kept.
     */
    public TwinSnapshot exportSnapshot() {
        TwinSnapshot.TwinSnapshotBuilder snapshot = TwinSnapshot.builder()
                .enclosure(enclosure)
                .catalogId(catalog.catalogId())
                .definitions(catalog.definitions());
        for (ComponentInstance instance : components.values()) {
            snapshot.instance(new TwinSnapshot.InstanceRecord(
                    instance.getInstanceId(),
                    instance.getDefinitionId(),
                    instance.getLabel(),
                    instance.getSchematicPosition(),
                    instance.getPhysicalPosition(),
                    instance.isPhysicallyPlaced(),
                    instance.getRailId(),
                    instance.getRailSlot()
            ));
        }
        for (LogicalConnection connection : connections.values()) {
            snapshot.connection(new TwinSnapshot.ConnectionRecord(
                    connection.getId(),
                    connection.getFromPin().toString(),
                    connection.getToPin().toString(),
                    connection.getWireType(),
                    connection.getLabel()
            ));
        }
        for (Wire wire : wires.values()) {
            List<Vec3> manual = new ArrayList<>();
            if (wire.getRoutingMethod() == RoutingMethod.MANUAL) {
                for (Waypoint waypoint : wire.getWaypoints()) {
                    manual.add(waypoint.position());
                }
            }
            snapshot.wire(new TwinSnapshot.WireRecord(
                    wire.getId(),
                    wire.getConnectionId(),
                    wire.getThickness(),
                    wire.getRoutingMethod(),
                    List.copyOf(manual)
            ));
        }
        return snapshot.build();
    }

    /**
     * Replaces the whole state with a snapshot, then re-routes every computed wire.
     *
     * <p>The snapshot is fully validated into fresh structures before anything is swapped
     * in; on failure the current state is untouched.</p>
     *
     * @return routing outcome per re-routed connection.
     * @throws DigitalTwinException {@code TWIN_INVALID_SNAPSHOT} when the snapshot is
     * inconsistent.
     */
    public Map<String, PathResult> loadSnapshot(TwinSnapshot snapshot) {
        LoadedState loaded;
        try {
            loaded = LoadedState.from(snapshot);
        } catch (IllegalArgumentException | NullPointerException | CatalogLoadException ex) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_SNAPSHOT,
                    "snapshot rejected: " + ex.getMessage(),
                    ex
            );
        }

        this.catalog = loaded.catalog;
        this.enclosure = loaded.enclosure;
        this.components = loaded.components;
        this.connections = loaded.connections;
        this.wires = loaded.wires;
        ids.reset();
        for (String id : loaded.allIds()) {
            ids.reserve(id);
        }
        log.info("Loaded snapshot: {} components, {} connections, {} wires",
                components.size(), connections.size(), wires.size());

        try {
            return routeAllWires();
        } catch (InvalidGridParametersException ex) {
            log.warn("[{}] Snapshot loaded but wires were not re-routed: {}", ex.getReasonCode(), ex.getMessage());
            return Map.of();
        }
    }

    // -------------------------------------------------------------------- helpers

    private ComponentInstance requireComponent(String instanceId) {
        ComponentInstance instance = instanceId == null ? null : components.get(instanceId);
        if (instance == null) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_UNKNOWN_COMPONENT,
                    "unknown component instance '" + instanceId + "'"
            );
        }
        return instance;
    }

    private LogicalConnection requireConnection(String connectionId) {
        LogicalConnection connection = connectionId == null ? null : connections.get(connectionId);
        if (connection == null) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_UNKNOWN_CONNECTION,
                    "unknown connection '" + connectionId + "'"
            );
        }
        return connection;
    }

    private PhysicalPin requirePin(PinRef ref) {
        if (ref == null) {
            throw new DigitalTwinException(DigitalTwinException.REASON_UNKNOWN_PIN, "pin reference is null");
        }
        ComponentInstance instance = components.get(ref.instanceId());
        if (instance == null) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_UNKNOWN_PIN,
                    "pin " + ref + " references unknown instance '" + ref.instanceId() + "'"
            );
        }
        return instance.findPin(ref.pinName()).orElseThrow(() -> new DigitalTwinException(
                DigitalTwinException.REASON_UNKNOWN_PIN,
                "instance " + ref.instanceId() + " has no pin '" + ref.pinName() + "'"
        ));
    }

    private void requireRailSlot(String railId, Integer railSlot) {
        if (railId == null && railSlot == null) {
            return;
        }
        if (railId == null || railSlot == null) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "railId and railSlot must be given together"
            );
        }
        MountingRail rail = findRail(enclosure, railId);
        if (rail == null) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "enclosure " + enclosure.getId() + " has no rail '" + railId + "'"
            );
        }
        if (railSlot < 0 || railSlot >= rail.getMaxModules()) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "slot " + railSlot + " outside rail " + railId + " [0," + rail.getMaxModules() + ")"
            );
        }
    }

    private static void requireFinitePosition(Vec3 position) {
        if (position == null || !position.allFinite()) {
            throw new DigitalTwinException(
                    DigitalTwinException.REASON_INVALID_ARGUMENT,
                    "position must be finite: " + position
            );
        }
    }

    private static MountingRail findRail(Enclosure enclosure, String railId) {
        for (MountingRail rail : enclosure.getRails()) {
            if (rail.getId().equals(railId)) {
                return rail;
            }
        }
        return null;
    }

    /**
     * Fully validated state rebuilt from a snapshot, not yet visible to readers.
     */
    private static final class LoadedState {
        private final Enclosure enclosure;
        private final ComponentCatalog catalog;
        private final Map<String, ComponentInstance> components = new LinkedHashMap<>();
        private final Map<String, LogicalConnection> connections = new LinkedHashMap<>();
        private final Map<String, Wire> wires = new LinkedHashMap<>();

        private LoadedState(Enclosure enclosure, ComponentCatalog catalog) {
            this.enclosure = enclosure;
            this.catalog = catalog;
        }

        static LoadedState from(TwinSnapshot snapshot) {
            if (snapshot == null) {
                throw invalid("snapshot is null");
            }
            if (snapshot.getFormatVersion() != TwinSnapshot.CURRENT_FORMAT_VERSION) {
                throw invalid("unsupported snapshot format version " + snapshot.getFormatVersion());
            }
            if (snapshot.getEnclosure() == null) {
                throw invalid("snapshot has no enclosure");
            }
            String catalogId = snapshot.getCatalogId() == null ? "snapshot" : snapshot.getCatalogId();
            LoadedState state = new LoadedState(
                    snapshot.getEnclosure(),
                    ComponentCatalog.of(catalogId, snapshot.getDefinitions())
            );
            state.loadInstances(snapshot.getInstances());
            state.loadConnections(snapshot.getConnections());
            state.loadWires(snapshot.getWires());
            return state;
        }

        private void loadInstances(List<TwinSnapshot.InstanceRecord> records) {
            for (TwinSnapshot.InstanceRecord record : records) {
                ComponentDefinition definition = catalog.find(record.definitionId())
                        .orElseThrow(() -> invalid("instance " + record.instanceId()
                                + " uses unknown definition '" + record.definitionId() + "'"));
                if (components.containsKey(record.instanceId())) {
                    throw invalid("duplicate instance id " + record.instanceId());
                }
                if ((record.railId() == null) != (record.railSlot() == null)) {
                    throw invalid("instance " + record.instanceId() + " has a partial rail assignment");
                }
                if (record.railId() != null) {
                    MountingRail rail = findRail(enclosure, record.railId());
                    if (rail == null || record.railSlot() < 0 || record.railSlot() >= rail.getMaxModules()) {
                        throw invalid("instance " + record.instanceId() + " sits on invalid rail slot "
                                + record.railId() + "#" + record.railSlot());
                    }
                }
                Vec3 position = record.physicalPosition() == null ? Vec3.ZERO : record.physicalPosition();
                ComponentInstance instance = ComponentInstance
                        .create(record.instanceId(), definition, record.label(), record.schematicPosition())
                        .movedTo(position, record.railId(), record.railSlot())
                        .withPhysicallyPlaced(record.physicallyPlaced());
                components.put(instance.getInstanceId(), instance);
            }
        }

        private void loadConnections(List<TwinSnapshot.ConnectionRecord> records) {
            for (TwinSnapshot.ConnectionRecord record : records) {
                if (connections.containsKey(record.id())) {
                    throw invalid("duplicate connection id " + record.id());
                }
                PinRef from = PinRef.parse(record.fromPin());
                PinRef to = PinRef.parse(record.toPin());
                if (from.equals(to)) {
                    throw invalid("connection " + record.id() + " joins pin " + from + " to itself");
                }
                requireResolvable(record.id(), from);
                requireResolvable(record.id(), to);
                connections.put(record.id(), LogicalConnection.builder()
                        .id(record.id())
                        .fromPin(from)
                        .toPin(to)
                        .wireType(record.wireType())
                        .label(record.label())
                        .build());
            }
        }

        private void loadWires(List<TwinSnapshot.WireRecord> records) {
            Set<String> wireIds = new HashSet<>();
            for (TwinSnapshot.WireRecord record : records) {
                LogicalConnection connection = connections.get(record.connectionId());
                if (connection == null) {
                    throw invalid("wire " + record.id() + " references unknown connection '" + record.connectionId() + "'");
                }
                if (wires.containsKey(connection.getId())) {
                    throw invalid("connection " + connection.getId() + " has more than one wire");
                }
                if (!wireIds.add(record.id())) {
                    throw invalid("duplicate wire id " + record.id());
                }
                RoutingMethod method = record.routingMethod() == null ? RoutingMethod.MANHATTAN : record.routingMethod();
                Wire wire = Wire.unrouted(record.id(), connection, record.thickness());
                if (method == RoutingMethod.MANUAL) {
                    List<Waypoint> route = new ArrayList<>();
                    List<Vec3> points = record.manualWaypoints() == null ? List.of() : record.manualWaypoints();
                    for (Vec3 point : points) {
                        if (point == null || !point.allFinite()) {
                            throw invalid("wire " + record.id() + " has a non-finite waypoint");
                        }
                        route.add(Waypoint.anchored(point));
                    }
                    wire = wire.withRoute(route, RoutingMethod.MANUAL);
                }
                wires.put(connection.getId(), wire);
            }
            for (String connectionId : connections.keySet()) {
                if (!wires.containsKey(connectionId)) {
                    throw invalid("connection " + connectionId + " has no wire");
                }
            }
        }

        private void requireResolvable(String connectionId, PinRef ref) {
            ComponentInstance instance = components.get(ref.instanceId());
            if (instance == null || instance.findPin(ref.pinName()).isEmpty()) {
                throw invalid("connection " + connectionId + " references unresolved pin " + ref);
            }
        }

        List<String> allIds() {
            List<String> all = new ArrayList<>(components.keySet());
            all.addAll(connections.keySet());
            for (Wire wire : wires.values()) {
                all.add(wire.getId());
            }
            return all;
        }

        private static DigitalTwinException invalid(String message) {
            return new DigitalTwinException(DigitalTwinException.REASON_INVALID_SNAPSHOT, message);
        }
    }
}
