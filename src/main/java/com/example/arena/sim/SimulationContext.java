package com.example.arena.sim;

import com.example.arena.combat.DamageApplier;
import com.example.arena.combat.LinearScanQuery;
import com.example.arena.combat.ProximityQuery;
import com.example.arena.combat.ShieldDefense;
import com.example.arena.combat.SpatialGrid;
import com.example.arena.combat.SpatialGridQuery;
import com.example.arena.config.SimulationConfig;
import com.example.arena.event.InputEvent;
import com.example.arena.event.InputQueue;
import com.example.arena.event.TickEvents;
import com.example.arena.model.MatchPhase;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;

/**
 * Everything one match needs, passed explicitly to every system.
 * <p>
 * Built at match start and closed at match end. Owns the world, the input
 * queue, the per-tick event buffers, the seeded random source and the
 * proximity query (grid-backed when spatial indexing is enabled).
 */
public class SimulationContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SimulationContext.class);

    private final SimulationConfig config;
    private final ArenaWorld world;
    private final TickEvents events = new TickEvents();
    private final InputQueue inputQueue = new InputQueue();
    private final Random random;
    private final SpatialGrid spatialGrid;
    private final ProximityQuery proximity;
    private final DamageApplier damageApplier;

    private List<InputEvent> tickInput = List.of();
    private long tickCount = 0;
    private boolean closed = false;

    public SimulationContext(SimulationConfig config) {
        this.config = config;
        this.world = new ArenaWorld(config.matchDuration(), config.runtime.strictContracts);
        this.random = new Random(config.runtime.seed);
        if (config.spatial.enabled) {
            this.spatialGrid = new SpatialGrid(world, config.spatial.cellSize);
            world.setPositionListener(spatialGrid);
            this.proximity = new SpatialGridQuery(world, spatialGrid);
        } else {
            this.spatialGrid = null;
            this.proximity = new LinearScanQuery(world);
        }
        this.damageApplier = new DamageApplier(world, events, List.of(new ShieldDefense(world)));
        logger.debug("[Simulation] context created: {}", config);
    }

    public SimulationConfig config() { return config; }
    public ArenaWorld world() { return world; }
    public TickEvents events() { return events; }
    public InputQueue inputQueue() { return inputQueue; }
    public Random random() { return random; }
    public ProximityQuery proximity() { return proximity; }
    public DamageApplier damageApplier() { return damageApplier; }

    /** The grid index, or null when spatial indexing is disabled. */
    public SpatialGrid spatialGrid() { return spatialGrid; }

    public long tickCount() { return tickCount; }

    public MatchPhase phase() {
        return world.showdownState().getState();
    }

    public boolean isClosed() { return closed; }

    /** Input events handed to the tick in progress, in submission order. */
    public List<InputEvent> tickInput() {
        return tickInput;
    }

    /**
     * Start a tick: reset the event buffers and take ownership of this tick's input.
     */
    void beginTick(List<InputEvent> input) {
        if (closed) throw new IllegalStateException("simulation context is closed");
        events.reset();
        tickInput = input == null ? List.of() : List.copyOf(input);
        tickCount++;
    }

    void endTick() {
        tickInput = List.of();
    }

    /**
     * Tear the match down. The context cannot be stepped afterwards.
     */
    @Override
    public void close() {
        if (closed) return;
        closed = true;
        world.setPositionListener(null);
        world.clear();
        if (spatialGrid != null) spatialGrid.clear();
        inputQueue.drain();
        events.reset();
        logger.debug("[Simulation] context closed after {} ticks", tickCount);
    }
}
