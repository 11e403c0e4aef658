package com.example.arena.sim;

import com.example.arena.ability.AbilitySystem;
import com.example.arena.combat.CleanupSystem;
import com.example.arena.combat.CombatResolver;
import com.example.arena.combat.SpatialIndexSystem;
import com.example.arena.config.SimulationConfig;
import com.example.arena.event.InputEvent;
import com.example.arena.match.MatchPhaseSystem;
import com.example.arena.model.MatchPhase;
import com.example.arena.model.MatchResult;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Tick orchestrator for one match.
 * <p>
 * Every step runs the systems in a fixed order: match phase, movement,
 * abilities, combat, cleanup, spatial index sync. Once the match phase
 * system ends the match, the rest of the pipeline is skipped for that tick
 * and every tick after it.
 */
public class Simulation implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Simulation.class);

    private final SimulationContext ctx;
    private final UnitFactory units;
    private final MatchPhaseSystem matchPhase;
    private final List<TickSystem> gameplay;

    public Simulation(SimulationConfig config) {
        this.ctx = new SimulationContext(config);
        this.units = new UnitFactory(ctx.world(), config);
        this.matchPhase = new MatchPhaseSystem();
        this.gameplay = List.of(
            new MovementSystem(),
            new AbilitySystem(),
            new CombatResolver(),
            new CleanupSystem(),
            new SpatialIndexSystem());
    }

    /** Step using whatever has been submitted to the input queue. */
    public void step(double deltaSeconds) {
        step(deltaSeconds, ctx.inputQueue().drain());
    }

    /**
     * Advance the match by {@code deltaSeconds} with the given input. The
     * events are seen by this tick only.
     */
    public void step(double deltaSeconds, List<InputEvent> input) {
        if (!(deltaSeconds >= 0) || Double.isInfinite(deltaSeconds)) {
            throw new IllegalArgumentException("deltaSeconds must be a finite value >= 0, got " + deltaSeconds);
        }
        ctx.beginTick(input);
        try {
            matchPhase.update(ctx, deltaSeconds);
            if (ctx.phase() == MatchPhase.ENDED) return;
            for (TickSystem system : gameplay) {
                system.update(ctx, deltaSeconds);
            }
        } finally {
            ctx.endTick();
        }
    }

    /**
     * Step at the configured fixed rate until the match ends or
     * {@code maxTicks} have run.
     *
     * @return the result, or null if the tick limit came first
     */
    public MatchResult runToEnd(long maxTicks) {
        double dt = ctx.config().runtime.fixedDeltaSeconds();
        for (long i = 0; i < maxTicks && !isEnded(); i++) {
            step(dt);
        }
        if (!isEnded()) {
            logger.warn("[Simulation] match still running after {} ticks", maxTicks);
        }
        return result();
    }

    /** Capture the current state and drain this tick's events. */
    public WorldSnapshot snapshot() {
        return WorldSnapshot.capture(ctx);
    }

    public SimulationContext context() { return ctx; }
    public ArenaWorld world() { return ctx.world(); }
    public UnitFactory units() { return units; }
    public MatchPhaseSystem matchPhaseSystem() { return matchPhase; }

    public MatchPhase phase() {
        return ctx.phase();
    }

    public boolean isEnded() {
        return ctx.phase() == MatchPhase.ENDED;
    }

    /** The recorded result, or null before the match ends. */
    public MatchResult result() {
        return ctx.world().showdownState().getResult();
    }

    @Override
    public void close() {
        ctx.close();
    }
}
