package com.example.arena.ability;

import com.example.arena.event.AbilityActivation;
import com.example.arena.event.InputEvent;
import com.example.arena.model.AbilityTimer;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.TickSystem;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the Dash, Shield and Ranged-Attack state machines.
 * <p>
 * Each tick, in order:
 * <ol>
 *   <li>count every ability timer down (active window, then cooldown),</li>
 *   <li>advance projectiles already in flight,</li>
 *   <li>process this tick's activation events in submission order.</li>
 * </ol>
 * An activation is accepted only for a living entity owning the ability
 * whose cooldown is exactly zero. Everything else is dropped; the event is
 * consumed either way.
 */
public class AbilitySystem implements TickSystem {
    private static final Logger logger = LoggerFactory.getLogger(AbilitySystem.class);

    private final AbilityRegistry registry;
    private final ProjectileSystem projectiles;

    public AbilitySystem() {
        this(AbilityRegistry.standard(), new ProjectileSystem());
    }

    public AbilitySystem(AbilityRegistry registry, ProjectileSystem projectiles) {
        this.registry = registry;
        this.projectiles = projectiles;
    }

    @Override
    public String name() {
        return "Abilities";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        tickTimers(ctx, deltaSeconds);
        projectiles.advance(ctx, deltaSeconds);
        for (InputEvent event : ctx.tickInput()) {
            if (event instanceof AbilityActivation) {
                activate(ctx, (AbilityActivation) event);
            }
        }
    }

    private void tickTimers(SimulationContext ctx, double deltaSeconds) {
        ArenaWorld world = ctx.world();
        for (AbilityHandler handler : registry.all()) {
            for (int e : handler.table(world).entities()) {
                AbilityTimer timer = handler.timerOf(world, e);
                if (timer.tick(deltaSeconds)) {
                    handler.onEffectEnded(ctx, e);
                }
            }
        }
    }

    /**
     * @return true if the ability fired
     */
    boolean activate(SimulationContext ctx, AbilityActivation request) {
        ArenaWorld world = ctx.world();
        int e = request.entityId();
        AbilityHandler handler = registry.get(request.kind());
        if (handler == null) {
            logger.debug("[Abilities] no handler for {}, ignoring activation by {}", request.kind(), e);
            return false;
        }
        if (!world.exists(e) || !world.isAlive(e)) {
            logger.debug("[Abilities] {} activation ignored: entity {} is not alive", request.kind(), e);
            return false;
        }
        AbilityTimer timer = handler.timerOf(world, e);
        if (timer == null) {
            logger.debug("[Abilities] entity {} has no {}", e, request.kind().getDisplayName());
            return false;
        }
        if (!timer.activate()) {
            logger.debug("[Abilities] {} of entity {} not ready ({}s left)",
                request.kind().getDisplayName(), e, String.format("%.2f", timer.getCooldown()));
            return false;
        }
        handler.onActivated(ctx, e);
        logger.debug("[Abilities] entity {} used {}", e, request.kind().getDisplayName());
        return true;
    }
}
