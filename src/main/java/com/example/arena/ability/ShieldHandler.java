package com.example.arena.ability;

import com.example.arena.model.AbilityKind;
import com.example.arena.model.AbilityTimer;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.ComponentTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shield has no immediate effect. While its window is open the damage
 * applier scales incoming hits (see {@code ShieldDefense}).
 */
public class ShieldHandler implements AbilityHandler {
    private static final Logger logger = LoggerFactory.getLogger(ShieldHandler.class);

    @Override
    public AbilityKind kind() {
        return AbilityKind.SHIELD;
    }

    @Override
    public ComponentTable<? extends AbilityTimer> table(ArenaWorld world) {
        return world.shields();
    }

    @Override
    public void onActivated(SimulationContext ctx, int entity) {
        logger.trace("[Abilities] shield up on {}", entity);
    }

    @Override
    public void onEffectEnded(SimulationContext ctx, int entity) {
        logger.trace("[Abilities] shield down on {}", entity);
    }
}
