package com.example.arena.ability;

import com.example.arena.model.AbilityKind;
import com.example.arena.model.AbilityTimer;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.ComponentTable;

/**
 * Behavior behind one ability kind. The timer bookkeeping is shared
 * ({@link AbilityTimer}); a handler supplies the component table holding its
 * timers and the effect fired on activation.
 */
public interface AbilityHandler {

    AbilityKind kind();

    ComponentTable<? extends AbilityTimer> table(ArenaWorld world);

    /** Called once, right after the timer accepted an activation. */
    void onActivated(SimulationContext ctx, int entity);

    /** Called on the tick the effect window closes. */
    default void onEffectEnded(SimulationContext ctx, int entity) {
    }

    default AbilityTimer timerOf(ArenaWorld world, int entity) {
        return table(world).get(entity);
    }
}
