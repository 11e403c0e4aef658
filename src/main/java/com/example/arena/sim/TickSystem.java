package com.example.arena.sim;

/**
 * One stage of the per-tick pipeline. Systems run in a fixed order on the
 * simulation thread and may only touch the world through the context.
 */
public interface TickSystem {

    String name();

    void update(SimulationContext ctx, double deltaSeconds);
}
