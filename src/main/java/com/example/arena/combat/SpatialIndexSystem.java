package com.example.arena.combat;

import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.TickSystem;

/**
 * Last stage of a tick: reconcile the spatial grid with the store.
 */
public class SpatialIndexSystem implements TickSystem {

    @Override
    public String name() {
        return "SpatialIndex";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        SpatialGrid grid = ctx.spatialGrid();
        if (grid == null) return;
        grid.sync();
    }
}
