package com.example.arena.combat;

import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.world.ArenaWorld;

/**
 * Proximity query that checks every targetable entity. Fine for small matches
 * and used as the reference behavior for the grid-backed query.
 */
public class LinearScanQuery implements ProximityQuery {
    private final ArenaWorld world;

    public LinearScanQuery(ArenaWorld world) {
        this.world = world;
    }

    @Override
    public int findNearestEnemy(double x, double y, int team, double maxRadius) {
        int best = ArenaWorld.NO_ENTITY;
        double bestDist = Double.POSITIVE_INFINITY;
        int[] candidates = world.query()
            .with(world.positions(), world.healths(), world.teams())
            .entities();
        for (int e : candidates) {
            Health h = world.healths().get(e);
            if (!h.isAlive()) continue;
            Team t = world.teams().get(e);
            if (t.getId() == team) continue;
            Position p = world.positions().get(e);
            double d = p.distanceTo(x, y);
            if (d > maxRadius) continue;
            // candidates are ascending, so strict < keeps the lowest id on ties
            if (d < bestDist) {
                bestDist = d;
                best = e;
            }
        }
        return best;
    }
}
