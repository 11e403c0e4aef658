package com.example.arena.combat;

import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.world.ArenaWorld;

import java.util.List;

/**
 * Proximity query backed by a {@link SpatialGrid}. Grid membership is
 * reconciled before each lookup and candidates are re-checked against the
 * store; stale index entries are repaired rather than trusted.
 */
public class SpatialGridQuery implements ProximityQuery {
    private final ArenaWorld world;
    private final SpatialGrid grid;

    public SpatialGridQuery(ArenaWorld world, SpatialGrid grid) {
        this.world = world;
        this.grid = grid;
    }

    @Override
    public int findNearestEnemy(double x, double y, int team, double maxRadius) {
        grid.reconcileMembership();
        List<Integer> candidates = grid.candidates(x, y, maxRadius);
        int best = ArenaWorld.NO_ENTITY;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int e : candidates) {
            if (!grid.verify(e)) continue;
            Health h = world.healths().get(e);
            if (!h.isAlive()) continue;
            Team t = world.teams().get(e);
            if (t.getId() == team) continue;
            Position p = world.positions().get(e);
            double d = p.distanceTo(x, y);
            if (d > maxRadius) continue;
            if (d < bestDist || (d == bestDist && e < best)) {
                bestDist = d;
                best = e;
            }
        }
        return best;
    }
}
