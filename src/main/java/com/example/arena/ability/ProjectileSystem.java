package com.example.arena.ability;

import com.example.arena.event.DamageEvent;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Projectile;
import com.example.arena.model.Velocity;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;

/**
 * Moves projectiles by {@code velocity * dt}, never past their maximum
 * distance. The whole path flown this tick is swept: the first enemy whose
 * centre lies within the hit radius of that path is damaged once. A projectile
 * that has flown its maximum distance without hitting anything simply expires.
 * Either way it is marked resolved and the cleanup pass removes it.
 */
public class ProjectileSystem {

    public void advance(SimulationContext ctx, double deltaSeconds) {
        ArenaWorld world = ctx.world();
        int[] inFlight = world.query()
            .with(world.projectiles(), world.positions(), world.velocities())
            .entities();
        for (int e : inFlight) {
            Projectile proj = world.projectiles().get(e);
            if (proj.isResolved()) continue;

            Position pos = world.positions().get(e);
            Velocity vel = world.velocities().get(e);
            double sx = pos.getX();
            double sy = pos.getY();
            double stepX = vel.getX() * deltaSeconds;
            double stepY = vel.getY() * deltaSeconds;
            double stepLen = Math.sqrt(stepX * stepX + stepY * stepY);
            double remaining = Math.max(0, proj.getMaxDistance() - proj.travelled(pos));
            boolean reachedEnd = stepLen >= remaining;
            if (stepLen > remaining) {
                double scale = remaining / stepLen;
                stepX *= scale;
                stepY *= scale;
            }
            double ex = sx + stepX;
            double ey = sy + stepY;
            world.move(e, ex, ey);

            int hit = firstHit(world, proj, sx, sy, ex, ey);
            if (hit != ArenaWorld.NO_ENTITY) {
                ctx.damageApplier().apply(proj.getOwner(), hit, proj.getDamage(), DamageEvent.Cause.PROJECTILE);
                proj.resolve();
            } else if (reachedEnd || proj.travelled(pos) >= proj.getMaxDistance()) {
                proj.resolve();
            }
        }
    }

    /**
     * Living enemy met earliest along the segment, ties going to the closer
     * one and then the lower id.
     */
    private static int firstHit(ArenaWorld world, Projectile proj, double sx, double sy, double ex, double ey) {
        int[] targets = world.query()
            .with(world.positions(), world.healths(), world.teams())
            .entities();
        int best = ArenaWorld.NO_ENTITY;
        double bestT = Double.POSITIVE_INFINITY;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int target : targets) {
            if (world.teams().get(target).getId() == proj.getOwnerTeam()) continue;
            Health h = world.healths().get(target);
            if (!h.isAlive()) continue;
            Position tp = world.positions().get(target);
            double dist = DashHandler.distanceToSegment(tp.getX(), tp.getY(), sx, sy, ex, ey);
            if (dist > proj.getHitRadius()) continue;
            double t = alongSegment(tp.getX(), tp.getY(), sx, sy, ex, ey);
            if (t < bestT || (t == bestT && dist < bestDist)) {
                bestT = t;
                bestDist = dist;
                best = target;
            }
        }
        return best;
    }

    private static double alongSegment(double px, double py, double ax, double ay, double bx, double by) {
        double abx = bx - ax;
        double aby = by - ay;
        double lenSq = abx * abx + aby * aby;
        if (lenSq == 0) return 0;
        double t = ((px - ax) * abx + (py - ay) * aby) / lenSq;
        return Math.max(0, Math.min(1, t));
    }
}
