package com.example.arena.ability;

import com.example.arena.config.SimulationConfig;
import com.example.arena.event.DamageEvent;
import com.example.arena.model.AbilityKind;
import com.example.arena.model.AbilityTimer;
import com.example.arena.model.Dash;
import com.example.arena.model.Facing;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.ComponentTable;

/**
 * Dash: an instant jump of {@code distance} along the entity's facing,
 * clamped to the arena. Enemies within {@code contactRadius} of the travelled
 * segment take the dash damage once.
 */
public class DashHandler implements AbilityHandler {

    @Override
    public AbilityKind kind() {
        return AbilityKind.DASH;
    }

    @Override
    public ComponentTable<? extends AbilityTimer> table(ArenaWorld world) {
        return world.dashes();
    }

    @Override
    public void onActivated(SimulationContext ctx, int entity) {
        ArenaWorld world = ctx.world();
        Dash dash = world.dashes().get(entity);
        Position pos = world.positions().get(entity);
        if (pos == null) return;

        Facing facing = world.facings().get(entity);
        double dx = facing != null ? facing.dirX() : 1;
        double dy = facing != null ? facing.dirY() : 0;

        SimulationConfig.ArenaSettings arena = ctx.config().arena;
        double sx = pos.getX();
        double sy = pos.getY();
        double ex = clamp(sx + dx * dash.getDistance(), 0, arena.width);
        double ey = clamp(sy + dy * dash.getDistance(), 0, arena.height);
        world.move(entity, ex, ey);

        Team team = world.teams().get(entity);
        if (team == null || dash.getDamage() <= 0) return;
        int[] candidates = world.query()
            .with(world.positions(), world.healths(), world.teams())
            .entities();
        for (int target : candidates) {
            if (target == entity) continue;
            if (!team.isEnemyOf(world.teams().get(target).getId())) continue;
            Health h = world.healths().get(target);
            if (!h.isAlive()) continue;
            Position tp = world.positions().get(target);
            if (distanceToSegment(tp.getX(), tp.getY(), sx, sy, ex, ey) <= dash.getContactRadius()) {
                ctx.damageApplier().apply(entity, target, dash.getDamage(), DamageEvent.Cause.DASH);
            }
        }
    }

    static double distanceToSegment(double px, double py, double ax, double ay, double bx, double by) {
        double abx = bx - ax;
        double aby = by - ay;
        double lenSq = abx * abx + aby * aby;
        double t = lenSq == 0 ? 0 : ((px - ax) * abx + (py - ay) * aby) / lenSq;
        t = Math.max(0, Math.min(1, t));
        double cx = ax + t * abx - px;
        double cy = ay + t * aby - py;
        return Math.sqrt(cx * cx + cy * cy);
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
