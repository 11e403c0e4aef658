package com.example.arena.combat;

import com.example.arena.event.DamageEvent;
import com.example.arena.model.Damage;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.TickSystem;
import com.example.arena.world.ArenaWorld;

/**
 * Auto-attack resolution.
 * <p>
 * For every living entity with Damage, Position and Team: count the attack
 * cooldown down, and once it reaches zero hit the nearest living enemy inside
 * {@code Damage.range}, then restart the cooldown at one attack interval.
 * Attackers are visited in ascending id order.
 */
public class CombatResolver implements TickSystem {

    @Override
    public String name() {
        return "Combat";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        ArenaWorld world = ctx.world();
        int[] attackers = world.query()
            .with(world.damages(), world.positions(), world.teams(), world.healths())
            .entities();
        for (int e : attackers) {
            Health health = world.healths().get(e);
            if (!health.isAlive()) continue;

            Damage damage = world.damages().get(e);
            damage.tick(deltaSeconds);
            if (!damage.isReady()) continue;

            Position pos = world.positions().get(e);
            Team team = world.teams().get(e);
            int target = ctx.proximity().findNearestEnemy(pos, team.getId(), damage.getRange());
            if (target == ArenaWorld.NO_ENTITY) continue;

            ctx.damageApplier().apply(e, target, damage.getAmount(), DamageEvent.Cause.AUTO_ATTACK);
            damage.resetCooldown();
        }
    }
}
