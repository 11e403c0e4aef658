package com.example.arena.combat;

import com.example.arena.event.DeathEvent;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Projectile;
import com.example.arena.model.Team;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.TickSystem;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Removes entities whose health reached zero (recording a death event for
 * each) and releases projectiles that resolved or whose owner is gone.
 * Running it on a world with nothing to remove changes nothing.
 */
public class CleanupSystem implements TickSystem {
    private static final Logger logger = LoggerFactory.getLogger(CleanupSystem.class);

    @Override
    public String name() {
        return "Cleanup";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        ArenaWorld world = ctx.world();

        Set<Integer> dead = new LinkedHashSet<>();
        for (int e : world.query().with(world.healths()).entities()) {
            Health h = world.healths().get(e);
            if (h.isAlive()) continue;
            Position p = world.positions().get(e);
            Team t = world.teams().get(e);
            ctx.events().recordDeath(new DeathEvent(e,
                t != null ? t.getId() : -1,
                p != null ? p.getX() : 0,
                p != null ? p.getY() : 0));
            dead.add(e);
        }

        int released = 0;
        for (int e : world.query().with(world.projectiles()).entities()) {
            Projectile proj = world.projectiles().get(e);
            // an owner killed this tick voids its projectiles
            if (proj.isResolved() || dead.contains(proj.getOwner()) || !world.exists(proj.getOwner())) {
                world.destroyEntity(e);
                released++;
            }
        }

        for (int e : dead) {
            world.destroyEntity(e);
        }
        if (!dead.isEmpty()) {
            logger.debug("[Cleanup] removed {} dead entities, released {} projectiles", dead.size(), released);
        }
    }
}
