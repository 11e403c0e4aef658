package com.example.arena.match;

import com.example.arena.config.SimulationConfig;
import com.example.arena.model.Behavior;
import com.example.arena.model.Damage;
import com.example.arena.model.Health;
import com.example.arena.model.MoveTarget;
import com.example.arena.model.Position;
import com.example.arena.model.SavedOrders;
import com.example.arena.model.Team;
import com.example.arena.model.Velocity;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Forced auto-battle: the showdown teleport, the per-tick steering of
 * forced units toward their nearest enemy, and the way back to manual control.
 */
public class AutoBattleController {
    private static final Logger logger = LoggerFactory.getLogger(AutoBattleController.class);

    /**
     * Gather every living unit at the arena center and hand it to auto-battle.
     * Positions are drawn uniformly from the teleport disc using the match's
     * seeded random source. Velocity is zeroed and move orders are saved
     * then cleared.
     *
     * @return number of units teleported
     */
    public int activateShowdown(SimulationContext ctx) {
        ArenaWorld world = ctx.world();
        SimulationConfig.ArenaSettings arena = ctx.config().arena;
        Random random = ctx.random();

        int count = 0;
        for (int e : world.query().with(world.positions(), world.healths()).entities()) {
            Health h = world.healths().get(e);
            if (!h.isAlive()) continue;

            double angle = random.nextDouble() * 2 * Math.PI;
            double r = arena.teleportRadius * Math.sqrt(random.nextDouble());
            world.move(e, arena.centerX + r * Math.cos(angle), arena.centerY + r * Math.sin(angle));

            Velocity v = world.velocities().get(e);
            if (v != null) v.zero();

            MoveTarget target = world.moveTargets().get(e);
            SavedOrders orders = SavedOrders.of(target);
            if (target != null) target.clear();

            Behavior behavior = world.behaviors().get(e);
            if (behavior == null) {
                behavior = new Behavior();
                world.behaviors().put(e, behavior);
            }
            behavior.forceAuto(orders);
            count++;
        }
        logger.info("[AutoBattle] teleported {} units to ({}, {}) within radius {}",
            count, arena.centerX, arena.centerY, arena.teleportRadius);
        return count;
    }

    /**
     * Point every forced unit at its nearest living enemy: walk toward it
     * while out of attack range, stand still once in range.
     */
    public void steer(SimulationContext ctx) {
        ArenaWorld world = ctx.world();
        int[] units = world.query()
            .with(world.behaviors(), world.positions(), world.teams(), world.healths())
            .entities();
        for (int e : units) {
            Behavior behavior = world.behaviors().get(e);
            if (!behavior.isForcedAuto() || !world.healths().get(e).isAlive()) continue;

            Position pos = world.positions().get(e);
            Team team = world.teams().get(e);
            int target = ctx.proximity().findNearestEnemy(pos, team.getId(), Double.POSITIVE_INFINITY);
            behavior.setTargetEntity(target);

            MoveTarget moveTarget = world.moveTargets().get(e);
            if (moveTarget == null) {
                moveTarget = new MoveTarget();
                world.moveTargets().put(e, moveTarget);
            }
            if (target == ArenaWorld.NO_ENTITY) {
                halt(world, e, moveTarget);
                continue;
            }
            Damage damage = world.damages().get(e);
            double reach = damage != null ? damage.getRange() : 0;
            Position tp = world.positions().get(target);
            if (pos.distanceTo(tp) > reach) {
                moveTarget.set(tp.getX(), tp.getY());
            } else {
                halt(world, e, moveTarget);
            }
        }
    }

    /**
     * Return a unit to manual control and restore the move order it had
     * before the showdown.
     *
     * @return false if the unit was not under forced auto-battle
     */
    public boolean revert(ArenaWorld world, int entity) {
        Behavior behavior = world.get(world.behaviors(), entity);
        if (behavior == null || !behavior.isForcedAuto()) return false;
        SavedOrders orders = behavior.revertToManual();
        MoveTarget target = world.moveTargets().get(entity);
        if (target != null) {
            if (orders.hadTarget()) {
                target.set(orders.targetX(), orders.targetY());
            } else {
                target.clear();
            }
        }
        return true;
    }

    private static void halt(ArenaWorld world, int entity, MoveTarget moveTarget) {
        moveTarget.clear();
        Velocity v = world.velocities().get(entity);
        if (v != null) v.zero();
    }
}
