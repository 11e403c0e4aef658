package com.example.arena.sim;

import com.example.arena.config.SimulationConfig;
import com.example.arena.event.InputEvent;
import com.example.arena.event.MoveCommand;
import com.example.arena.model.Behavior;
import com.example.arena.model.Facing;
import com.example.arena.model.MoveTarget;
import com.example.arena.model.Position;
import com.example.arena.model.Velocity;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Straight-line movement.
 * <p>
 * Applies this tick's move commands (ignored once manual input is locked or
 * while the unit is under forced auto-battle), steers each unit toward its
 * active move target at the configured speed, and integrates positions.
 * A unit that would reach its target this tick lands on it and stops.
 * Projectiles are moved by the ability system, not here.
 */
public class MovementSystem implements TickSystem {
    private static final Logger logger = LoggerFactory.getLogger(MovementSystem.class);

    @Override
    public String name() {
        return "Movement";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        applyCommands(ctx);

        ArenaWorld world = ctx.world();
        SimulationConfig.MovementSettings movement = ctx.config().movement;
        int[] movers = world.query()
            .with(world.positions(), world.velocities())
            .without(world.projectiles())
            .entities();
        for (int e : movers) {
            if (world.healths().has(e) && !world.isAlive(e)) continue;
            Position pos = world.positions().get(e);
            Velocity vel = world.velocities().get(e);
            MoveTarget target = world.moveTargets().get(e);

            if (target != null && target.isActive()) {
                double dist = pos.distanceTo(target.getX(), target.getY());
                double step = movement.speed * deltaSeconds;
                if (dist <= movement.arrivalThreshold || dist <= step) {
                    faceToward(world, e, target.getX() - pos.getX(), target.getY() - pos.getY());
                    if (dist > 0) world.move(e, target.getX(), target.getY());
                    target.clear();
                    vel.zero();
                    continue;
                }
                vel.set((target.getX() - pos.getX()) / dist * movement.speed,
                        (target.getY() - pos.getY()) / dist * movement.speed);
            }

            if (vel.isZero()) continue;
            faceToward(world, e, vel.getX(), vel.getY());
            world.move(e, pos.getX() + vel.getX() * deltaSeconds, pos.getY() + vel.getY() * deltaSeconds);
        }
    }

    private void applyCommands(SimulationContext ctx) {
        ArenaWorld world = ctx.world();
        for (InputEvent event : ctx.tickInput()) {
            if (!(event instanceof MoveCommand)) continue;
            MoveCommand cmd = (MoveCommand) event;
            int e = cmd.entityId();
            if (ctx.phase().locksManualInput()) {
                logger.debug("[Movement] move command for {} ignored during {}", e, ctx.phase());
                continue;
            }
            if (!world.exists(e) || !world.isAlive(e)) {
                logger.debug("[Movement] move command for missing or dead entity {} ignored", e);
                continue;
            }
            Behavior behavior = world.behaviors().get(e);
            if (behavior != null && behavior.isForcedAuto()) {
                logger.debug("[Movement] entity {} is under auto-battle, move command ignored", e);
                continue;
            }
            MoveTarget target = world.moveTargets().get(e);
            if (target == null) {
                target = new MoveTarget();
                world.moveTargets().put(e, target);
            }
            target.set(cmd.x(), cmd.y());
        }
    }

    private static void faceToward(ArenaWorld world, int entity, double dx, double dy) {
        Facing facing = world.facings().get(entity);
        if (facing != null) facing.faceAlong(dx, dy);
    }
}
