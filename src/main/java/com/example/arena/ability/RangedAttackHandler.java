package com.example.arena.ability;

import com.example.arena.model.AbilityKind;
import com.example.arena.model.AbilityTimer;
import com.example.arena.model.Facing;
import com.example.arena.model.Position;
import com.example.arena.model.Projectile;
import com.example.arena.model.RangedAttack;
import com.example.arena.model.Team;
import com.example.arena.model.Velocity;
import com.example.arena.sim.SimulationContext;
import com.example.arena.world.ArenaWorld;
import com.example.arena.world.ComponentTable;

/**
 * Ranged attack: spawns a projectile entity at the caster's position. It flies
 * toward the nearest enemy within range, or along the caster's facing if
 * there is none, and starts moving on the next tick.
 */
public class RangedAttackHandler implements AbilityHandler {

    @Override
    public AbilityKind kind() {
        return AbilityKind.RANGED_ATTACK;
    }

    @Override
    public ComponentTable<? extends AbilityTimer> table(ArenaWorld world) {
        return world.rangedAttacks();
    }

    @Override
    public void onActivated(SimulationContext ctx, int entity) {
        ArenaWorld world = ctx.world();
        RangedAttack ranged = world.rangedAttacks().get(entity);
        Position pos = world.positions().get(entity);
        Team team = world.teams().get(entity);
        if (pos == null || team == null) return;

        double dx;
        double dy;
        int target = ctx.proximity().findNearestEnemy(pos, team.getId(), ranged.getRange());
        Facing facing = world.facings().get(entity);
        if (target != ArenaWorld.NO_ENTITY && world.positions().get(target).distanceTo(pos) > 0) {
            Position tp = world.positions().get(target);
            double d = tp.distanceTo(pos);
            dx = (tp.getX() - pos.getX()) / d;
            dy = (tp.getY() - pos.getY()) / d;
            if (facing != null) facing.faceAlong(dx, dy);
        } else if (facing != null) {
            dx = facing.dirX();
            dy = facing.dirY();
        } else {
            dx = 1;
            dy = 0;
        }

        int projectile = world.createEntity();
        world.positions().put(projectile, new Position(pos.getX(), pos.getY()));
        world.velocities().put(projectile,
            new Velocity(dx * ranged.getProjectileSpeed(), dy * ranged.getProjectileSpeed()));
        world.projectiles().put(projectile, new Projectile(entity, team.getId(), ranged.getDamage(),
            pos.getX(), pos.getY(), ranged.getRange(), ranged.getHitRadius()));
        ranged.setLastProjectile(projectile);
    }
}
