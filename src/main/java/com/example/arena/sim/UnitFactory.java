package com.example.arena.sim;

import com.example.arena.config.SimulationConfig;
import com.example.arena.model.Behavior;
import com.example.arena.model.Damage;
import com.example.arena.model.Dash;
import com.example.arena.model.Facing;
import com.example.arena.model.Health;
import com.example.arena.model.MoveTarget;
import com.example.arena.model.Position;
import com.example.arena.model.RangedAttack;
import com.example.arena.model.Shield;
import com.example.arena.model.Team;
import com.example.arena.model.Velocity;
import com.example.arena.world.ArenaWorld;

/**
 * Creates fully equipped units from the configured base stats.
 * Blue units start facing +x, red units -x.
 */
public class UnitFactory {
    private final ArenaWorld world;
    private final SimulationConfig config;

    public UnitFactory(ArenaWorld world, SimulationConfig config) {
        this.world = world;
        this.config = config;
    }

    public int spawnUnit(int team, double x, double y) {
        SimulationConfig.CombatSettings c = config.combat;
        return spawnUnit(team, x, y, c.baseDamage, c.baseRange, c.baseAttackSpeed, c.baseHealth);
    }

    /**
     * Spawn a unit with explicit combat stats.
     * @throws IllegalArgumentException for an invalid team, health or attack speed;
     *         nothing is created in that case
     */
    public int spawnUnit(int team, double x, double y, double damage, double range,
                         double attackSpeed, double maxHealth) {
        Team t = new Team(team);
        Health health = new Health(maxHealth);
        Damage dmg = new Damage(damage, range, attackSpeed);

        SimulationConfig.DashSettings d = config.dash;
        SimulationConfig.ShieldSettings s = config.shield;
        SimulationConfig.RangedSettings r = config.ranged;

        int e = world.createEntity();
        world.positions().put(e, new Position(x, y));
        world.velocities().put(e, new Velocity());
        world.facings().put(e, new Facing(team == Team.RED ? Math.PI : 0));
        world.healths().put(e, health);
        world.teams().put(e, t);
        world.damages().put(e, dmg);
        world.dashes().put(e, new Dash(d.maxCooldown, d.duration, d.distance, d.damage, d.contactRadius));
        world.shields().put(e, new Shield(s.maxCooldown, s.duration, s.damageReduction));
        world.rangedAttacks().put(e, new RangedAttack(r.maxCooldown, r.duration, r.range, r.damage,
            r.projectileSpeed, r.hitRadius));
        world.moveTargets().put(e, new MoveTarget());
        world.behaviors().put(e, new Behavior());
        world.move(e, x, y);
        return e;
    }

    /**
     * Line up {@code perTeam} blue units on the left quarter of the arena and
     * as many red units on the right quarter.
     *
     * @return the new ids, blue first
     */
    public int[] spawnTeams(int perTeam) {
        SimulationConfig.ArenaSettings arena = config.arena;
        int[] ids = new int[perTeam * 2];
        double spacing = arena.height / (perTeam + 1);
        for (int i = 0; i < perTeam; i++) {
            double y = spacing * (i + 1);
            ids[i] = spawnUnit(Team.BLUE, arena.width * 0.25, y);
            ids[perTeam + i] = spawnUnit(Team.RED, arena.width * 0.75, y);
        }
        return ids;
    }
}
