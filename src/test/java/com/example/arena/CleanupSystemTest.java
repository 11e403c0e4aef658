package com.example.arena;

import com.example.arena.combat.CleanupSystem;
import com.example.arena.config.SimulationConfig;
import com.example.arena.event.DeathEvent;
import com.example.arena.model.Position;
import com.example.arena.model.Projectile;
import com.example.arena.model.Team;
import com.example.arena.model.Velocity;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.UnitFactory;
import com.example.arena.world.ArenaWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Removal of dead units and finished projectiles.
 */
@DisplayName("Cleanup")
public class CleanupSystemTest {

    private SimulationConfig config;
    private SimulationContext ctx;
    private UnitFactory units;
    private final CleanupSystem cleanup = new CleanupSystem();

    @BeforeEach
    void setUp() {
        config = SimulationConfig.defaults()
            .withRuntime(new SimulationConfig.RuntimeSettings(60, 42L, true));
        ctx = new SimulationContext(config);
        units = new UnitFactory(ctx.world(), config);
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    @DisplayName("Nothing dead means nothing changes, however often it runs")
    void idempotentWhenNothingDead() {
        int a = units.spawnUnit(Team.BLUE, 100, 100);
        int b = units.spawnUnit(Team.RED, 300, 100);
        ctx.world().healths().get(b).setCurrent(1);
        int before = ctx.world().entityCount();

        cleanup.update(ctx, 0.016);
        cleanup.update(ctx, 0.016);

        assertEquals(before, ctx.world().entityCount());
        assertTrue(ctx.world().exists(a));
        assertTrue(ctx.world().exists(b));
        assertEquals(1, ctx.world().healths().get(b).getCurrent(), 1e-9);
        assertEquals(0, ctx.events().pendingDeathCount());
    }

    @Test
    @DisplayName("Dead units are removed once with a death event")
    void deadUnitRemoved() {
        units.spawnUnit(Team.BLUE, 100, 100);
        int b = units.spawnUnit(Team.RED, 300, 200);
        ctx.world().healths().get(b).setCurrent(0);

        cleanup.update(ctx, 0.016);
        cleanup.update(ctx, 0.016);

        assertFalse(ctx.world().exists(b));
        assertFalse(ctx.spatialGrid().contains(b));
        List<DeathEvent> deaths = ctx.events().drainDeathEvents();
        assertEquals(1, deaths.size());
        assertEquals(new DeathEvent(b, Team.RED, 300, 200), deaths.get(0));
        assertEquals(ArenaWorld.NO_ENTITY, ctx.proximity().findNearestEnemy(300, 200, Team.BLUE, 50));
    }

    @Test
    @DisplayName("Projectiles die with their owner")
    void projectileVoidedWithOwner() {
        int owner = units.spawnUnit(Team.BLUE, 100, 100);
        int projectile = spawnProjectile(owner, false);
        ctx.world().healths().get(owner).setCurrent(0);

        cleanup.update(ctx, 0.016);

        assertFalse(ctx.world().exists(owner));
        assertFalse(ctx.world().exists(projectile));
    }

    @Test
    @DisplayName("Resolved projectiles are released, live ones stay")
    void resolvedProjectileReleased() {
        int owner = units.spawnUnit(Team.BLUE, 100, 100);
        int done = spawnProjectile(owner, true);
        int flying = spawnProjectile(owner, false);

        cleanup.update(ctx, 0.016);

        assertFalse(ctx.world().exists(done));
        assertTrue(ctx.world().exists(flying));
        assertEquals(0, ctx.events().pendingDeathCount());
    }

    private int spawnProjectile(int owner, boolean resolved) {
        ArenaWorld world = ctx.world();
        int p = world.createEntity();
        world.positions().put(p, new Position(100, 100));
        world.velocities().put(p, new Velocity(300, 0));
        Projectile proj = new Projectile(owner, Team.BLUE, 40, 100, 100, 300, 15);
        if (resolved) proj.resolve();
        world.projectiles().put(p, proj);
        return p;
    }
}
