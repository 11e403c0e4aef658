package com.example.arena;

import com.example.arena.combat.ProximityQuery;
import com.example.arena.combat.SpatialGrid;
import com.example.arena.config.SimulationConfig;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.sim.Simulation;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.UnitFactory;
import com.example.arena.world.ArenaWorld;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Nearest-enemy lookup, with and without the spatial grid, and the grid's
 * desync detection.
 */
@DisplayName("Proximity query")
public class ProximityQueryTest {

    private static SimulationConfig config(boolean grid) {
        return SimulationConfig.defaults()
            .withSpatial(new SimulationConfig.SpatialSettings(grid, 64))
            .withRuntime(new SimulationConfig.RuntimeSettings(60, 42L, true));
    }

    @ParameterizedTest(name = "grid={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("Strictly nearest enemy wins")
    void nearest(boolean grid) {
        SimulationConfig cfg = config(grid);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            units.spawnUnit(Team.BLUE, 0, 0);
            units.spawnUnit(Team.RED, 50, 0);
            int nearer = units.spawnUnit(Team.RED, 0, 30);
            units.spawnUnit(Team.BLUE, 5, 5);

            assertEquals(nearer, ctx.proximity().findNearestEnemy(0, 0, Team.BLUE, 1000));
        }
    }

    @ParameterizedTest(name = "grid={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("Equal distances resolve to the lowest id")
    void tieBreak(boolean grid) {
        SimulationConfig cfg = config(grid);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int first = units.spawnUnit(Team.RED, 200, 100);
            units.spawnUnit(Team.RED, 0, 100);
            units.spawnUnit(Team.RED, 100, 200);

            assertEquals(first, ctx.proximity().findNearestEnemy(100, 100, Team.BLUE, 500));
        }
    }

    @ParameterizedTest(name = "grid={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("The radius is inclusive and bounds the search")
    void radius(boolean grid) {
        SimulationConfig cfg = config(grid);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int red = units.spawnUnit(Team.RED, 100, 0);
            ProximityQuery q = ctx.proximity();

            assertEquals(ArenaWorld.NO_ENTITY, q.findNearestEnemy(0, 0, Team.BLUE, 99.9));
            assertEquals(red, q.findNearestEnemy(0, 0, Team.BLUE, 100));
            assertEquals(red, q.findNearestEnemy(0, 0, Team.BLUE, Double.POSITIVE_INFINITY));
        }
    }

    @ParameterizedTest(name = "grid={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("Dead units and allies are never returned")
    void deadAndAlliesSkipped(boolean grid) {
        SimulationConfig cfg = config(grid);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int dead = units.spawnUnit(Team.RED, 10, 0);
            int blue = units.spawnUnit(Team.BLUE, 200, 0);
            int alive = units.spawnUnit(Team.RED, 90, 0);
            ctx.world().healths().get(dead).setCurrent(0);

            assertEquals(alive, ctx.proximity().findNearestEnemy(0, 0, Team.BLUE, 500));
            // red asking: the closer reds are allies, so the blue unit further out wins
            assertEquals(blue, ctx.proximity().findNearestEnemy(0, 0, Team.RED, 500));
            assertEquals(ArenaWorld.NO_ENTITY, ctx.proximity().findNearestEnemy(0, 0, Team.RED, 150));
        }
    }

    @Test
    @DisplayName("Moves through the world keep the grid current")
    void gridFollowsMoves() {
        SimulationConfig cfg = config(true);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int red = units.spawnUnit(Team.RED, 10, 10);
            ctx.world().move(red, 1000, 1000);

            assertEquals(red, ctx.proximity().findNearestEnemy(990, 990, Team.BLUE, 50));
            assertEquals(ArenaWorld.NO_ENTITY, ctx.proximity().findNearestEnemy(10, 10, Team.BLUE, 50));
            assertEquals(0, ctx.spatialGrid().getRepairCount());
        }
    }

    @Test
    @DisplayName("Sync repairs an entry whose position changed behind the grid's back")
    void syncRepairsStaleCell() {
        SimulationConfig cfg = config(true);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int red = units.spawnUnit(Team.RED, 10, 10);
            ctx.world().positions().get(red).set(1000, 1000);

            SpatialGrid grid = ctx.spatialGrid();
            assertEquals(1, grid.sync());
            assertEquals(red, ctx.proximity().findNearestEnemy(990, 990, Team.BLUE, 50));
            assertEquals(0, grid.sync());
            assertEquals(1, grid.getRepairCount());
        }
    }

    @Test
    @DisplayName("A query that meets an id missing from the store drops it")
    void queryRepairsMissingEntity() {
        SimulationConfig cfg = config(true);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int red = units.spawnUnit(Team.RED, 10, 10);
            SpatialGrid grid = ctx.spatialGrid();

            ctx.world().setPositionListener(null);
            ctx.world().destroyEntity(red);
            ctx.world().setPositionListener(grid);
            assertTrue(grid.contains(red));

            assertEquals(ArenaWorld.NO_ENTITY, ctx.proximity().findNearestEnemy(0, 0, Team.BLUE, 100));
            assertFalse(grid.contains(red));
            assertEquals(1, grid.getRepairCount());
        }
    }

    @ParameterizedTest(name = "grid={0}")
    @ValueSource(booleans = {false, true})
    @DisplayName("A unit assembled straight from components is found before any tick")
    void handBuiltUnitFoundImmediately(boolean grid) {
        SimulationConfig cfg = config(grid);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            units.spawnUnit(Team.BLUE, 500, 500);
            ArenaWorld world = ctx.world();
            int red = world.createEntity();
            world.positions().put(red, new Position(550, 500));
            world.healths().put(red, new Health(100));
            world.teams().put(red, new Team(Team.RED));

            assertEquals(red, ctx.proximity().findNearestEnemy(500, 500, Team.BLUE, 200));
            if (grid) {
                assertTrue(ctx.spatialGrid().contains(red));
                assertEquals(1, ctx.spatialGrid().getRepairCount());
                assertEquals(0, ctx.spatialGrid().reconcileMembership());
            }
        }
    }

    @Test
    @DisplayName("A unit assembled straight from components is attacked on the first tick")
    void handBuiltUnitAttackedOnFirstTick() {
        try (Simulation sim = new Simulation(config(true))) {
            sim.units().spawnUnit(Team.BLUE, 500, 500);
            ArenaWorld world = sim.world();
            int red = world.createEntity();
            world.positions().put(red, new Position(550, 500));
            world.healths().put(red, new Health(100));
            world.teams().put(red, new Team(Team.RED));

            sim.step(1.0 / 60);

            assertEquals(90.0, world.healths().get(red).getCurrent(), 1e-9);
        }
    }

    @Test
    @DisplayName("Membership check is skipped while no component was attached or detached")
    void membershipCheckIdleWithoutChanges() {
        SimulationConfig cfg = config(true);
        try (SimulationContext ctx = new SimulationContext(cfg)) {
            UnitFactory units = new UnitFactory(ctx.world(), cfg);
            int red = units.spawnUnit(Team.RED, 10, 10);
            SpatialGrid grid = ctx.spatialGrid();

            assertEquals(0, grid.reconcileMembership());
            assertEquals(0, grid.reconcileMembership());
            assertTrue(grid.contains(red));
            assertEquals(0, grid.getRepairCount());
        }
    }
}
