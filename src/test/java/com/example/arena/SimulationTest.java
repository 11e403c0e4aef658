package com.example.arena;

import com.example.arena.config.SimulationConfig;
import com.example.arena.event.AbilityActivation;
import com.example.arena.event.DeathEvent;
import com.example.arena.model.AbilityKind;
import com.example.arena.model.MatchResult;
import com.example.arena.model.Team;
import com.example.arena.sim.EntityView;
import com.example.arena.sim.Simulation;
import com.example.arena.sim.WorldSnapshot;
import com.example.arena.world.ArenaWorld;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Whole-tick behavior: ordering, snapshots, determinism and teardown.
 */
@DisplayName("Simulation")
public class SimulationTest {

    private static final double DT = 1.0 / 60;

    private static SimulationConfig strict() {
        return SimulationConfig.defaults()
            .withRuntime(new SimulationConfig.RuntimeSettings(60, 42L, true));
    }

    @Test
    @DisplayName("Two duelists trade one hit per second until one falls")
    void duel() {
        try (Simulation sim = new Simulation(strict())) {
            int a = sim.units().spawnUnit(Team.BLUE, 500, 500, 10, 200, 1.0, 100);
            int b = sim.units().spawnUnit(Team.RED, 600, 500, 10, 200, 1.0, 100);
            ArenaWorld world = sim.world();

            for (int i = 0; i < 60; i++) sim.step(DT);
            assertEquals(90, world.healths().get(a).getCurrent(), 1e-9);
            assertEquals(90, world.healths().get(b).getCurrent(), 1e-9);

            List<DeathEvent> deaths = new ArrayList<>();
            for (int i = 0; i < 540; i++) {
                sim.step(DT);
                deaths.addAll(sim.snapshot().deathEvents());
            }

            assertFalse(world.exists(a) && world.exists(b), "someone should have died within 10 seconds");
            assertFalse(deaths.isEmpty());
            for (DeathEvent death : deaths) {
                assertFalse(world.exists(death.entityId()));
                for (int e : world.query().with(world.healths()).entities()) {
                    assertNotEquals(death.entityId(), e);
                }
            }
            int survivorTeam = world.exists(a) ? Team.BLUE : Team.RED;
            assertEquals(ArenaWorld.NO_ENTITY,
                sim.context().proximity().findNearestEnemy(550, 500, survivorTeam, 1000));
        }
    }

    @Test
    @DisplayName("Event lists are handed out once")
    void snapshotDrainsEvents() {
        try (Simulation sim = new Simulation(strict())) {
            sim.units().spawnUnit(Team.BLUE, 500, 500);
            sim.units().spawnUnit(Team.RED, 550, 500);
            sim.step(DT);

            WorldSnapshot first = sim.snapshot();
            assertEquals(2, first.damageEvents().size());
            WorldSnapshot second = sim.snapshot();
            assertTrue(second.damageEvents().isEmpty());
            assertEquals(first.entities(), second.entities());
        }
    }

    @Test
    @DisplayName("Snapshots expose health, team and ability timers")
    void snapshotContents() {
        try (Simulation sim = new Simulation(strict())) {
            int a = sim.units().spawnUnit(Team.BLUE, 100, 100);
            sim.step(DT, List.of(new AbilityActivation(a, AbilityKind.SHIELD)));

            WorldSnapshot snap = sim.snapshot();
            EntityView view = snap.entity(a);
            assertNotNull(view);
            assertEquals(Team.BLUE, view.team());
            assertEquals(100, view.health(), 1e-9);
            assertFalse(view.projectile());
            assertEquals(15, view.ability(AbilityKind.SHIELD).cooldown(), 1e-9);
            assertEquals(0, view.ability(AbilityKind.DASH).cooldown(), 1e-9);
            assertEquals(1, snap.tick());
            assertEquals("1:59", snap.clockText());
        }
    }

    @Test
    @DisplayName("The same seed and input produce the same match")
    void deterministic() {
        MatchResult first = playMatch();
        MatchResult second = playMatch();
        assertNotNull(first);
        assertEquals(first, second);
    }

    private static MatchResult playMatch() {
        SimulationConfig config = strict();
        try (Simulation sim = new Simulation(config)) {
            int[] ids = sim.units().spawnTeams(4);
            Random presses = new Random(7);
            AbilityKind[] kinds = AbilityKind.values();
            for (int tick = 0; tick < 60 * 200 && !sim.isEnded(); tick++) {
                if (presses.nextInt(30) == 0) {
                    int who = ids[presses.nextInt(ids.length)];
                    sim.context().inputQueue().activate(who, kinds[presses.nextInt(kinds.length)]);
                }
                sim.step(DT);
            }
            return sim.result();
        }
    }

    @Test
    @DisplayName("runToEnd plays to a result at the configured rate")
    void runToEnd() {
        try (Simulation sim = new Simulation(strict())) {
            sim.units().spawnTeams(3);
            MatchResult result = sim.runToEnd(60L * 200);
            assertNotNull(result);
            assertTrue(result.decidedAt() >= 150);
            assertTrue(result.decidedAt() <= 180 + 1e-6);
        }
    }

    @Test
    @DisplayName("Bad time steps are rejected")
    void badDeltaRejected() {
        try (Simulation sim = new Simulation(strict())) {
            assertThrows(IllegalArgumentException.class, () -> sim.step(-0.1));
            assertThrows(IllegalArgumentException.class, () -> sim.step(Double.NaN));
        }
    }

    @Test
    @DisplayName("A closed simulation cannot be stepped")
    void closedSimulation() {
        Simulation sim = new Simulation(strict());
        sim.units().spawnTeams(2);
        sim.close();
        assertEquals(1, sim.world().entityCount());
        assertThrows(IllegalStateException.class, () -> sim.step(DT));
    }
}
