package com.example.arena;

import com.example.arena.config.SimulationConfig;
import com.example.arena.model.MatchResult;
import com.example.arena.model.Team;
import com.example.arena.sim.MatchRunner;
import com.example.arena.sim.Simulation;
import com.example.arena.util.TickService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real-time driving of a match on the tick thread.
 */
@DisplayName("Match runner")
public class MatchRunnerTest {

    private TickService ticks;

    @BeforeEach
    void setUp() {
        ticks = new TickService();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        ticks.shutdown(1000);
    }

    /** A match that reaches its deadline a tenth of a second in. */
    private static SimulationConfig quickMatch() {
        return SimulationConfig.defaults()
            .withPhases(new SimulationConfig.PhaseTimings(0.02, 0.04, 0.05, 0.1))
            .withRuntime(new SimulationConfig.RuntimeSettings(200, 42L, true));
    }

    @Test
    @DisplayName("Runs to the deadline and publishes a snapshot per tick")
    void runsToCompletion() throws Exception {
        AtomicInteger snapshots = new AtomicInteger();
        try (Simulation sim = new Simulation(quickMatch())) {
            sim.units().spawnUnit(Team.BLUE, 100, 100, 10, 10, 1.0, 100);
            sim.units().spawnUnit(Team.RED, 1800, 900, 10, 10, 1.0, 100);
            MatchRunner runner = new MatchRunner(sim, ticks, snap -> snapshots.incrementAndGet());

            MatchResult result = runner.start().get(10, TimeUnit.SECONDS);

            assertTrue(result.isDraw());
            assertEquals(MatchResult.Reason.DEADLINE, result.reason());
            assertTrue(snapshots.get() >= 20, "snapshots: " + snapshots.get());
            assertTrue(sim.isEnded());
        }
    }

    @Test
    @DisplayName("A failing tick stops the match and fails the future")
    void failingTick() {
        try (Simulation sim = new Simulation(quickMatch())) {
            sim.units().spawnTeams(1);
            MatchRunner runner = new MatchRunner(sim, ticks, snap -> {
                throw new IllegalStateException("renderer exploded");
            });

            CompletableFuture<MatchResult> done = runner.start();

            ExecutionException ex = assertThrows(ExecutionException.class, () -> done.get(10, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertFalse(ticks.isScheduled("arena-match"));
        }
    }
}
