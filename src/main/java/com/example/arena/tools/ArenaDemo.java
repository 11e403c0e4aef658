package com.example.arena.tools;

import com.example.arena.config.ConfigLoader;
import com.example.arena.config.SimulationConfig;
import com.example.arena.event.DeathEvent;
import com.example.arena.model.AbilityKind;
import com.example.arena.model.MatchPhase;
import com.example.arena.model.MatchResult;
import com.example.arena.model.Team;
import com.example.arena.sim.MatchRunner;
import com.example.arena.sim.Simulation;
import com.example.arena.sim.WorldSnapshot;
import com.example.arena.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Headless match runner.
 * <p>
 * Usage: {@code ArenaDemo [unitsPerTeam] [--realtime]}. Without
 * {@code --realtime} the match is stepped as fast as possible at the
 * configured tick rate; with it the match runs on the tick thread in wall
 * clock time. Units press random abilities now and then to exercise the
 * ability pipeline.
 */
public class ArenaDemo {
    private static final Logger logger = LoggerFactory.getLogger(ArenaDemo.class);

    /** Hard stop for the headless run: well past any configured deadline. */
    private static final long MAX_TICKS = 1_000_000L;

    public static void main(String[] args) {
        int perTeam = 5;
        boolean realtime = false;
        for (String a : args) {
            if ("--realtime".equals(a)) {
                realtime = true;
            } else {
                try {
                    perTeam = Integer.parseInt(a);
                } catch (NumberFormatException e) {
                    logger.error("Usage: ArenaDemo [unitsPerTeam] [--realtime] (bad argument '{}')", a);
                    System.exit(2);
                }
            }
        }

        SimulationConfig config = ConfigLoader.load();
        MatchResult result;
        try (Simulation sim = new Simulation(config)) {
            int[] ids = sim.units().spawnTeams(perTeam);
            logger.info("[ArenaDemo] spawned {} units per team", perTeam);
            result = realtime ? runRealtime(sim, config) : runHeadless(sim, config, ids);
        }
        if (result == null) {
            logger.warn("[ArenaDemo] match did not finish");
            System.exit(1);
        }
        logger.info("[ArenaDemo] {}", result);
    }

    private static MatchResult runHeadless(Simulation sim, SimulationConfig config, int[] ids) {
        Random presses = new Random(config.runtime.seed);
        AbilityKind[] kinds = AbilityKind.values();
        double dt = config.runtime.fixedDeltaSeconds();
        int kills = 0;
        MatchPhase lastPhase = sim.phase();
        for (long tick = 0; tick < MAX_TICKS && !sim.isEnded(); tick++) {
            // roughly one press per unit every two seconds
            for (int id : ids) {
                if (presses.nextDouble() < dt / 2) {
                    sim.context().inputQueue().activate(id, kinds[presses.nextInt(kinds.length)]);
                }
            }
            sim.step(dt);
            WorldSnapshot snap = sim.snapshot();
            for (DeathEvent death : snap.deathEvents()) {
                kills++;
                logger.debug("[ArenaDemo] {} unit {} down at {}", Team.nameOf(death.teamId()), death.entityId(),
                    snap.clockText());
            }
            if (snap.phase() != lastPhase) {
                lastPhase = snap.phase();
                logger.info("[ArenaDemo] t={}s phase {} ({} units down so far)",
                    String.format("%.1f", snap.totalTime()), lastPhase.getDisplayName(), kills);
            }
        }
        return sim.result();
    }

    private static MatchResult runRealtime(Simulation sim, SimulationConfig config) {
        TickService ticks = new TickService();
        MatchRunner runner = new MatchRunner(sim, ticks, snap -> {
            if (snap.tick() % Math.max(1, Math.round(config.runtime.tickRate * 10)) == 0) {
                logger.info("[ArenaDemo] {} {} left in {}", snap.phase().getDisplayName(), snap.clockText(),
                    snap.banner().isEmpty() ? "phase" : snap.banner());
            }
        });
        long waitSeconds = Math.round(config.phases.matchEndAt) + 30;
        try {
            return runner.start().get(waitSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            logger.warn("[ArenaDemo] no result after {}s, stopping", waitSeconds);
            runner.stop();
            return null;
        } catch (ExecutionException e) {
            logger.error("[ArenaDemo] match failed", e.getCause());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            runner.stop();
            return null;
        } finally {
            try {
                ticks.shutdown(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
