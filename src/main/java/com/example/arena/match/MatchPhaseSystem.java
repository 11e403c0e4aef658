package com.example.arena.match;

import com.example.arena.config.SimulationConfig.PhaseTimings;
import com.example.arena.model.MatchPhase;
import com.example.arena.model.MatchResult;
import com.example.arena.model.ShowdownState;
import com.example.arena.sim.SimulationContext;
import com.example.arena.sim.TickSystem;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Match timeline: NORMAL, WARNING, COLLAPSE, SHOWDOWN, ENDED.
 * <p>
 * Advances the game clock and moves the phase forward whenever a threshold
 * has been crossed, one phase at a time, so a large time step still passes
 * through every intermediate phase. Entering SHOWDOWN triggers the teleport
 * and forced auto-battle. During SHOWDOWN each tick checks for a winner and
 * then steers the forced units, starting with the tick after the teleport. ENDED is terminal and does nothing.
 */
public class MatchPhaseSystem implements TickSystem {
    private static final Logger logger = LoggerFactory.getLogger(MatchPhaseSystem.class);

    private final AutoBattleController autoBattle;

    public MatchPhaseSystem() {
        this(new AutoBattleController());
    }

    public MatchPhaseSystem(AutoBattleController autoBattle) {
        this.autoBattle = autoBattle;
    }

    @Override
    public String name() {
        return "MatchPhase";
    }

    @Override
    public void update(SimulationContext ctx, double deltaSeconds) {
        ArenaWorld world = ctx.world();
        ShowdownState state = world.showdownState();
        if (state.getState() == MatchPhase.ENDED) return;

        PhaseTimings phases = ctx.config().phases;
        double now = world.gameTimer().advance(deltaSeconds);

        MatchPhase due = PhaseClock.phaseFor(now, phases);
        boolean gathered = false;
        while (state.getState().isBefore(due)) {
            MatchPhase next = state.getState().next();
            state.transitionTo(next, now);
            logger.info("[MatchPhase] {} -> {} at {}", state.getLastState(), next, PhaseClock.formatTime(now));
            String banner = PhaseClock.banner(next, phases, null);
            if (!banner.isEmpty()) {
                logger.info("[MatchPhase] {}", banner);
            }
            if (next == MatchPhase.SHOWDOWN) {
                autoBattle.activateShowdown(ctx);
                gathered = true;
            }
        }

        if (state.getState() == MatchPhase.SHOWDOWN) {
            MatchResult result = VictoryCheck.evaluate(world, now, phases.matchEndAt);
            if (result != null) {
                state.end(result, now);
                logger.info("[MatchPhase] match over: {}", result);
                logger.info("[MatchPhase] {}", PhaseClock.banner(MatchPhase.ENDED, phases, result));
                return;
            }
            // units hold their teleport position on the tick they arrive
            if (!gathered) autoBattle.steer(ctx);
        }
    }

    public AutoBattleController autoBattle() {
        return autoBattle;
    }
}
