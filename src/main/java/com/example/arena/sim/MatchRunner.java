package com.example.arena.sim;

import com.example.arena.model.MatchResult;
import com.example.arena.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Runs a simulation in real time on a {@link TickService}: one fixed step per
 * period, a snapshot to the listener after each step, and completion when
 * the match ends. All steps happen on the tick thread.
 */
public class MatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(MatchRunner.class);
    static final String TASK_NAME = "arena-match";

    private final Simulation simulation;
    private final TickService ticks;
    private final Consumer<WorldSnapshot> listener;
    private final CompletableFuture<MatchResult> done = new CompletableFuture<>();

    public MatchRunner(Simulation simulation, TickService ticks, Consumer<WorldSnapshot> listener) {
        this.simulation = simulation;
        this.ticks = ticks;
        this.listener = listener;
    }

    /**
     * Start ticking.
     * @return completes with the match result, or exceptionally if a tick fails
     */
    public CompletableFuture<MatchResult> start() {
        double tickRate = simulation.context().config().runtime.tickRate;
        long periodMs = Math.max(1, Math.round(1000.0 / tickRate));
        ticks.scheduleAtFixedRate(TASK_NAME, this::tick, 0, periodMs);
        logger.info("[MatchRunner] started at {} ticks/s", tickRate);
        return done;
    }

    void tick() {
        if (done.isDone()) return;
        try {
            simulation.step(simulation.context().config().runtime.fixedDeltaSeconds());
            if (listener != null) {
                listener.accept(simulation.snapshot());
            }
            if (simulation.isEnded()) {
                ticks.cancel(TASK_NAME);
                done.complete(simulation.result());
            }
        } catch (Throwable t) {
            logger.error("[MatchRunner] tick {} failed, stopping match", simulation.context().tickCount(), t);
            ticks.cancel(TASK_NAME);
            done.completeExceptionally(t);
        }
    }

    /** Stop ticking without a result. */
    public void stop() {
        ticks.cancel(TASK_NAME);
        done.cancel(false);
    }
}
