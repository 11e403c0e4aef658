package com.example.arena.match;

import com.example.arena.config.SimulationConfig.PhaseTimings;
import com.example.arena.model.MatchPhase;
import com.example.arena.model.MatchResult;

/**
 * Pure functions of match time against the configured phase thresholds,
 * plus the text the HUD shows for each phase.
 */
public final class PhaseClock {

    private PhaseClock() {}

    /**
     * Phase the timeline says we should be in at {@code totalTime}. Never
     * returns ENDED; only a victory or the deadline ends a match.
     */
    public static MatchPhase phaseFor(double totalTime, PhaseTimings phases) {
        if (totalTime >= phases.showdownAt) return MatchPhase.SHOWDOWN;
        if (totalTime >= phases.collapseAt) return MatchPhase.COLLAPSE;
        if (totalTime >= phases.warningAt) return MatchPhase.WARNING;
        return MatchPhase.NORMAL;
    }

    /**
     * Seconds until the next scheduled transition. During SHOWDOWN that is the
     * deadline; once ENDED it is zero.
     */
    public static double timeUntilNextPhase(double totalTime, MatchPhase current, PhaseTimings phases) {
        double next;
        switch (current) {
            case NORMAL:
                next = phases.warningAt;
                break;
            case WARNING:
                next = phases.collapseAt;
                break;
            case COLLAPSE:
                next = phases.showdownAt;
                break;
            case SHOWDOWN:
                next = phases.matchEndAt;
                break;
            default:
                return 0;
        }
        return Math.max(0, next - totalTime);
    }

    /** {@code M:SS}, both parts rounded down. Negative input reads as 0:00. */
    public static String formatTime(double seconds) {
        if (!(seconds > 0)) return "0:00";
        int minutes = (int) Math.floor(seconds / 60);
        int secs = (int) Math.floor(seconds % 60);
        return String.format("%d:%02d", minutes, secs);
    }

    /**
     * Banner text for the phase, empty during NORMAL.
     *
     * @param result the recorded result; only read when ENDED
     */
    public static String banner(MatchPhase phase, PhaseTimings phases, MatchResult result) {
        switch (phase) {
            case WARNING:
                long secs = Math.round(phases.showdownAt - phases.warningAt);
                return "ARENA COLLAPSE IN " + secs + " SECONDS";
            case COLLAPSE:
                return "PREPARE FOR FINAL SHOWDOWN";
            case SHOWDOWN:
                return "FINAL SHOWDOWN!";
            case ENDED:
                if (result == null) return "";
                return result.isDraw() ? "DRAW!" : "TEAM " + result.winningTeam() + " WINS!";
            default:
                return "";
        }
    }
}
