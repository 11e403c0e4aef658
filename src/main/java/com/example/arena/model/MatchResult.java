package com.example.arena.model;

/**
 * Outcome of a finished match.
 *
 * @param winningTeam team id, or {@link #DRAW}
 * @param reason why the match ended
 * @param decidedAt match time of the decision, in seconds
 */
public record MatchResult(
    int winningTeam,
    Reason reason,
    double decidedAt,
    int blueSurvivors,
    int redSurvivors,
    double blueHealth,
    double redHealth
) {
    public static final int DRAW = -1;

    public enum Reason {
        /** Only one team still has living units. */
        ELIMINATION,
        /** Nobody is left standing. */
        ANNIHILATION,
        /** The end-of-match deadline arrived with both teams alive. */
        DEADLINE
    }

    public boolean isDraw() {
        return winningTeam == DRAW;
    }

    @Override
    public String toString() {
        String who = isDraw() ? "draw" : "team " + winningTeam + " (" + Team.nameOf(winningTeam) + ") wins";
        return String.format("MatchResult[%s by %s at %.2fs, survivors %d/%d, health %.0f/%.0f]",
            who, reason, decidedAt, blueSurvivors, redSurvivors, blueHealth, redHealth);
    }
}
