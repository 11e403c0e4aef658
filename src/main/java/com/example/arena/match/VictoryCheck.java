package com.example.arena.match;

import com.example.arena.model.Health;
import com.example.arena.model.MatchResult;
import com.example.arena.model.Team;
import com.example.arena.world.ArenaWorld;

/**
 * Decides whether a showdown is over.
 * <ul>
 *   <li>exactly one team with living units: that team wins,</li>
 *   <li>no team with living units: draw,</li>
 *   <li>deadline reached with both teams alive: draw.</li>
 * </ul>
 */
public final class VictoryCheck {

    private VictoryCheck() {}

    /**
     * @return the result, or null while the match goes on
     */
    public static MatchResult evaluate(ArenaWorld world, double totalTime, double deadline) {
        int[] survivors = new int[Team.COUNT];
        double[] health = new double[Team.COUNT];
        for (int e : world.query().with(world.healths(), world.teams()).entities()) {
            Health h = world.healths().get(e);
            if (!h.isAlive()) continue;
            int team = world.teams().get(e).getId();
            survivors[team]++;
            health[team] += h.getCurrent();
        }

        int teamsAlive = 0;
        int lastAlive = MatchResult.DRAW;
        for (int t = 0; t < Team.COUNT; t++) {
            if (survivors[t] > 0) {
                teamsAlive++;
                lastAlive = t;
            }
        }

        if (teamsAlive == 1) {
            return result(lastAlive, MatchResult.Reason.ELIMINATION, totalTime, survivors, health);
        }
        if (teamsAlive == 0) {
            return result(MatchResult.DRAW, MatchResult.Reason.ANNIHILATION, totalTime, survivors, health);
        }
        if (totalTime >= deadline) {
            return result(MatchResult.DRAW, MatchResult.Reason.DEADLINE, totalTime, survivors, health);
        }
        return null;
    }

    private static MatchResult result(int winner, MatchResult.Reason reason, double at,
                                      int[] survivors, double[] health) {
        return new MatchResult(winner, reason, at,
            survivors[Team.BLUE], survivors[Team.RED], health[Team.BLUE], health[Team.RED]);
    }
}
