package com.example.arena.sim;

import com.example.arena.config.SimulationConfig;
import com.example.arena.event.DamageEvent;
import com.example.arena.event.DeathEvent;
import com.example.arena.match.PhaseClock;
import com.example.arena.model.AbilityTimer;
import com.example.arena.model.Health;
import com.example.arena.model.MatchPhase;
import com.example.arena.model.MatchResult;
import com.example.arena.model.Position;
import com.example.arena.model.Team;
import com.example.arena.world.ArenaWorld;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable picture of the match after a tick, plus that tick's damage and
 * death events. Taking a snapshot drains the event buffers.
 */
public record WorldSnapshot(
    long tick,
    double totalTime,
    MatchPhase phase,
    double timeUntilNextPhase,
    String banner,
    MatchResult result,
    List<EntityView> entities,
    List<DamageEvent> damageEvents,
    List<DeathEvent> deathEvents
) {

    static WorldSnapshot capture(SimulationContext ctx) {
        ArenaWorld world = ctx.world();
        SimulationConfig.PhaseTimings phases = ctx.config().phases;
        double now = world.gameTimer().getTotalTime();
        MatchPhase phase = world.showdownState().getState();
        MatchResult result = world.showdownState().getResult();

        List<EntityView> views = new ArrayList<>();
        for (int e : world.query().with(world.positions()).entities()) {
            Position p = world.positions().get(e);
            Health h = world.healths().get(e);
            Team t = world.teams().get(e);
            List<AbilityView> abilities = new ArrayList<>(3);
            addAbility(abilities, world.dashes().get(e));
            addAbility(abilities, world.shields().get(e));
            addAbility(abilities, world.rangedAttacks().get(e));
            views.add(new EntityView(e, p.getX(), p.getY(),
                h != null ? h.getCurrent() : 0,
                h != null ? h.getMax() : 0,
                t != null ? t.getId() : -1,
                world.projectiles().has(e),
                List.copyOf(abilities)));
        }

        return new WorldSnapshot(
            ctx.tickCount(),
            now,
            phase,
            PhaseClock.timeUntilNextPhase(now, phase, phases),
            PhaseClock.banner(phase, phases, result),
            result,
            List.copyOf(views),
            ctx.events().drainDamageEvents(),
            ctx.events().drainDeathEvents());
    }

    private static void addAbility(List<AbilityView> out, AbilityTimer timer) {
        if (timer != null) out.add(AbilityView.of(timer));
    }

    public EntityView entity(int id) {
        for (EntityView v : entities) {
            if (v.id() == id) return v;
        }
        return null;
    }

    public String clockText() {
        return PhaseClock.formatTime(timeUntilNextPhase);
    }
}
