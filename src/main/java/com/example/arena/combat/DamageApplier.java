package com.example.arena.combat;

import com.example.arena.event.DamageEvent;
import com.example.arena.event.TickEvents;
import com.example.arena.model.Health;
import com.example.arena.model.Position;
import com.example.arena.world.ArenaWorld;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The single place health is reduced. Runs the defense modifiers, clamps
 * through {@link Health#applyDamage(double)} and records a damage event at the
 * target's position. Auto-attacks, dash contact and projectiles all go
 * through here.
 */
public class DamageApplier {
    private static final Logger logger = LoggerFactory.getLogger(DamageApplier.class);

    private final ArenaWorld world;
    private final TickEvents events;
    private final List<DefenseModifier> modifiers;

    public DamageApplier(ArenaWorld world, TickEvents events, List<DefenseModifier> modifiers) {
        this.world = world;
        this.events = events;
        this.modifiers = List.copyOf(modifiers);
    }

    /**
     * Apply {@code raw} damage from {@code source} to {@code target}.
     * Targets that are missing, have no health or are already dead are left alone.
     *
     * @return health actually removed
     */
    public double apply(int source, int target, double raw, DamageEvent.Cause cause) {
        Health health = world.get(world.healths(), target);
        if (health == null || !health.isAlive()) return 0;

        double amount = raw;
        for (DefenseModifier m : modifiers) {
            amount = m.modify(target, amount);
        }
        double removed = health.applyDamage(amount);

        Position p = world.positions().get(target);
        double x = p != null ? p.getX() : 0;
        double y = p != null ? p.getY() : 0;
        events.recordDamage(new DamageEvent(source, target, amount, x, y, cause));

        if (logger.isTraceEnabled()) {
            logger.trace("[Combat] {} hit {} for {} ({}), health now {}", source, target, amount, cause, health);
        }
        if (!health.isAlive()) {
            logger.debug("[Combat] entity {} killed by {} ({})", target, source, cause);
        }
        return removed;
    }
}
