package com.example.arena.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Damage and death events produced by one tick.
 * <p>
 * Collaborators drain each list once; the next tick starts by resetting the
 * buffers, so anything left unread is dropped.
 */
public class TickEvents {
    private static final Logger logger = LoggerFactory.getLogger(TickEvents.class);

    private final List<DamageEvent> damageEvents = new ArrayList<>();
    private final List<DeathEvent> deathEvents = new ArrayList<>();

    public void recordDamage(DamageEvent event) {
        damageEvents.add(event);
    }

    public void recordDeath(DeathEvent event) {
        deathEvents.add(event);
    }

    /** Hand over the damage events and empty the buffer. */
    public List<DamageEvent> drainDamageEvents() {
        List<DamageEvent> out = List.copyOf(damageEvents);
        damageEvents.clear();
        return out;
    }

    /** Hand over the death events and empty the buffer. */
    public List<DeathEvent> drainDeathEvents() {
        List<DeathEvent> out = List.copyOf(deathEvents);
        deathEvents.clear();
        return out;
    }

    public int pendingDamageCount() {
        return damageEvents.size();
    }

    public int pendingDeathCount() {
        return deathEvents.size();
    }

    /**
     * Start a new tick.
     */
    public void reset() {
        if (!damageEvents.isEmpty() || !deathEvents.isEmpty()) {
            logger.debug("[TickEvents] dropping {} damage / {} death events nobody drained",
                damageEvents.size(), deathEvents.size());
        }
        damageEvents.clear();
        deathEvents.clear();
    }
}
