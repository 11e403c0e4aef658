package com.example.arena.event;

import com.example.arena.model.AbilityKind;

/**
 * Edge-triggered request ("key just pressed") to fire an ability. Consumed by
 * the tick it is delivered to, whether or not the ability fires.
 */
public record AbilityActivation(int entityId, AbilityKind kind) implements InputEvent {

    public AbilityActivation {
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
    }
}
