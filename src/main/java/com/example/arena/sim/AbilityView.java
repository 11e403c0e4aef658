package com.example.arena.sim;

import com.example.arena.model.AbilityKind;
import com.example.arena.model.AbilityState;
import com.example.arena.model.AbilityTimer;

/**
 * Read-only copy of one ability's timers.
 */
public record AbilityView(AbilityKind kind, AbilityState state, double active, double cooldown, double maxCooldown) {

    static AbilityView of(AbilityTimer timer) {
        return new AbilityView(timer.kind(), timer.getState(), timer.getActive(), timer.getCooldown(),
            timer.getMaxCooldown());
    }
}
