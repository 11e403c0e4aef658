package com.example.arena.sim;

import com.example.arena.model.AbilityKind;

import java.util.List;

/**
 * Read-only copy of one entity for renderers and HUDs. {@code team} is -1 and
 * health values are 0 for entities without those components (projectiles).
 */
public record EntityView(
    int id,
    double x,
    double y,
    double health,
    double maxHealth,
    int team,
    boolean projectile,
    List<AbilityView> abilities
) {
    public AbilityView ability(AbilityKind kind) {
        for (AbilityView a : abilities) {
            if (a.kind() == kind) return a;
        }
        return null;
    }
}
