package com.example.arena.combat;

import com.example.arena.model.Shield;
import com.example.arena.world.ArenaWorld;

/**
 * Scales incoming damage while the target's shield is active.
 */
public class ShieldDefense implements DefenseModifier {
    private final ArenaWorld world;

    public ShieldDefense(ArenaWorld world) {
        this.world = world;
    }

    @Override
    public double modify(int target, double amount) {
        Shield shield = world.shields().get(target);
        if (shield == null || !shield.isActive()) return amount;
        return amount * shield.incomingMultiplier();
    }
}
