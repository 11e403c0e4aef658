package com.example.arena.model;

/**
 * Timed damage reduction. While the effect window is open, incoming damage
 * is multiplied by {@code 1 - damageReduction}.
 */
public class Shield extends AbilityTimer {
    private final double damageReduction;

    public Shield(double maxCooldown, double duration, double damageReduction) {
        super(maxCooldown, duration);
        if (damageReduction < 0 || damageReduction > 1) {
            throw new IllegalArgumentException("Shield damageReduction must be in [0,1], got " + damageReduction);
        }
        this.damageReduction = damageReduction;
    }

    @Override
    public AbilityKind kind() { return AbilityKind.SHIELD; }

    public double getDamageReduction() { return damageReduction; }

    /** Multiplier applied to incoming damage right now. */
    public double incomingMultiplier() {
        return isActive() ? 1.0 - damageReduction : 1.0;
    }
}
