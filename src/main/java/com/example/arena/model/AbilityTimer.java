package com.example.arena.model;

/**
 * Shared activation/cooldown bookkeeping for Dash, Shield and Ranged-Attack.
 * <p>
 * Both timers count down every tick regardless of state. Activation opens an
 * effect window of {@code duration} seconds and restarts the cooldown at
 * {@code maxCooldown}; it is only permitted while the cooldown is exactly zero.
 */
public abstract class AbilityTimer {
    private final double maxCooldown;
    private final double duration;
    private double active;
    private double cooldown;

    protected AbilityTimer(double maxCooldown, double duration) {
        if (maxCooldown < 0) throw new IllegalArgumentException(kind() + " maxCooldown must be >= 0, got " + maxCooldown);
        if (duration < 0) throw new IllegalArgumentException(kind() + " duration must be >= 0, got " + duration);
        this.maxCooldown = maxCooldown;
        this.duration = duration;
    }

    public abstract AbilityKind kind();

    public double getMaxCooldown() { return maxCooldown; }
    public double getDuration() { return duration; }
    public double getActive() { return active; }
    public double getCooldown() { return cooldown; }

    /**
     * Count both timers down by {@code deltaSeconds}, flooring at zero.
     * @return true if the effect window closed during this tick
     */
    public boolean tick(double deltaSeconds) {
        boolean wasActive = active > 0;
        active = Math.max(0, active - deltaSeconds);
        cooldown = Math.max(0, cooldown - deltaSeconds);
        return wasActive && active == 0;
    }

    public boolean isReady() {
        return cooldown == 0;
    }

    public boolean isActive() {
        return active > 0;
    }

    /**
     * Open the effect window and restart the cooldown.
     * @return false (and no change) if the ability is not ready
     */
    public boolean activate() {
        if (!isReady()) return false;
        active = duration;
        cooldown = maxCooldown;
        return true;
    }

    /** Close the effect window early; the cooldown keeps running. */
    public void endEffect() {
        active = 0;
    }

    public AbilityState getState() {
        if (active > 0) return AbilityState.ACTIVE;
        if (cooldown > 0) return AbilityState.COOLING_DOWN;
        return AbilityState.IDLE;
    }

    @Override
    public String toString() {
        return String.format("%s[%s active=%.2f cooldown=%.2f/%.2f]",
            kind().getDisplayName(), getState(), active, cooldown, maxCooldown);
    }
}
