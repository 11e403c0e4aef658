package com.example.arena.model;

/**
 * Hit points of an entity. {@code current} is always kept inside [0, max];
 * an entity is alive while {@code current > 0}.
 */
public class Health {
    private double current;
    private final double max;

    public Health(double max) {
        this(max, max);
    }

    public Health(double current, double max) {
        if (!(max > 0)) {
            throw new IllegalArgumentException("Health.max must be > 0, got " + max);
        }
        this.max = max;
        this.current = clamp(current);
    }

    public double getCurrent() { return current; }
    public double getMax() { return max; }

    public boolean isAlive() {
        return current > 0;
    }

    public void setCurrent(double value) {
        this.current = clamp(value);
    }

    /**
     * Subtract damage, clamping at zero.
     * @return the amount actually removed
     */
    public double applyDamage(double amount) {
        if (amount <= 0) return 0;
        double before = current;
        current = clamp(current - amount);
        return before - current;
    }

    private double clamp(double value) {
        if (Double.isNaN(value)) return 0;
        return Math.max(0, Math.min(max, value));
    }

    @Override
    public String toString() {
        return String.format("%.1f/%.1f", current, max);
    }
}
