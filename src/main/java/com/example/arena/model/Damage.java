package com.example.arena.model;

/**
 * Auto-attack profile: damage per hit, reach, attacks per second and the
 * seconds left until the next attack may land.
 */
public class Damage {
    private final double amount;
    private final double range;
    private final double attackSpeed;
    private double cooldown;

    public Damage(double amount, double range, double attackSpeed) {
        if (amount < 0) throw new IllegalArgumentException("Damage.amount must be >= 0, got " + amount);
        if (range < 0) throw new IllegalArgumentException("Damage.range must be >= 0, got " + range);
        if (!(attackSpeed > 0)) throw new IllegalArgumentException("Damage.attackSpeed must be > 0, got " + attackSpeed);
        this.amount = amount;
        this.range = range;
        this.attackSpeed = attackSpeed;
        this.cooldown = 0;
    }

    public double getAmount() { return amount; }
    public double getRange() { return range; }
    public double getAttackSpeed() { return attackSpeed; }
    public double getCooldown() { return cooldown; }

    /** Count the cooldown down by {@code deltaSeconds}, never below zero. */
    public void tick(double deltaSeconds) {
        cooldown = Math.max(0, cooldown - deltaSeconds);
    }

    public boolean isReady() {
        return cooldown <= 0;
    }

    /** Start the wait before the next attack: one attack interval. */
    public void resetCooldown() {
        cooldown = 1.0 / attackSpeed;
    }
}
