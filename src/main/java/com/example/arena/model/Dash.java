package com.example.arena.model;

/**
 * Instant forward displacement with contact damage along the traversed path.
 */
public class Dash extends AbilityTimer {
    private final double distance;
    private final double damage;
    private final double contactRadius;

    public Dash(double maxCooldown, double duration, double distance, double damage, double contactRadius) {
        super(maxCooldown, duration);
        if (distance < 0) throw new IllegalArgumentException("Dash distance must be >= 0, got " + distance);
        this.distance = distance;
        this.damage = Math.max(0, damage);
        this.contactRadius = Math.max(0, contactRadius);
    }

    @Override
    public AbilityKind kind() { return AbilityKind.DASH; }

    public double getDistance() { return distance; }
    public double getDamage() { return damage; }
    public double getContactRadius() { return contactRadius; }
}
