package com.example.arena.model;

/**
 * Fires a projectile along the owner's facing. The projectile is its own entity;
 * this component only remembers the last one fired.
 */
public class RangedAttack extends AbilityTimer {
    public static final int NO_PROJECTILE = -1;

    private final double range;
    private final double damage;
    private final double projectileSpeed;
    private final double hitRadius;
    private int lastProjectile = NO_PROJECTILE;

    public RangedAttack(double maxCooldown, double duration, double range, double damage,
                        double projectileSpeed, double hitRadius) {
        super(maxCooldown, duration);
        if (range < 0) throw new IllegalArgumentException("RangedAttack range must be >= 0, got " + range);
        if (!(projectileSpeed > 0)) throw new IllegalArgumentException("RangedAttack projectileSpeed must be > 0, got " + projectileSpeed);
        this.range = range;
        this.damage = Math.max(0, damage);
        this.projectileSpeed = projectileSpeed;
        this.hitRadius = Math.max(0, hitRadius);
    }

    @Override
    public AbilityKind kind() { return AbilityKind.RANGED_ATTACK; }

    public double getRange() { return range; }
    public double getDamage() { return damage; }
    public double getProjectileSpeed() { return projectileSpeed; }
    public double getHitRadius() { return hitRadius; }

    public int getLastProjectile() { return lastProjectile; }
    public void setLastProjectile(int entity) { this.lastProjectile = entity; }
}
