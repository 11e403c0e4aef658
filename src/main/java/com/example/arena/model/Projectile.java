package com.example.arena.model;

/**
 * In-flight ranged attack. Travels from its origin until it either touches an
 * enemy (dealing damage once) or has covered {@code maxDistance}; then it is
 * marked resolved and released by the cleanup pass.
 */
public class Projectile {
    private final int owner;
    private final int ownerTeam;
    private final double damage;
    private final double originX;
    private final double originY;
    private final double maxDistance;
    private final double hitRadius;
    private boolean resolved;

    public Projectile(int owner, int ownerTeam, double damage, double originX, double originY,
                      double maxDistance, double hitRadius) {
        this.owner = owner;
        this.ownerTeam = ownerTeam;
        this.damage = damage;
        this.originX = originX;
        this.originY = originY;
        this.maxDistance = maxDistance;
        this.hitRadius = hitRadius;
    }

    public int getOwner() { return owner; }
    public int getOwnerTeam() { return ownerTeam; }
    public double getDamage() { return damage; }
    public double getOriginX() { return originX; }
    public double getOriginY() { return originY; }
    public double getMaxDistance() { return maxDistance; }
    public double getHitRadius() { return hitRadius; }

    public boolean isResolved() { return resolved; }
    public void resolve() { this.resolved = true; }

    public double travelled(Position at) {
        return at.distanceTo(originX, originY);
    }
}
