package com.example.arena.event;

/**
 * One application of damage during a tick. {@code x, y} is where the target stood.
 */
public record DamageEvent(int sourceId, int targetId, double amount, double x, double y, Cause cause) {

    public enum Cause { AUTO_ATTACK, DASH, PROJECTILE }
}
