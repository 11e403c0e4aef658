package com.example.arena.model;

/**
 * Point an entity is walking toward, written by move commands and by forced auto-battle.
 */
public class MoveTarget {
    private double x;
    private double y;
    private boolean active;

    public double getX() { return x; }
    public double getY() { return y; }
    public boolean isActive() { return active; }

    public void set(double x, double y) {
        this.x = x;
        this.y = y;
        this.active = true;
    }

    public void clear() {
        this.active = false;
    }
}
