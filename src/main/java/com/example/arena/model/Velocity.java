package com.example.arena.model;

/**
 * Per-second displacement, used for movement integration and facing.
 */
public class Velocity {
    private double x;
    private double y;

    public Velocity() {
        this(0, 0);
    }

    public Velocity(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public void set(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public void zero() {
        this.x = 0;
        this.y = 0;
    }

    public boolean isZero() {
        return x == 0 && y == 0;
    }
}
