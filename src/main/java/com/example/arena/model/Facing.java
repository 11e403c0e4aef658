package com.example.arena.model;

/**
 * Direction an entity last moved in, in radians. Dash and ranged attacks fire along it.
 * A unit that has never moved faces +x.
 */
public class Facing {
    private double angle;

    public Facing() {
        this(0);
    }

    public Facing(double angle) {
        this.angle = angle;
    }

    public double getAngle() { return angle; }
    public void setAngle(double angle) { this.angle = angle; }

    /** Unit vector x component. */
    public double dirX() { return Math.cos(angle); }

    /** Unit vector y component. */
    public double dirY() { return Math.sin(angle); }

    /** Point the facing along a velocity; zero vectors leave it untouched. */
    public void faceAlong(double vx, double vy) {
        if (vx == 0 && vy == 0) return;
        this.angle = Math.atan2(vy, vx);
    }
}
