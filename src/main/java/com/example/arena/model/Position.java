package com.example.arena.model;

/**
 * World-space location of an entity.
 * Indexed entities should be moved through {@code ArenaWorld.move} so the
 * spatial index stays in step with the stored coordinates.
 */
public class Position {
    private double x;
    private double y;

    public Position(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public void set(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double distanceTo(double ox, double oy) {
        double dx = ox - x;
        double dy = oy - y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    public double distanceTo(Position other) {
        return distanceTo(other.x, other.y);
    }

    @Override
    public String toString() {
        return String.format("(%.1f, %.1f)", x, y);
    }
}
