package com.example.arena.model;

/**
 * Movement orders an entity had before auto-battle took control.
 */
public record SavedOrders(double targetX, double targetY, boolean hadTarget) {

    public static final SavedOrders NONE = new SavedOrders(0, 0, false);

    public static SavedOrders of(MoveTarget target) {
        if (target == null || !target.isActive()) return NONE;
        return new SavedOrders(target.getX(), target.getY(), true);
    }
}
