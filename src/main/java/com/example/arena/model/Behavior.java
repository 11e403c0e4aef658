package com.example.arena.model;

/**
 * Behavior mode of an entity. In FORCED_AUTO the entity keeps a snapshot of the
 * orders it had under MANUAL control so the override can be undone.
 */
public class Behavior {
    public static final int NO_TARGET = -1;

    private BehaviorMode mode = BehaviorMode.MANUAL;
    private SavedOrders savedOrders = SavedOrders.NONE;
    private int targetEntity = NO_TARGET;

    public BehaviorMode getMode() { return mode; }
    public SavedOrders getSavedOrders() { return savedOrders; }
    public int getTargetEntity() { return targetEntity; }

    public boolean isForcedAuto() {
        return mode == BehaviorMode.FORCED_AUTO;
    }

    /**
     * Hand control to auto-battle. The first snapshot wins; forcing an entity
     * that is already forced keeps its original orders.
     */
    public void forceAuto(SavedOrders orders) {
        if (mode == BehaviorMode.FORCED_AUTO) return;
        this.mode = BehaviorMode.FORCED_AUTO;
        this.savedOrders = orders == null ? SavedOrders.NONE : orders;
        this.targetEntity = NO_TARGET;
    }

    /**
     * Give control back to the player.
     * @return the orders to restore
     */
    public SavedOrders revertToManual() {
        SavedOrders orders = savedOrders;
        this.mode = BehaviorMode.MANUAL;
        this.savedOrders = SavedOrders.NONE;
        this.targetEntity = NO_TARGET;
        return orders;
    }

    public void setTargetEntity(int targetEntity) {
        this.targetEntity = targetEntity;
    }
}
