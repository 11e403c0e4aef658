package com.example.arena.model;

/**
 * Who drives an entity's movement.
 */
public enum BehaviorMode {
    /** Orders come from the player (move commands). */
    MANUAL,
    /** The showdown has taken over: chase and fight the nearest enemy. */
    FORCED_AUTO
}
