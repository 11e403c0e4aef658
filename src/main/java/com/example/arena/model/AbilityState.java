package com.example.arena.model;

/**
 * Observable state of an ability timer.
 */
public enum AbilityState {
    /** Cooldown is zero and no effect window is open; may be activated. */
    IDLE,
    /** The timed effect window is open. */
    ACTIVE,
    /** Effect window over, waiting for the cooldown to run out. */
    COOLING_DOWN
}
