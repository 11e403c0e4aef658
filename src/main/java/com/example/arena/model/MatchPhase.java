package com.example.arena.model;

/**
 * Stages of the match timeline, in the only order they may occur.
 */
public enum MatchPhase {
    NORMAL("Normal"),
    WARNING("Warning"),
    COLLAPSE("Collapse"),
    SHOWDOWN("Showdown"),
    ENDED("Ended");

    private final String displayName;

    MatchPhase(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** The following phase, or this one for the terminal phase. */
    public MatchPhase next() {
        MatchPhase[] all = values();
        return ordinal() + 1 < all.length ? all[ordinal() + 1] : this;
    }

    public boolean isBefore(MatchPhase other) {
        return ordinal() < other.ordinal();
    }

    /** Manual movement and selection are ignored in these phases. */
    public boolean locksManualInput() {
        return this == SHOWDOWN || this == ENDED;
    }
}
