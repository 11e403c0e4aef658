package com.example.arena.model;

/**
 * Match clock. Lives on the match sentinel entity.
 */
public class GameTimer {
    private double totalTime;
    private final double matchDuration;

    public GameTimer(double matchDuration) {
        this.matchDuration = matchDuration;
    }

    public double getTotalTime() { return totalTime; }
    public double getMatchDuration() { return matchDuration; }

    public double advance(double deltaSeconds) {
        if (deltaSeconds > 0) totalTime += deltaSeconds;
        return totalTime;
    }

    /** Seconds left until the configured match duration, never negative. */
    public double getTimeRemaining() {
        return Math.max(0, matchDuration - totalTime);
    }
}
