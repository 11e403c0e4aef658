package com.example.arena.model;

/**
 * Current match phase plus the phase it left and when. Lives on the match sentinel entity.
 * Phases only move forward; ENDED is terminal.
 */
public class ShowdownState {
    private MatchPhase state = MatchPhase.NORMAL;
    private MatchPhase lastState = MatchPhase.NORMAL;
    private double transitionTime;
    private MatchResult result;

    public MatchPhase getState() { return state; }
    public MatchPhase getLastState() { return lastState; }
    public double getTransitionTime() { return transitionTime; }
    public MatchResult getResult() { return result; }

    /**
     * End the match with a result. Only legal from a pre-ENDED phase.
     */
    public void end(MatchResult result, double atTime) {
        transitionTo(MatchPhase.ENDED, atTime);
        this.result = result;
    }

    /**
     * Move to a later phase.
     * @throws IllegalStateException when asked to go backwards or stay put
     */
    public void transitionTo(MatchPhase next, double atTime) {
        if (!state.isBefore(next)) {
            throw new IllegalStateException("Illegal phase transition " + state + " -> " + next);
        }
        this.lastState = state;
        this.state = next;
        this.transitionTime = atTime;
    }
}
