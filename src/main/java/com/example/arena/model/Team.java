package com.example.arena.model;

/**
 * Team membership. Exactly two teams exist; entities on different teams are enemies.
 */
public class Team {
    public static final int BLUE = 0;
    public static final int RED = 1;
    public static final int COUNT = 2;

    private final int id;

    public Team(int id) {
        if (id != BLUE && id != RED) {
            throw new IllegalArgumentException("Team id must be 0 or 1, got " + id);
        }
        this.id = id;
    }

    public int getId() { return id; }

    public boolean isEnemyOf(int otherTeam) {
        return otherTeam != id;
    }

    public static String nameOf(int teamId) {
        if (teamId == BLUE) return "Blue";
        if (teamId == RED) return "Red";
        return "None";
    }
}
