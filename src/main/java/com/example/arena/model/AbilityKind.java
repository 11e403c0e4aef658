package com.example.arena.model;

/**
 * Abilities a unit can trigger from input.
 */
public enum AbilityKind {
    DASH("Dash"),
    SHIELD("Shield"),
    RANGED_ATTACK("Ranged Attack");

    private final String displayName;

    AbilityKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Parse from a config or command token, case-insensitively.
     * Accepts "ranged" as shorthand for RANGED_ATTACK.
     */
    public static AbilityKind fromString(String s) {
        if (s == null) return null;
        String key = s.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        if (key.equals("RANGED")) return RANGED_ATTACK;
        for (AbilityKind k : values()) {
            if (k.name().equals(key)) return k;
        }
        return null;
    }
}
