package com.example.covenant.model;

/**
 * Broad ability families. Drives priority bands, coordination and corruption triggers.
 */
public enum AbilityCategory {
    ATTACK("Attack"),
    DEFENSE("Defense"),
    HEAL("Heal"),
    SPECIAL("Special");

    private final String displayName;

    AbilityCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
