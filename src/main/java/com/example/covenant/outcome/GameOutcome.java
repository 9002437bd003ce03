package com.example.covenant.outcome;

/**
 * Result of evaluating the win conditions.
 */
public enum GameOutcome {

    IN_PROGRESS("In progress", false),
    COOPERATIVE_VICTORY("Cooperative victory", true),
    INFILTRATOR_VICTORY("Infiltrator victory", true),
    DRAW("Draw", true);

    private final String displayName;
    private final boolean terminal;

    GameOutcome(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
