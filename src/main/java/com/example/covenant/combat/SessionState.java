package com.example.covenant.combat;

/**
 * Lifecycle of a game session.
 */
public enum SessionState {

    /** Participants and adversary being set up */
    INITIALIZING("Initializing"),

    /** Rounds are being played */
    ACTIVE("Active"),

    /** A win condition was reached */
    ENDED("Ended"),

    /** An invariant check failed; no further rounds are accepted */
    CORRUPTED("Corrupted");

    private final String displayName;

    SessionState(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
