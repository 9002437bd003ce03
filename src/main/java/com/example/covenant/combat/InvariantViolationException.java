package com.example.covenant.combat;

/**
 * A post-round consistency check failed. This means a defect in the engine, never bad input;
 * the owning session is flagged corrupted and refuses further rounds.
 */
public class InvariantViolationException extends RuntimeException {

    private final int round;

    public InvariantViolationException(int round, String message) {
        super("Round " + round + ": " + message);
        this.round = round;
    }

    public int getRound() { return round; }
}
