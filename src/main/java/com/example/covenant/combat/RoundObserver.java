package com.example.covenant.combat;

/**
 * Outbound hook for analytics. Failures are logged and never affect the round.
 */
public interface RoundObserver {

    void onRoundResolved(RoundResult result);
}
