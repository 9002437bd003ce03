package com.example.covenant.outcome;

import com.example.covenant.model.Participant;

import java.util.Collection;

/**
 * Pure win-condition check, safe to call before or after any round.
 *
 * Zero alive is a draw; zero alive corrupted is a cooperative victory; an all-corrupted
 * table is an infiltrator victory; anything else is still in progress.
 */
public final class WinConditionEvaluator {

    private WinConditionEvaluator() {}

    public static GameOutcome evaluate(Collection<Participant> participants) {
        return evaluate(FactionCensus.of(participants));
    }

    public static GameOutcome evaluate(FactionCensus census) {
        if (census.getAlive() == 0) return GameOutcome.DRAW;
        if (census.getAliveCorrupted() == 0) return GameOutcome.COOPERATIVE_VICTORY;
        if (census.getAliveCorrupted() == census.getAlive()) return GameOutcome.INFILTRATOR_VICTORY;
        return GameOutcome.IN_PROGRESS;
    }
}
