package com.example.covenant.outcome;

import com.example.covenant.model.Participant;

import java.util.Collection;

/**
 * Head count of living participants by hidden allegiance.
 * Along with the corruption protocol, this is the only place that reads allegiance.
 */
public final class FactionCensus {

    private final int total;
    private final int alive;
    private final int aliveCorrupted;

    private FactionCensus(int total, int alive, int aliveCorrupted) {
        this.total = total;
        this.alive = alive;
        this.aliveCorrupted = aliveCorrupted;
    }

    /**
     * Participants pending death still count as alive until their death is committed.
     */
    public static FactionCensus of(Collection<Participant> participants) {
        int alive = 0;
        int corrupted = 0;
        for (Participant p : participants) {
            if (!p.isAlive()) continue;
            alive++;
            if (p.isCorrupted()) corrupted++;
        }
        return new FactionCensus(participants.size(), alive, corrupted);
    }

    public int getTotal() { return total; }
    public int getAlive() { return alive; }
    public int getAliveCorrupted() { return aliveCorrupted; }
    public int getAliveCooperative() { return alive - aliveCorrupted; }

    public double corruptedFraction() {
        return alive == 0 ? 0.0 : (double) aliveCorrupted / alive;
    }

    @Override
    public String toString() {
        return "FactionCensus[alive=" + alive + "/" + total + ", corrupted=" + aliveCorrupted + "]";
    }
}
