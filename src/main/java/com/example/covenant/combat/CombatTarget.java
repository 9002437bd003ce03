package com.example.covenant.combat;

import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;

/**
 * Either a participant or the adversary.
 */
public final class CombatTarget {

    private final Participant participant;
    private final Adversary adversary;

    private CombatTarget(Participant participant, Adversary adversary) {
        this.participant = participant;
        this.adversary = adversary;
    }

    public static CombatTarget of(Participant p) { return new CombatTarget(p, null); }
    public static CombatTarget of(Adversary a) { return new CombatTarget(null, a); }

    public boolean isAdversary() { return adversary != null; }
    public Participant getParticipant() { return participant; }
    public Adversary getAdversary() { return adversary; }

    public String getId() { return isAdversary() ? Adversary.ID : participant.getId(); }
    public String getName() { return isAdversary() ? adversary.getName() : participant.getName(); }

    @Override
    public boolean equals(Object o) {
        return o instanceof CombatTarget && ((CombatTarget) o).getId().equals(getId());
    }

    @Override
    public int hashCode() { return getId().hashCode(); }

    @Override
    public String toString() { return getId(); }
}
