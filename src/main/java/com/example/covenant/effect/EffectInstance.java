package com.example.covenant.effect;

/**
 * A running status effect on one participant.
 *
 * Subclasses are keyed by {@link EffectDefinition.Type} and carry only the fields their
 * type needs. The defaults below describe an effect with no combat modifiers.
 */
public abstract class EffectInstance {

    private final EffectDefinition definition;
    private final String ownerId;
    private final String sourceId;
    private int remainingTurns; // EffectDefinition.PERMANENT never counts down
    private int appliedRound;

    protected EffectInstance(EffectDefinition definition, String ownerId, String sourceId, int remainingTurns) {
        this.definition = definition;
        this.ownerId = ownerId;
        this.sourceId = sourceId;
        this.remainingTurns = remainingTurns;
    }

    public EffectDefinition getDefinition() { return definition; }
    public String getOwnerId() { return ownerId; }

    /**
     * Participant whose ability created this effect; null for passives granted at setup.
     */
    public String getSourceId() { return sourceId; }

    public int getRemainingTurns() { return remainingTurns; }

    public boolean isPermanent() { return remainingTurns == EffectDefinition.PERMANENT; }

    /**
     * Round in which this effect was last applied or refreshed; 0 when granted before play.
     */
    public int getAppliedRound() { return appliedRound; }

    void markApplied(int round) { this.appliedRound = round; }

    /**
     * Count down one round.
     * @return true if the effect has run out
     */
    public boolean decrement() {
        if (isPermanent()) return false;
        remainingTurns = Math.max(0, remainingTurns - 1);
        return remainingTurns == 0;
    }

    /**
     * Refresh keeps whichever duration is longer.
     */
    public void refresh(int turns) {
        if (isPermanent()) return;
        remainingTurns = Math.max(remainingTurns, turns);
    }

    /** Flat armor this effect adds to its owner. */
    public double armorBonus() { return 0; }

    /** Percent change to damage the owner takes (positive means more damage). */
    public double incomingPercent() { return 0; }

    /** Percent change to damage the owner deals. */
    public double outgoingPercent() { return 0; }

    /** Short description of the payload for log messages. */
    public String describe() { return definition.getName(); }

    @Override
    public String toString() {
        return String.format("%s[%s on %s, %s]", getClass().getSimpleName(), definition.getId(), ownerId,
                isPermanent() ? "permanent" : remainingTurns + " turn(s)");
    }
}
