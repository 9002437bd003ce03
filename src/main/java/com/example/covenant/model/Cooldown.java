package com.example.covenant.model;

/**
 * Cooldown entry for a single ability, counted in rounds.
 */
public class Cooldown {
    private final String abilityId;
    private int remainingRounds;

    public Cooldown(String abilityId, int remainingRounds) {
        this.abilityId = abilityId;
        this.remainingRounds = Math.max(0, remainingRounds);
    }

    public String getAbilityId() { return abilityId; }
    public int getRemainingRounds() { return remainingRounds; }

    /**
     * Count down one round.
     * @return true if the cooldown has expired
     */
    public boolean tick() {
        remainingRounds = Math.max(0, remainingRounds - 1);
        return remainingRounds <= 0;
    }

    public boolean isExpired() {
        return remainingRounds <= 0;
    }
}
