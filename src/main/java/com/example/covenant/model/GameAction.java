package com.example.covenant.model;

import java.util.Objects;

/**
 * One submitted intent: actor uses ability on target.
 * Target is a participant id, {@link Adversary#ID}, or null for self / all-others abilities.
 */
public final class GameAction {

    private final String actorId;
    private final String abilityId;
    private final String targetId;

    public GameAction(String actorId, String abilityId, String targetId) {
        this.actorId = Objects.requireNonNull(actorId, "actorId");
        this.abilityId = Objects.requireNonNull(abilityId, "abilityId");
        this.targetId = targetId;
    }

    public static GameAction self(String actorId, String abilityId) {
        return new GameAction(actorId, abilityId, null);
    }

    public static GameAction onAdversary(String actorId, String abilityId) {
        return new GameAction(actorId, abilityId, Adversary.ID);
    }

    public String getActorId() { return actorId; }
    public String getAbilityId() { return abilityId; }
    public String getTargetId() { return targetId; }

    public boolean targetsAdversary() {
        return Adversary.ID.equals(targetId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameAction)) return false;
        GameAction that = (GameAction) o;
        return actorId.equals(that.actorId) && abilityId.equals(that.abilityId)
                && Objects.equals(targetId, that.targetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(actorId, abilityId, targetId);
    }

    @Override
    public String toString() {
        return actorId + " -> " + abilityId + (targetId != null ? " @ " + targetId : "");
    }
}
