package com.example.covenant.corruption;

/**
 * A queued conversion attempt, resolved after combat.
 */
public final class CorruptionAttempt {

    private final String actorId;
    private final String targetId; // null for untargeted attempts
    private final CorruptionContext context;

    public CorruptionAttempt(String actorId, String targetId, CorruptionContext context) {
        this.actorId = actorId;
        this.targetId = targetId;
        this.context = context;
    }

    public String getActorId() { return actorId; }
    public String getTargetId() { return targetId; }
    public CorruptionContext getContext() { return context; }

    @Override
    public String toString() {
        return "CorruptionAttempt[" + actorId + " -> " + (targetId != null ? targetId : "?") + ", " + context + "]";
    }
}
