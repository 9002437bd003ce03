package com.example.covenant.combat;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One entry of the narrated round log.
 * Contains everything a client needs to render the event; nothing here is produced through SLF4J.
 */
public class RoundEvent {

    public enum Type {
        ROUND_START,
        COMEBACK,       // Comeback bonuses switched on or off
        ACTION,         // Ability used
        DAMAGE,         // Normal hit
        CRITICAL,       // Variance crit
        MISS,           // Variance failure
        REDIRECT,       // Stealth or wild redirect
        NO_OP,          // Target or actor no longer legal
        HEAL,
        HEAL_BLOCKED,
        EFFECT_APPLIED,
        EFFECT_REFRESHED,
        EFFECT_REJECTED,
        EFFECT_EXPIRED,
        ARMOR_DEGRADED,
        STUNNED,        // Actor skipped its action
        PENDING_DEATH,
        REVIVED,
        DEATH,
        ADVERSARY_ATTACK,
        ADVERSARY_DEFEATED,
        ADVERSARY_RESPAWN,
        CORRUPTION,
        DETECTION,
        REJECTED,       // Action refused at collection
        ROUND_END
    }

    public enum Visibility { PUBLIC, PRIVATE }

    private final Type type;
    private final int round;
    private final String actorId;
    private final String targetId;
    private final String abilityId;
    private final int amount;
    private final String message;
    private final Visibility visibility;
    private final Set<String> recipients;

    private RoundEvent(Type type, int round, String actorId, String targetId, String abilityId, int amount,
                       String message, Visibility visibility, Collection<String> recipients) {
        this.type = type;
        this.round = round;
        this.actorId = actorId;
        this.targetId = targetId;
        this.abilityId = abilityId;
        this.amount = amount;
        this.message = message;
        this.visibility = visibility;
        this.recipients = recipients == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(recipients));
    }

    // Static factory methods

    public static RoundEvent publicEvent(Type type, int round, String actorId, String targetId, String abilityId,
                                         int amount, String message) {
        return new RoundEvent(type, round, actorId, targetId, abilityId, amount, message, Visibility.PUBLIC, null);
    }

    public static RoundEvent publicEvent(Type type, int round, String message) {
        return publicEvent(type, round, null, null, null, 0, message);
    }

    /**
     * Event only the listed participants may see.
     */
    public static RoundEvent privateEvent(Type type, int round, String actorId, String targetId, int amount,
                                          String message, Collection<String> recipients) {
        return new RoundEvent(type, round, actorId, targetId, null, amount, message, Visibility.PRIVATE, recipients);
    }

    public Type getType() { return type; }
    public int getRound() { return round; }
    public String getActorId() { return actorId; }
    public String getTargetId() { return targetId; }
    public String getAbilityId() { return abilityId; }
    public int getAmount() { return amount; }
    public String getMessage() { return message; }
    public Visibility getVisibility() { return visibility; }
    public Set<String> getRecipients() { return recipients; }

    public boolean isPublic() { return visibility == Visibility.PUBLIC; }

    public boolean isVisibleTo(String participantId) {
        return isPublic() || recipients.contains(participantId);
    }

    @Override
    public String toString() {
        return "[R" + round + " " + type + (isPublic() ? "" : " private") + "] " + message;
    }
}
