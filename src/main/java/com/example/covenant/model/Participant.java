package com.example.covenant.model;

import com.example.covenant.effect.EffectInstance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable per-player record owned by exactly one game session.
 *
 * HP is clamped to [0, maxHp]. Lethal damage does not remove the participant at once:
 * it enters pending death for the rest of the round, and the session commits the death
 * (alive = false) at round end unless a revival effect intercepts.
 *
 * The hidden allegiance is only meant to be read by the corruption and win-condition
 * components; nothing else should branch on it.
 */
public class Participant {

    private final String id;
    private final String name;
    private final int seat;
    private final int maxHp;
    private int hp;
    private double armor;
    private double damageModifier;
    private final Set<String> abilityIds;
    private Allegiance allegiance;
    private boolean alive = true;
    private boolean pendingDeath = false;

    private final List<EffectInstance> effects = new ArrayList<>();
    private final Map<String, Cooldown> cooldowns = new LinkedHashMap<>();
    private final ParticipantStats stats = new ParticipantStats();

    public Participant(String id, String name, int seat, int maxHp, double armor, double damageModifier,
                       Set<String> abilityIds, Allegiance allegiance) {
        if (maxHp <= 0) {
            throw new IllegalArgumentException("maxHp must be positive for " + id);
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.seat = seat;
        this.maxHp = maxHp;
        this.hp = maxHp;
        this.armor = armor;
        this.damageModifier = damageModifier;
        this.abilityIds = abilityIds != null ? new LinkedHashSet<>(abilityIds) : new LinkedHashSet<>();
        this.allegiance = allegiance != null ? allegiance : Allegiance.COOPERATIVE;
    }

    // Identification

    public String getId() { return id; }
    public String getName() { return name; }

    /**
     * Fixed seat order; breaks priority ties so a round replays identically.
     */
    public int getSeat() { return seat; }

    // Health

    public int getMaxHp() { return maxHp; }
    public int getHp() { return hp; }

    public void setHp(int value) {
        this.hp = Math.max(0, Math.min(maxHp, value));
    }

    public boolean isAlive() { return alive; }

    /**
     * Alive and not waiting on a death commit; only such participants act or are targeted.
     */
    public boolean isActive() { return alive && !pendingDeath; }

    public boolean isPendingDeath() { return pendingDeath; }

    public void enterPendingDeath(int displayHp) {
        this.pendingDeath = true;
        this.hp = Math.max(0, Math.min(maxHp, displayHp));
    }

    /**
     * Pending death cleared by a revival effect.
     */
    public void revive(int newHp) {
        this.pendingDeath = false;
        setHp(Math.max(1, newHp));
    }

    public void commitDeath() {
        this.pendingDeath = false;
        this.alive = false;
        this.hp = 0;
    }

    // Combat attributes

    public double getArmor() { return armor; }
    public void setArmor(double armor) { this.armor = armor; }

    public double getDamageModifier() { return damageModifier; }
    public void setDamageModifier(double damageModifier) { this.damageModifier = damageModifier; }

    public Set<String> getAbilityIds() { return Collections.unmodifiableSet(abilityIds); }

    public boolean hasAbility(String abilityId) {
        return abilityIds.contains(abilityId);
    }

    // Allegiance

    public Allegiance getAllegiance() { return allegiance; }
    public void setAllegiance(Allegiance allegiance) { this.allegiance = allegiance; }
    public boolean isCorrupted() { return allegiance == Allegiance.CORRUPTED; }

    // Effects

    public List<EffectInstance> getEffects() { return Collections.unmodifiableList(effects); }
    public void addEffect(EffectInstance effect) { effects.add(effect); }
    public boolean removeEffect(EffectInstance effect) { return effects.remove(effect); }

    public boolean hasEffect(String effectId) {
        for (EffectInstance e : effects) {
            if (e.getDefinition().getId().equals(effectId)) return true;
        }
        return false;
    }

    // Cooldowns

    public Map<String, Cooldown> getCooldowns() { return cooldowns; }

    // Statistics

    public ParticipantStats getStats() { return stats; }

    @Override
    public String toString() {
        return String.format("%s[%d/%d hp, armor %.1f%s]", name, hp, maxHp, armor,
                alive ? (pendingDeath ? ", dying" : "") : ", dead");
    }
}
