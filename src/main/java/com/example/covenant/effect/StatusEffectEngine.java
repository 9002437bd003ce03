package com.example.covenant.effect;

import com.example.covenant.config.GameBalance;
import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Applies, queries and advances status effects on participants.
 *
 * Application rule for an effect id the target already carries: a stackable effect adds
 * another instance; otherwise a refreshable one has its duration raised to the longer of old
 * and new; otherwise the application is rejected. A participant never holds more than
 * {@code effects.maxPerParticipant} instances, and durations never exceed {@code effects.maxTurns}.
 */
public class StatusEffectEngine {

    private static final Logger logger = LoggerFactory.getLogger(StatusEffectEngine.class);

    public enum Outcome { APPLIED, STACKED, REFRESHED, REJECTED_ACTIVE, REJECTED_CAPACITY }

    /**
     * What happened to one application attempt; {@code instance} is null when rejected.
     */
    public static final class ApplyResult {
        private final Outcome outcome;
        private final EffectInstance instance;

        ApplyResult(Outcome outcome, EffectInstance instance) {
            this.outcome = outcome;
            this.instance = instance;
        }

        public Outcome getOutcome() { return outcome; }
        public EffectInstance getInstance() { return instance; }
        public boolean isApplied() { return instance != null; }
    }

    private final EffectRegistry registry;
    private final GameBalance.Effects limits;
    private int currentRound;

    public StatusEffectEngine(EffectRegistry registry, GameBalance.Effects limits) {
        this.registry = registry;
        this.limits = limits;
    }

    public EffectRegistry getRegistry() { return registry; }

    /**
     * Start stamping new applications with this round. Effects applied or refreshed during a
     * round first count down at the end of the following round.
     */
    public void beginRound(int round) {
        this.currentRound = round;
    }

    public ApplyResult apply(Participant target, String effectId, String sourceId) {
        return apply(target, effectId, sourceId, null, null);
    }

    /**
     * Apply an effect to a participant.
     *
     * @param durationOverride turns to run instead of the definition default, or null
     * @param magnitudeOverrides per-application magnitudes (for example a stronger poison), or null
     * @throws IllegalArgumentException if the effect id is not registered
     */
    public ApplyResult apply(Participant target, String effectId, String sourceId,
                             Integer durationOverride, Map<String, Double> magnitudeOverrides) {
        EffectDefinition def = registry.getDefinition(effectId);
        if (def == null) {
            throw new IllegalArgumentException("Unknown status effect: " + effectId);
        }
        int duration = clampDuration(def, durationOverride);

        EffectInstance existing = findFirst(target, effectId);
        if (existing != null && !def.isStackable()) {
            if (def.isRefreshable()) {
                existing.refresh(duration);
                existing.markApplied(currentRound);
                logger.debug("Refreshed {} on {} to {} turn(s)", effectId, target.getId(), existing.getRemainingTurns());
                return new ApplyResult(Outcome.REFRESHED, existing);
            }
            logger.debug("Rejected {} on {}: already active", effectId, target.getId());
            return new ApplyResult(Outcome.REJECTED_ACTIVE, null);
        }
        if (target.getEffects().size() >= limits.getMaxPerParticipant()) {
            logger.debug("Rejected {} on {}: effect limit {} reached", effectId, target.getId(),
                    limits.getMaxPerParticipant());
            return new ApplyResult(Outcome.REJECTED_CAPACITY, null);
        }
        EffectInstance inst = registry.getHandler(def).create(def, target.getId(), sourceId, duration, magnitudeOverrides);
        inst.markApplied(currentRound);
        target.addEffect(inst);
        logger.debug("Applied {} to {}", inst, target.getId());
        return new ApplyResult(existing != null ? Outcome.STACKED : Outcome.APPLIED, inst);
    }

    int clampDuration(EffectDefinition def, Integer override) {
        int d = override != null ? override : def.getDefaultDuration();
        if (d == EffectDefinition.PERMANENT) return d;
        return Math.max(1, Math.min(limits.getMaxTurns(), d));
    }

    private static EffectInstance findFirst(Participant p, String effectId) {
        for (EffectInstance e : p.getEffects()) {
            if (e.getDefinition().getId().equals(effectId)) return e;
        }
        return null;
    }

    public boolean remove(Participant p, String effectId) {
        boolean removed = false;
        for (EffectInstance e : new ArrayList<>(p.getEffects())) {
            if (e.getDefinition().getId().equals(effectId)) {
                removed |= p.removeEffect(e);
            }
        }
        return removed;
    }

    // Queries

    public double armorBonus(Participant p) {
        double sum = 0;
        for (EffectInstance e : p.getEffects()) sum += e.armorBonus();
        return sum;
    }

    /**
     * Product of every incoming percent modifier, never below zero.
     */
    public double incomingMultiplier(Participant p) {
        double m = 1.0;
        for (EffectInstance e : p.getEffects()) m *= 1.0 + e.incomingPercent() / 100.0;
        return Math.max(0, m);
    }

    public double outgoingMultiplier(Participant p) {
        double m = 1.0;
        for (EffectInstance e : p.getEffects()) m *= 1.0 + e.outgoingPercent() / 100.0;
        return Math.max(0, m);
    }

    public boolean hasFlag(Participant p, EffectDefinition.Flag flag) {
        for (EffectInstance e : p.getEffects()) {
            if (e.getDefinition().hasFlag(flag)) return true;
        }
        return false;
    }

    public boolean blocksHealing(Participant p) { return hasFlag(p, EffectDefinition.Flag.BLOCKS_HEALING); }
    public boolean preventsActions(Participant p) { return hasFlag(p, EffectDefinition.Flag.PREVENTS_ACTIONS); }
    public boolean preventsTargeting(Participant p) { return hasFlag(p, EffectDefinition.Flag.PREVENTS_TARGETING); }

    /**
     * Wear down every degrading armor on the participant.
     * @return true if any armor value changed
     */
    public boolean degradeOnHit(Participant p) {
        boolean changed = false;
        for (EffectInstance e : p.getEffects()) {
            if (e instanceof StoneArmorEffect.Instance && e.getDefinition().hasFlag(EffectDefinition.Flag.DEGRADES_ON_HIT)) {
                changed |= ((StoneArmorEffect.Instance) e).degrade();
            }
        }
        return changed;
    }

    /**
     * A revival effect with uses left, or null.
     */
    public UndyingEffect.Instance findRevival(Participant p) {
        for (EffectInstance e : p.getEffects()) {
            if (e instanceof UndyingEffect.Instance && e.getDefinition().hasFlag(EffectDefinition.Flag.REVIVES)) {
                UndyingEffect.Instance u = (UndyingEffect.Instance) e;
                if (!u.isSpent()) return u;
            }
        }
        return null;
    }

    // End-of-round pass

    /**
     * Tick every effect on every living participant, then count durations down and drop
     * the ones that ran out. Effects run in ascending processing priority across the whole
     * table (all damage-over-time before healing-over-time), seat order breaking ties.
     * Participants already pending death keep counting down but their effects do nothing.
     * Effects applied during the current round sit this pass out entirely.
     */
    public void processEndOfRound(List<Participant> participants, EffectTickContext ctx) {
        final class Entry {
            final Participant owner;
            final EffectInstance effect;
            Entry(Participant owner, EffectInstance effect) { this.owner = owner; this.effect = effect; }
        }
        List<Entry> entries = new ArrayList<>();
        for (Participant p : participants) {
            if (!p.isAlive()) continue;
            for (EffectInstance e : p.getEffects()) entries.add(new Entry(p, e));
        }
        entries.sort(Comparator.<Entry>comparingInt(en -> en.effect.getDefinition().getPriority())
                .thenComparingInt(en -> en.owner.getSeat()));

        for (Entry en : entries) {
            if (!en.owner.getEffects().contains(en.effect)) continue;
            if (currentRound > 0 && en.effect.getAppliedRound() == currentRound) continue;
            if (en.owner.isActive()) {
                EffectHandler handler = registry.getHandler(en.effect.getDefinition());
                handler.tick(en.effect, en.owner, ctx);
            }
            if (en.effect.decrement()) {
                en.owner.removeEffect(en.effect);
                logger.debug("{} expired on {}", en.effect.getDefinition().getId(), en.owner.getId());
                ctx.onExpired(en.owner, en.effect);
            }
        }
    }
}
