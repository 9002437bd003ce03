package com.example.covenant.corruption;

import com.example.covenant.combat.CombatTarget;
import com.example.covenant.combat.HealingListener;
import com.example.covenant.combat.RoundContext;
import com.example.covenant.combat.RoundEvent;
import com.example.covenant.config.GameBalance;
import com.example.covenant.effect.ModifierEffect;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Allegiance;
import com.example.covenant.model.Participant;
import com.example.covenant.outcome.FactionCensus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The hidden conversion protocol and its one sanctioned leak, healing detection.
 *
 * Corrupted attackers queue attempts during combat; {@link #resolve} rolls them afterwards in
 * the order they were queued. Chance:
 * <pre>
 *   min(maxChance, baseChance + corruptedFraction * scalingFactor) * contextModifier * (1 - resistance)
 * </pre>
 * An attempt is dropped when the round cap or the actor's cap is reached, the actor is on
 * cooldown, or the actor was exposed this round and the rules forbid converting while exposed.
 * Every roll uses the round's hidden random source so the visible game is identical whatever
 * the allegiances are.
 */
public class CorruptionSystem implements HealingListener {

    private static final Logger logger = LoggerFactory.getLogger(CorruptionSystem.class);

    public static final String DETECTED_EFFECT = "detected";

    private final GameBalance.Corruption cfg;
    private final GameBalance.Healing healing;
    private final GameBalance.Comeback comeback;
    private final StatusEffectEngine effects;

    private final List<CorruptionAttempt> queue = new ArrayList<>();
    private final Map<String, Integer> conversionsByActor = new HashMap<>();
    private final Map<String, Integer> availableFromRound = new HashMap<>();
    private int conversionsThisRound;

    public CorruptionSystem(GameBalance balance, StatusEffectEngine effects) {
        this.cfg = balance.getCorruption();
        this.healing = balance.getHealing();
        this.comeback = balance.getComeback();
        this.effects = effects;
    }

    public void beginRound() {
        queue.clear();
        conversionsByActor.clear();
        conversionsThisRound = 0;
    }

    /**
     * Called for every attack that connected. Only corrupted attackers queue anything.
     */
    public void onAttack(Participant actor, CombatTarget target, boolean area) {
        if (!actor.isCorrupted()) return;
        if (target.isAdversary()) {
            queue.add(new CorruptionAttempt(actor.getId(), null, CorruptionContext.UNTARGETED));
        } else {
            queue.add(new CorruptionAttempt(actor.getId(), target.getId(),
                    area ? CorruptionContext.AREA : CorruptionContext.SINGLE_TARGET));
        }
    }

    public List<CorruptionAttempt> getQueue() { return Collections.unmodifiableList(queue); }

    /**
     * Chance before the roll, or 0 if the attempt is not allowed at all.
     */
    public double chance(CorruptionContext context, FactionCensus census, boolean comebackActive) {
        double raw = Math.min(cfg.getMaxChance(), cfg.getBaseChance() + census.corruptedFraction() * cfg.getScalingFactor());
        double resistance = comebackActive
                ? Math.min(comeback.getCorruptionResistancePercent() / 100.0, cfg.getMaxResistance())
                : 0.0;
        return Math.max(0, raw * context.modifier(cfg) * (1.0 - resistance));
    }

    public boolean isOnCooldown(String actorId, int round) {
        Integer from = availableFromRound.get(actorId);
        return from != null && round < from;
    }

    /**
     * Roll every queued attempt.
     *
     * @return participants converted this round
     */
    public List<Participant> resolve(RoundContext ctx, List<Participant> participants) {
        Map<String, Participant> roster = new LinkedHashMap<>();
        for (Participant p : participants) roster.put(p.getId(), p);
        List<Participant> converted = new ArrayList<>();

        for (CorruptionAttempt attempt : queue) {
            Participant actor = roster.get(attempt.getActorId());
            if (actor == null || !actor.isActive() || !actor.isCorrupted()) continue;
            String blocked = blockedReason(actor, ctx);
            if (blocked != null) {
                logger.debug("Round {}: {} blocked ({})", ctx.getRound(), attempt, blocked);
                continue;
            }
            Participant target = attempt.getTargetId() != null
                    ? roster.get(attempt.getTargetId())
                    : pickUntargeted(actor, participants, ctx);
            if (target == null || !target.isActive() || target.isCorrupted() || target == actor) continue;

            double chance = chance(attempt.getContext(), FactionCensus.of(participants), ctx.isComebackActive());
            double roll = ctx.getHiddenRandom().nextDouble();
            logger.debug("Round {}: {} chance {} roll {}", ctx.getRound(), attempt, chance, roll);
            if (roll >= chance) continue;

            target.setAllegiance(Allegiance.CORRUPTED);
            actor.getStats().addCorruption();
            conversionsThisRound++;
            conversionsByActor.merge(actor.getId(), 1, Integer::sum);
            availableFromRound.put(actor.getId(), ctx.getRound() + cfg.getCooldownRounds() + 1);
            converted.add(target);
            ctx.privateEvent(RoundEvent.Type.CORRUPTION, actor.getId(), target.getId(), 0,
                    actor.getName() + " has corrupted " + target.getName() + ".",
                    Arrays.asList(actor.getId(), target.getId()));
            logger.info("Round {}: conversion by {} ({})", ctx.getRound(), actor.getId(), attempt.getContext());
        }
        queue.clear();
        return converted;
    }

    private String blockedReason(Participant actor, RoundContext ctx) {
        if (conversionsThisRound >= cfg.getMaxPerRound()) return "round cap";
        if (conversionsByActor.getOrDefault(actor.getId(), 0) >= cfg.getMaxPerActor()) return "actor cap";
        if (isOnCooldown(actor.getId(), ctx.getRound())) return "cooldown";
        if (ctx.isRevealed(actor.getId()) && !cfg.canCorruptWhenDetected()) return "exposed";
        return null;
    }

    private Participant pickUntargeted(Participant actor, List<Participant> participants, RoundContext ctx) {
        List<Participant> eligible = new ArrayList<>();
        for (Participant p : participants) {
            if (p != actor && p.isActive() && !p.isCorrupted()) eligible.add(p);
        }
        if (eligible.isEmpty()) return null;
        return eligible.get(ctx.getHiddenRandom().nextInt(eligible.size()));
    }

    // ========== Healing detection ==========

    @Override
    public void onHealed(RoundContext ctx, Participant healer, Participant target, int amount, boolean overTime) {
        if (healer == null || healer == target) return;
        if (overTime && !healing.isDetectionOnHealOverTime()) return;
        if (amount <= 0 && healing.isDetectionRequiresActualHealing()) return;
        if (!target.isCorrupted()) return;
        if (ctx.getHiddenRandom().nextDouble() >= healing.getDetectionChance()) return;

        ctx.markRevealed(target.getId());
        ctx.privateEvent(RoundEvent.Type.DETECTION, healer.getId(), target.getId(), 0,
                "While healing " + target.getName() + ", " + healer.getName() + " senses corruption within them.",
                Collections.singletonList(healer.getId()));
        if (effects.getRegistry().contains(DETECTED_EFFECT)) {
            Map<String, Double> magnitude = new HashMap<>();
            magnitude.put(ModifierEffect.INCOMING, cfg.getDetectionDamagePenaltyPercent());
            effects.apply(target, DETECTED_EFFECT, healer.getId(), cfg.getDetectionPenaltyDuration(), magnitude);
        }
        logger.info("Round {}: {} detected a corrupted participant", ctx.getRound(), healer.getId());
    }
}
