package com.example.covenant.combat;

import com.example.covenant.adversary.AdversaryController;
import com.example.covenant.config.GameBalance;
import com.example.covenant.corruption.CorruptionSystem;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;
import com.example.covenant.model.ParticipantStats;
import com.example.covenant.outcome.FactionCensus;
import com.example.covenant.outcome.GameOutcome;
import com.example.covenant.outcome.WinConditionEvaluator;
import com.example.covenant.util.CooldownManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves one round, strictly sequentially:
 * <ol>
 *   <li>comeback check and cooldown tick</li>
 *   <li>actions in priority order, each seeing the effects of the ones before it</li>
 *   <li>end-of-round status effect pass</li>
 *   <li>adversary turn</li>
 *   <li>corruption attempts</li>
 *   <li>death commit (with revival), adversary respawn or aging</li>
 *   <li>invariant check and win evaluation</li>
 * </ol>
 * Once started a round always runs to completion; there is no partial rollback.
 */
public class RoundResolver {

    private static final Logger logger = LoggerFactory.getLogger(RoundResolver.class);

    private final GameBalance balance;
    private final AbilityCatalog catalog;
    private final StatusEffectEngine effects;
    private final CombatCalculator calc;
    private final ModifierPipeline pipeline;
    private final CooldownManager cooldowns;
    private final CorruptionSystem corruption;
    private final AdversaryController adversaryController;
    private final AbilityExecutor executor;
    private boolean comebackWasActive;

    public RoundResolver(GameBalance balance, AbilityCatalog catalog, StatusEffectEngine effects,
                         CooldownManager cooldowns, CorruptionSystem corruption, AdversaryController adversaryController) {
        this.balance = balance;
        this.catalog = catalog;
        this.effects = effects;
        this.calc = new CombatCalculator(balance);
        this.pipeline = ModifierPipeline.standard(calc, effects);
        this.cooldowns = cooldowns;
        this.corruption = corruption;
        this.adversaryController = adversaryController;
        this.executor = new AbilityExecutor(balance, catalog, effects, new TargetResolver(effects), pipeline,
                cooldowns, corruption);
    }

    public ModifierPipeline getPipeline() { return pipeline; }

    /**
     * @param participants every participant in seat order, dead ones included
     * @param actions validated actions for this round, in any order
     * @throws InvariantViolationException if the post-round check fails
     */
    public RoundResult resolve(RoundContext ctx, List<GameAction> actions, List<Participant> participants,
                               Adversary adversary) {
        Map<String, Participant> roster = new LinkedHashMap<>();
        for (Participant p : participants) {
            roster.put(p.getId(), p);
            ctx.recordStartHp(p.getId(), p.getHp());
        }
        logger.info("Resolving round {} ({} action(s))", ctx.getRound(), actions.size());

        effects.beginRound(ctx.getRound());
        corruption.beginRound();
        updateComeback(ctx, participants);
        cooldowns.tick(participants);

        for (GameAction action : actions) {
            Ability ability = catalog.get(action.getAbilityId());
            if (ability != null) ctx.getCoordination().record(action, ability);
        }
        ctx.setOrderedActions(ActionOrdering.order(actions, catalog, roster));

        HealthLedger ledger = new HealthLedger(ctx, effects, adversary, roster, balance.getPendingDeathHp(), corruption);
        for (GameAction action : ctx.getOrderedActions()) {
            executor.execute(ctx, action, participants, roster, adversary, ledger);
        }

        effects.processEndOfRound(participants, ledger);
        adversaryController.takeTurn(ctx, adversary, participants, ledger, pipeline);
        corruption.resolve(ctx, participants);

        for (Participant dead : ledger.commitDeaths(participants)) {
            adversaryController.getThreatTable().remove(dead.getId());
        }
        adversaryController.endOfRound(ctx, adversary);

        checkInvariants(ctx, participants, adversary);

        GameOutcome outcome = WinConditionEvaluator.evaluate(participants);
        ctx.publicEvent(RoundEvent.Type.ROUND_END, "Round " + ctx.getRound() + " ends: " + outcome.getDisplayName() + ".");

        Map<String, ParticipantStats.Snapshot> stats = new LinkedHashMap<>();
        for (Participant p : participants) stats.put(p.getId(), p.getStats().snapshot());
        return new RoundResult(ctx.getRound(), ctx.getEvents(), outcome, stats);
    }

    private void updateComeback(RoundContext ctx, List<Participant> participants) {
        FactionCensus census = FactionCensus.of(participants);
        boolean active = calc.isComebackActive(census.getAliveCooperative(), census.getTotal());
        ctx.setComebackActive(active);
        if (active != comebackWasActive) {
            ctx.publicEvent(RoundEvent.Type.COMEBACK, active
                    ? "The survivors rally: comeback bonuses are active."
                    : "The tide has turned: comeback bonuses fade.");
            logger.info("Round {}: comeback {}", ctx.getRound(), active ? "on" : "off");
        }
        comebackWasActive = active;
    }

    void checkInvariants(RoundContext ctx, List<Participant> participants, Adversary adversary) {
        int maxEffects = balance.getEffects().getMaxPerParticipant();
        for (Participant p : participants) {
            if (p.getHp() < 0 || p.getHp() > p.getMaxHp()) {
                throw violation(ctx, p.getId() + " hp " + p.getHp() + " outside [0, " + p.getMaxHp() + "]");
            }
            if (p.isPendingDeath()) {
                throw violation(ctx, p.getId() + " still pending death after commit");
            }
            if (!p.isAlive() && p.getHp() != 0) {
                throw violation(ctx, p.getId() + " is dead with " + p.getHp() + " hp");
            }
            if (p.getEffects().size() > maxEffects) {
                throw violation(ctx, p.getId() + " carries " + p.getEffects().size() + " effects");
            }
            Integer start = ctx.getStartHp(p.getId());
            if (start != null && p.getHp() - start != ctx.getHpDelta(p.getId())) {
                throw violation(ctx, p.getId() + " hp moved by " + (p.getHp() - start)
                        + " but recorded changes sum to " + ctx.getHpDelta(p.getId()));
            }
        }
        for (Map.Entry<String, Double> e : adversaryController.getThreatTable().snapshot().entrySet()) {
            if (e.getValue() < 0) {
                throw violation(ctx, "negative threat " + e.getValue() + " for " + e.getKey());
            }
        }
        if (adversary != null && (adversary.getHp() < 0 || adversary.getHp() > adversary.getMaxHp())) {
            throw violation(ctx, "adversary hp " + adversary.getHp() + " outside its clamp");
        }
    }

    private static InvariantViolationException violation(RoundContext ctx, String message) {
        logger.error("Invariant violated in round {}: {}", ctx.getRound(), message);
        return new InvariantViolationException(ctx.getRound(), message);
    }
}
