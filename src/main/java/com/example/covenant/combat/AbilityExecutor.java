package com.example.covenant.combat;

import com.example.covenant.config.GameBalance;
import com.example.covenant.corruption.CorruptionSystem;
import com.example.covenant.effect.ArmorEffect;
import com.example.covenant.effect.DotEffect;
import com.example.covenant.effect.EffectDefinition;
import com.example.covenant.effect.HealOverTimeEffect;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.GameAction;
import com.example.covenant.model.Participant;
import com.example.covenant.model.TargetShape;
import com.example.covenant.util.CooldownManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one action against the current state.
 *
 * The actor must still be standing and free to act. Targets are resolved now, the variance
 * roll is made once for the whole action, and every target then goes through the modifier
 * pipeline on its own. A connected attack by a corrupted actor is handed to the corruption
 * protocol as a queued attempt.
 */
public class AbilityExecutor {

    private static final Logger logger = LoggerFactory.getLogger(AbilityExecutor.class);

    private final GameBalance balance;
    private final AbilityCatalog catalog;
    private final StatusEffectEngine effects;
    private final TargetResolver targets;
    private final ModifierPipeline pipeline;
    private final CooldownManager cooldowns;
    private final CorruptionSystem corruption;

    public AbilityExecutor(GameBalance balance, AbilityCatalog catalog, StatusEffectEngine effects,
                           TargetResolver targets, ModifierPipeline pipeline, CooldownManager cooldowns,
                           CorruptionSystem corruption) {
        this.balance = balance;
        this.catalog = catalog;
        this.effects = effects;
        this.targets = targets;
        this.pipeline = pipeline;
        this.cooldowns = cooldowns;
        this.corruption = corruption;
    }

    public void execute(RoundContext ctx, GameAction action, List<Participant> participants,
                        Map<String, Participant> roster, Adversary adversary, HealthLedger ledger) {
        Participant actor = roster.get(action.getActorId());
        Ability ability = catalog.get(action.getAbilityId());
        if (actor == null || ability == null) {
            logger.warn("Round {}: dropping unresolvable action {}", ctx.getRound(), action);
            return;
        }
        if (!actor.isActive()) {
            logger.debug("Round {}: {} can no longer act", ctx.getRound(), actor.getId());
            return;
        }
        if (effects.preventsActions(actor)) {
            ctx.publicEvent(RoundEvent.Type.STUNNED, actor.getId(), null, ability.getId(), 0,
                    actor.getName() + " is stunned and cannot act.");
            return;
        }

        cooldowns.start(actor, ability);
        actor.getStats().addAbilityUsed();

        TargetResolver.Resolution resolution =
                targets.resolve(action, ability, actor, participants, adversary, ctx.getRandom());
        if (resolution.isSilent()) {
            return;
        }
        if (resolution.isNoOp()) {
            ctx.publicEvent(RoundEvent.Type.NO_OP, actor.getId(), action.getTargetId(), ability.getId(), 0,
                    actor.getName() + "'s " + ability.getName() + " has no effect: " + resolution.getNoOpReason() + ".");
            return;
        }
        List<CombatTarget> resolved = new ArrayList<>(resolution.getTargets());
        boolean coordinated = !resolution.isRedirected() && CoordinationTally.qualifies(ability);
        if (resolution.isRedirected()) {
            CombatTarget to = resolved.get(0);
            ctx.publicEvent(RoundEvent.Type.REDIRECT, actor.getId(), to.getId(), ability.getId(), 0,
                    resolution.getRedirectedFrom().getName() + " cannot be seen; " + actor.getName() + "'s "
                            + ability.getName() + " strikes " + to.getName() + " instead.");
        }

        VarianceRoll roll = VarianceRoll.roll(ctx.getRandom(), balance.getVariance());
        if (roll == VarianceRoll.FAILURE) {
            ctx.publicEvent(RoundEvent.Type.MISS, actor.getId(), resolved.get(0).getId(), ability.getId(), 0,
                    actor.getName() + "'s " + ability.getName() + " fails completely.");
            return;
        }
        if (roll == VarianceRoll.WILD) {
            roll = applyWild(ctx, ability, actor, resolved, participants, adversary);
            if (roll == VarianceRoll.WILD) coordinated = false;
        }

        boolean area = ability.getTargetShape() == TargetShape.ALL_OTHERS;
        for (CombatTarget target : resolved) {
            int coordinators = coordinated ? ctx.getCoordination().coordinators(target.getId(), ability.getCategory()) : 0;
            switch (ability.getCategory()) {
                case ATTACK:
                    attack(ctx, actor, ability, target, roll, coordinators, area, ledger);
                    break;
                case HEAL:
                    heal(ctx, actor, ability, target, roll, coordinators, ledger);
                    break;
                default:
                    applyAbilityEffect(ctx, actor, ability, target, false);
                    break;
            }
        }
    }

    /**
     * A wild roll throws a single-target ability at someone else. Other shapes, or no
     * alternative, resolve as a normal roll.
     */
    private VarianceRoll applyWild(RoundContext ctx, Ability ability, Participant actor, List<CombatTarget> resolved,
                                   List<Participant> participants, Adversary adversary) {
        if (ability.getTargetShape() != TargetShape.SINGLE_OTHER) {
            return VarianceRoll.NORMAL;
        }
        CombatTarget original = resolved.get(0);
        CombatTarget wild = targets.wildRedirect(ability, actor, original, participants, adversary, ctx.getRandom());
        if (wild == null) {
            return VarianceRoll.NORMAL;
        }
        resolved.set(0, wild);
        ctx.publicEvent(RoundEvent.Type.REDIRECT, actor.getId(), wild.getId(), ability.getId(), 0,
                actor.getName() + "'s " + ability.getName() + " goes wild and hits " + wild.getName() + " instead of "
                        + original.getName() + "!");
        return VarianceRoll.WILD;
    }

    private void attack(RoundContext ctx, Participant actor, Ability ability, CombatTarget target, VarianceRoll roll,
                        int coordinators, boolean area, HealthLedger ledger) {
        int amount = pipeline.resolve(HitContext.damage(ability.getDamage(), actor, target, roll, coordinators,
                ctx.isComebackActive()));
        int dealt;
        if (target.isAdversary()) {
            dealt = ledger.damageAdversary(actor, amount);
        } else {
            Participant p = target.getParticipant();
            dealt = ledger.damageParticipant(actor, p, amount, ability.getId());
            if (dealt > 0) crackStoneArmor(ctx, actor, ability, p);
        }
        boolean crit = roll == VarianceRoll.CRITICAL || roll == VarianceRoll.WILD;
        ctx.publicEvent(crit ? RoundEvent.Type.CRITICAL : RoundEvent.Type.DAMAGE, actor.getId(), target.getId(),
                ability.getId(), dealt, actor.getName() + (crit ? " critically hits " : " hits ") + target.getName()
                        + " with " + ability.getName() + " for " + dealt + " damage.");
        if (!target.isAdversary()) {
            applyAbilityEffect(ctx, actor, ability, target, dealt > 0);
        }
        corruption.onAttack(actor, target, area);
    }

    private void heal(RoundContext ctx, Participant actor, Ability ability, CombatTarget target, VarianceRoll roll,
                      int coordinators, HealthLedger ledger) {
        if (target.isAdversary()) return;
        Participant p = target.getParticipant();
        if (ability.getHeal() > 0) {
            int amount = pipeline.resolve(HitContext.heal(ability.getHeal(), actor, target, roll, coordinators,
                    ctx.isComebackActive()));
            int healed = ledger.heal(actor, p, amount, ability.getId(), false);
            if (!effects.blocksHealing(p)) {
                ctx.publicEvent(RoundEvent.Type.HEAL, actor.getId(), p.getId(), ability.getId(), healed,
                        actor.getName() + " heals " + (p == actor ? "themselves" : p.getName()) + " for " + healed
                                + " hp with " + ability.getName() + ".");
            }
        }
        applyAbilityEffect(ctx, actor, ability, target, false);
    }

    private void crackStoneArmor(RoundContext ctx, Participant actor, Ability ability, Participant p) {
        if (effects.degradeOnHit(p)) {
            ctx.publicEvent(RoundEvent.Type.ARMOR_DEGRADED, actor.getId(), p.getId(), ability.getId(), 0,
                    p.getName() + "'s stone armor cracks.");
        }
    }

    /**
     * Apply the ability's status effect, honouring its {@code chance} parameter.
     *
     * @param hitLanded whether the same action already dealt damage to the target
     */
    private void applyAbilityEffect(RoundContext ctx, Participant actor, Ability ability, CombatTarget target,
                                    boolean hitLanded) {
        if (!ability.hasEffect() || target.isAdversary()) return;
        Participant p = target.getParticipant();
        if (!p.isActive()) return;

        double chance = ability.getParam(Ability.PARAM_CHANCE, 1.0);
        if (chance < 1.0 && ctx.getRandom().nextDouble() >= chance) {
            ctx.publicEvent(RoundEvent.Type.MISS, actor.getId(), p.getId(), ability.getId(), 0,
                    p.getName() + " shrugs off " + actor.getName() + "'s " + ability.getName() + ".");
            return;
        }
        Integer duration = ability.hasParam(Ability.PARAM_DURATION)
                ? (int) ability.getParam(Ability.PARAM_DURATION, 0)
                : null;
        StatusEffectEngine.ApplyResult result =
                effects.apply(p, ability.getEffectId(), actor.getId(), duration, effectMagnitudes(ability));
        EffectDefinition def = effects.getRegistry().getDefinition(ability.getEffectId());
        if (result.isApplied() && !hitLanded && def.hasFlag(EffectDefinition.Flag.TRIGGERS_SECONDARY_DECAY)) {
            crackStoneArmor(ctx, actor, ability, p);
        }
        if (def.hasFlag(EffectDefinition.Flag.HIDDEN)) {
            if (result.isApplied()) {
                ctx.privateEvent(RoundEvent.Type.EFFECT_APPLIED, actor.getId(), p.getId(), 0,
                        p.getName() + " is affected by " + def.getName() + ".", Collections.singletonList(actor.getId()));
            }
            return;
        }
        String effectName = def.getName();
        switch (result.getOutcome()) {
            case APPLIED:
            case STACKED:
                ctx.publicEvent(RoundEvent.Type.EFFECT_APPLIED, actor.getId(), p.getId(), ability.getId(), 0,
                        p.getName() + " is affected by " + effectName + ".");
                break;
            case REFRESHED:
                ctx.publicEvent(RoundEvent.Type.EFFECT_REFRESHED, actor.getId(), p.getId(), ability.getId(), 0,
                        effectName + " on " + p.getName() + " is refreshed.");
                break;
            default:
                ctx.publicEvent(RoundEvent.Type.EFFECT_REJECTED, actor.getId(), p.getId(), ability.getId(), 0,
                        effectName + " has no further effect on " + p.getName() + ".");
                break;
        }
    }

    /**
     * Ability parameters that set the strength of the effect it applies.
     */
    static Map<String, Double> effectMagnitudes(Ability ability) {
        Map<String, Double> m = new HashMap<>();
        if (ability.hasParam(Ability.PARAM_EFFECT_DAMAGE)) {
            m.put(DotEffect.DAMAGE, ability.getParam(Ability.PARAM_EFFECT_DAMAGE, 0));
        }
        if (ability.hasParam(Ability.PARAM_EFFECT_AMOUNT)) {
            m.put(HealOverTimeEffect.AMOUNT, ability.getParam(Ability.PARAM_EFFECT_AMOUNT, 0));
        }
        if (ability.hasParam(Ability.PARAM_ARMOR)) {
            m.put(ArmorEffect.ARMOR, ability.getParam(Ability.PARAM_ARMOR, 0));
        }
        return m.isEmpty() ? Collections.emptyMap() : m;
    }
}
