package com.example.covenant.combat;

import com.example.covenant.config.GameBalance;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered chain of {@link DamageModifier} stages.
 *
 * Standard order: actor modifier, variance, coordination, comeback, target incoming modifiers,
 * actor outgoing modifiers, armor. Healing skips the effect-modifier and armor stages, so a heal
 * always lands in full whatever the target's allegiance.
 */
public class ModifierPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ModifierPipeline.class);

    private final List<DamageModifier> stages;

    public ModifierPipeline(List<DamageModifier> stages) {
        this.stages = Collections.unmodifiableList(new ArrayList<>(stages));
    }

    public static ModifierPipeline standard(CombatCalculator calc, StatusEffectEngine effects) {
        GameBalance balance = calc.getBalance();
        List<DamageModifier> s = new ArrayList<>();
        s.add(new ActorModifier(calc));
        s.add(new VarianceModifier(balance.getVariance()));
        s.add(new CoordinationModifier(calc));
        s.add(new ComebackModifier(balance.getComeback()));
        s.add(new IncomingModifier(effects));
        s.add(new OutgoingModifier(effects));
        s.add(new ArmorModifier(calc, effects));
        return new ModifierPipeline(s);
    }

    public List<String> stageNames() {
        List<String> names = new ArrayList<>();
        for (DamageModifier m : stages) names.add(m.name());
        return names;
    }

    public HitContext run(HitContext hit) {
        HitContext current = hit;
        for (DamageModifier m : stages) {
            current = m.apply(current);
        }
        logger.debug("{} via {}", current, stageNames());
        return current;
    }

    /**
     * Run the chain and round down to whole hp.
     */
    public int resolve(HitContext hit) {
        return CombatCalculator.roundDown(run(hit).getValue());
    }

    // ========== Stages ==========

    static final class ActorModifier implements DamageModifier {
        private final CombatCalculator calc;
        ActorModifier(CombatCalculator calc) { this.calc = calc; }

        @Override public String name() { return "actor"; }

        @Override
        public HitContext apply(HitContext hit) {
            Participant actor = hit.getActor();
            if (actor == null) return hit;
            double m = hit.isDamage() ? actor.getDamageModifier() : calc.healModifier(actor.getDamageModifier());
            return hit.withValue(hit.getValue() * m);
        }
    }

    static final class VarianceModifier implements DamageModifier {
        private final GameBalance.Variance variance;
        VarianceModifier(GameBalance.Variance variance) { this.variance = variance; }

        @Override public String name() { return "variance"; }

        @Override
        public HitContext apply(HitContext hit) {
            return hit.withValue(hit.getValue() * hit.getVariance().multiplier(variance));
        }
    }

    static final class CoordinationModifier implements DamageModifier {
        private final CombatCalculator calc;
        CoordinationModifier(CombatCalculator calc) { this.calc = calc; }

        @Override public String name() { return "coordination"; }

        @Override
        public HitContext apply(HitContext hit) {
            GameBalance.Coordination cfg = calc.getBalance().getCoordination();
            if (hit.isFromAdversary()) return hit;
            if (hit.getTarget().isAdversary() && !cfg.appliesToAdversary()) return hit;
            double pct = hit.isDamage() ? cfg.getDamageBonusPercent() : cfg.getHealingBonusPercent();
            return hit.withValue(hit.getValue() * calc.coordinationMultiplier(hit.getCoordinators(), pct));
        }
    }

    static final class ComebackModifier implements DamageModifier {
        private final GameBalance.Comeback comeback;
        ComebackModifier(GameBalance.Comeback comeback) { this.comeback = comeback; }

        @Override public String name() { return "comeback"; }

        @Override
        public HitContext apply(HitContext hit) {
            if (!hit.isComebackActive() || hit.isFromAdversary()) return hit;
            double pct = hit.isDamage() ? comeback.getDamageIncreasePercent() : comeback.getHealingIncreasePercent();
            return hit.withValue(hit.getValue() * (1.0 + pct / 100.0));
        }
    }

    static final class IncomingModifier implements DamageModifier {
        private final StatusEffectEngine effects;
        IncomingModifier(StatusEffectEngine effects) { this.effects = effects; }

        @Override public String name() { return "incoming"; }

        @Override
        public HitContext apply(HitContext hit) {
            if (!hit.isDamage() || hit.getTarget().isAdversary()) return hit;
            return hit.withValue(hit.getValue() * effects.incomingMultiplier(hit.getTarget().getParticipant()));
        }
    }

    static final class OutgoingModifier implements DamageModifier {
        private final StatusEffectEngine effects;
        OutgoingModifier(StatusEffectEngine effects) { this.effects = effects; }

        @Override public String name() { return "outgoing"; }

        @Override
        public HitContext apply(HitContext hit) {
            if (!hit.isDamage() || hit.isFromAdversary()) return hit;
            return hit.withValue(hit.getValue() * effects.outgoingMultiplier(hit.getActor()));
        }
    }

    static final class ArmorModifier implements DamageModifier {
        private final CombatCalculator calc;
        private final StatusEffectEngine effects;
        ArmorModifier(CombatCalculator calc, StatusEffectEngine effects) {
            this.calc = calc;
            this.effects = effects;
        }

        @Override public String name() { return "armor"; }

        @Override
        public HitContext apply(HitContext hit) {
            if (!hit.isDamage() || hit.getTarget().isAdversary()) return hit;
            Participant target = hit.getTarget().getParticipant();
            double armor = target.getArmor() + effects.armorBonus(target);
            if (hit.isComebackActive()) {
                armor += calc.getBalance().getComeback().getArmorIncrease();
            }
            return hit.withValue(calc.mitigate(hit.getValue(), armor));
        }
    }
}
