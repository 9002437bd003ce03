package com.example.covenant;

import com.example.covenant.combat.CombatCalculator;
import com.example.covenant.combat.CombatTarget;
import com.example.covenant.combat.HitContext;
import com.example.covenant.combat.ModifierPipeline;
import com.example.covenant.combat.VarianceRoll;
import com.example.covenant.config.GameBalance;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ordered damage/heal modifier chain.
 */
public class ModifierPipelineTest {

    private final GameBalance balance = Fixtures.quietBalance();
    private final StatusEffectEngine effects = Fixtures.engine(balance);
    private final ModifierPipeline pipeline = ModifierPipeline.standard(new CombatCalculator(balance), effects);

    private final Participant actor = Fixtures.participant("a", 1, 100);
    private final Participant target = Fixtures.participant("t", 2, 100);
    private final Adversary adversary = new Adversary("Beast", 1, 100, 0);

    @Test
    @DisplayName("Stage order is fixed")
    void testStageOrder() {
        assertEquals(Arrays.asList("actor", "variance", "coordination", "comeback", "incoming", "outgoing", "armor"),
                pipeline.stageNames());
    }

    @Test
    @DisplayName("Two coordinators on the adversary turn 30 into 33")
    void testCoordinationScenario() {
        HitContext hit = HitContext.damage(30, actor, CombatTarget.of(adversary), VarianceRoll.NORMAL, 2, false);
        assertEquals(33, pipeline.resolve(hit));
    }

    @Test
    void testCoordination_notAppliedToAdversaryWhenDisabled() {
        GameBalance b = Fixtures.quietBalance("coordination.appliesToAdversary", false);
        ModifierPipeline p = ModifierPipeline.standard(new CombatCalculator(b), effects);
        HitContext hit = HitContext.damage(30, actor, CombatTarget.of(adversary), VarianceRoll.NORMAL, 2, false);
        assertEquals(30, p.resolve(hit));
    }

    @Test
    void testArmorMitigation() {
        target.setArmor(5);
        HitContext hit = HitContext.damage(40, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false);
        assertEquals(20, pipeline.resolve(hit));
    }

    @Test
    void testActorDamageModifier() {
        actor.setDamageModifier(1.5);
        HitContext hit = HitContext.damage(20, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false);
        assertEquals(30, pipeline.resolve(hit));
    }

    @Test
    @DisplayName("Healing ignores armor and incoming modifiers")
    void testHealingSkipsArmor() {
        target.setArmor(5);
        effects.apply(target, "vulnerable", "a");
        HitContext heal = HitContext.heal(20, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false);
        assertEquals(20, pipeline.resolve(heal));
    }

    @Test
    void testHealingUsesInverseModifier() {
        actor.setDamageModifier(1.5);
        HitContext heal = HitContext.heal(20, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false);
        assertEquals(10, pipeline.resolve(heal));
    }

    @Test
    void testVulnerableAndWeakened() {
        effects.apply(target, "vulnerable", "a");
        assertEquals(50, pipeline.resolve(
                HitContext.damage(40, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false)));

        effects.apply(actor, "weakened", "t");
        // 40 * 0.75 * 1.25 = 37.5
        assertEquals(37, pipeline.resolve(
                HitContext.damage(40, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false)));
    }

    @Test
    void testSanctuaryHalvesDamage() {
        effects.apply(target, "sanctuary", "t");
        assertEquals(20, pipeline.resolve(
                HitContext.damage(40, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, false)));
    }

    @Test
    void testVarianceOutcomes() {
        assertEquals(30, pipeline.resolve(
                HitContext.damage(20, actor, CombatTarget.of(target), VarianceRoll.CRITICAL, 1, false)));
        assertEquals(0, pipeline.resolve(
                HitContext.damage(20, actor, CombatTarget.of(target), VarianceRoll.FAILURE, 1, false)));
    }

    @Test
    void testComebackBoostsHealing() {
        HitContext heal = HitContext.heal(20, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, true);
        assertEquals(25, pipeline.resolve(heal));
    }

    @Test
    @DisplayName("Comeback raises damage and the target's armor")
    void testComebackOnDamage() {
        // 40 * 1.25 = 50, then armor 0 + 1 -> 10% reduction -> 45
        HitContext hit = HitContext.damage(40, actor, CombatTarget.of(target), VarianceRoll.NORMAL, 1, true);
        assertEquals(45, pipeline.resolve(hit));
    }

    @Test
    void testAdversaryStrikeMitigatedByArmor() {
        target.setArmor(5);
        assertEquals(20, pipeline.resolve(HitContext.adversaryStrike(40, CombatTarget.of(target), false)));
    }
}
