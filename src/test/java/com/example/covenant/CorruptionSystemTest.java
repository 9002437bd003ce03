package com.example.covenant;

import com.example.covenant.combat.CombatTarget;
import com.example.covenant.combat.RoundContext;
import com.example.covenant.combat.RoundEvent;
import com.example.covenant.config.GameBalance;
import com.example.covenant.corruption.CorruptionContext;
import com.example.covenant.corruption.CorruptionSystem;
import com.example.covenant.effect.StatusEffectEngine;
import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;
import com.example.covenant.outcome.FactionCensus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for conversion attempts, their caps and cooldowns, and healing detection.
 */
public class CorruptionSystemTest {

    private StatusEffectEngine effects;
    private CorruptionSystem corruption;
    private Participant a;
    private Participant b;
    private Participant x;
    private Participant y;
    private List<Participant> all;

    /** Certain conversion, with any further overrides. */
    private void init(Object... overrides) {
        Object[] base = { "corruption.baseChance", 1.0, "corruption.maxChance", 1.0,
                "corruption.aoeModifier", 1.0, "corruption.untargetedModifier", 1.0 };
        Object[] merged = Arrays.copyOf(base, base.length + overrides.length);
        System.arraycopy(overrides, 0, merged, base.length, overrides.length);
        GameBalance balance = Fixtures.quietBalance(merged);
        effects = Fixtures.engine(balance);
        corruption = new CorruptionSystem(balance, effects);
        a = Fixtures.participant("a", 1, 100);
        b = Fixtures.participant("b", 2, 100);
        x = Fixtures.corrupted("x", 3, 100);
        y = Fixtures.corrupted("y", 4, 100);
        all = Arrays.asList(a, b, x, y);
    }

    private static RoundContext round(int n) {
        return new RoundContext(n, new Random(n), new Random(1000 + n));
    }

    // === Attempts ===

    @Test
    @DisplayName("A corrupted attacker converts their target and only the two of them are told")
    void testConversion_privateEvent() {
        init();
        RoundContext ctx = round(1);
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);

        List<Participant> converted = corruption.resolve(ctx, all);

        assertEquals(Arrays.asList(a), converted);
        assertTrue(a.isCorrupted());
        assertEquals(1, x.getStats().getCorruptionsPerformed());
        RoundEvent event = ctx.getEvents().get(0);
        assertEquals(RoundEvent.Type.CORRUPTION, event.getType());
        assertFalse(event.isPublic());
        assertTrue(event.isVisibleTo("x"));
        assertTrue(event.isVisibleTo("a"));
        assertFalse(event.isVisibleTo("b"));
        assertFalse(event.isVisibleTo("y"));
    }

    @Test
    void testCooperativeAttackerQueuesNothing() {
        init();
        corruption.beginRound();
        corruption.onAttack(a, CombatTarget.of(b), false);
        assertTrue(corruption.getQueue().isEmpty());
    }

    @Test
    void testRoundCap() {
        init();
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);
        corruption.onAttack(y, CombatTarget.of(b), false);

        assertEquals(1, corruption.resolve(round(1), all).size());
        assertTrue(a.isCorrupted());
        assertFalse(b.isCorrupted());
    }

    @Test
    void testActorCap() {
        init("corruption.maxPerRound", 5);
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), true);
        corruption.onAttack(x, CombatTarget.of(b), true);

        assertEquals(1, corruption.resolve(round(1), all).size());
        assertFalse(b.isCorrupted());
    }

    @Test
    @DisplayName("After converting, an actor waits out the cooldown")
    void testCooldown() {
        init();
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);
        corruption.resolve(round(1), all);

        assertTrue(corruption.isOnCooldown("x", 2));
        assertFalse(corruption.isOnCooldown("x", 3));

        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(b), false);
        assertTrue(corruption.resolve(round(2), all).isEmpty());

        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(b), false);
        assertEquals(1, corruption.resolve(round(3), all).size());
    }

    @Test
    void testRevealedActorBlocked() {
        init();
        RoundContext ctx = round(1);
        ctx.markRevealed("x");
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);
        assertTrue(corruption.resolve(ctx, all).isEmpty());

        init("corruption.canCorruptWhenDetected", true);
        RoundContext permissive = round(1);
        permissive.markRevealed("x");
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);
        assertEquals(1, corruption.resolve(permissive, all).size());
    }

    @Test
    void testAttackOnAdversaryPicksRandomVictim() {
        init();
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(new Adversary("Beast", 1, 100, 0)), false);

        List<Participant> converted = corruption.resolve(round(1), all);

        assertEquals(1, converted.size());
        assertTrue(converted.get(0) == a || converted.get(0) == b);
    }

    @Test
    void testFallenTargetNotConverted() {
        init();
        a.enterPendingDeath(0);
        corruption.beginRound();
        corruption.onAttack(x, CombatTarget.of(a), false);
        assertTrue(corruption.resolve(round(1), all).isEmpty());
        assertFalse(a.isCorrupted());
    }

    // === Chance ===

    @Test
    void testChanceFormula() {
        GameBalance defaults = Fixtures.quietBalance("comeback.enabled", true);
        CorruptionSystem system = new CorruptionSystem(defaults, Fixtures.engine(defaults));
        init();
        FactionCensus half = FactionCensus.of(all);

        // min(0.65, 0.45 + 0.5 * 0.4) = 0.65
        assertEquals(0.65, system.chance(CorruptionContext.SINGLE_TARGET, half, false), 1e-9);
        assertEquals(0.195, system.chance(CorruptionContext.AREA, half, false), 1e-9);
        // 15% comeback resistance
        assertEquals(0.5525, system.chance(CorruptionContext.SINGLE_TARGET, half, true), 1e-9);
    }

    // === Detection ===

    @Test
    @DisplayName("Healing a corrupted participant can expose them to the healer alone")
    void testDetection_onHeal() {
        init("healing.detectionChance", 1.0);
        RoundContext ctx = round(1);

        corruption.onHealed(ctx, a, x, 10, false);

        assertTrue(ctx.isRevealed("x"));
        assertTrue(x.hasEffect(CorruptionSystem.DETECTED_EFFECT));
        assertEquals(1.15, effects.incomingMultiplier(x), 1e-9);
        RoundEvent event = ctx.getEvents().get(0);
        assertEquals(RoundEvent.Type.DETECTION, event.getType());
        assertTrue(event.isVisibleTo("a"));
        assertFalse(event.isVisibleTo("x"));
    }

    @Test
    void testDetection_notTriggered() {
        init("healing.detectionChance", 1.0, "healing.detectionOnHealOverTime", false);
        RoundContext ctx = round(1);

        corruption.onHealed(ctx, x, x, 10, false);  // self heal
        corruption.onHealed(ctx, a, x, 0, false);   // nothing restored
        corruption.onHealed(ctx, a, x, 10, true);   // over time, disabled
        corruption.onHealed(ctx, a, b, 10, false);  // cooperative target
        corruption.onHealed(ctx, null, x, 10, false);

        assertTrue(ctx.getEvents().isEmpty());
        assertFalse(ctx.isRevealed("x"));
    }

    @Test
    void testDetection_blocksConversionSameRound() {
        init("healing.detectionChance", 1.0);
        RoundContext ctx = round(1);
        corruption.beginRound();
        corruption.onHealed(ctx, a, x, 10, false);
        corruption.onAttack(x, CombatTarget.of(b), false);

        assertTrue(corruption.resolve(ctx, all).isEmpty());
    }
}
