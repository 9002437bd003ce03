package com.example.covenant;

import com.example.covenant.combat.CombatCalculator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for armor mitigation, coordination, comeback and adversary scaling formulas.
 */
public class CombatCalculatorTest {

    private final CombatCalculator calculator = new CombatCalculator(Fixtures.quietBalance("comeback.enabled", true));

    // === Armor ===

    @Test
    @DisplayName("Armor 5 at rate 0.1 halves 40 damage to 20")
    void testArmor_scenario() {
        assertEquals(0.5, calculator.armorReduction(5), 1e-9);
        assertEquals(20, CombatCalculator.roundDown(calculator.mitigate(40, 5)));
    }

    @Test
    void testArmor_positiveCapped() {
        // 10 * 0.1 = 1.0, capped at 0.75
        assertEquals(0.75, calculator.armorReduction(10), 1e-9);
        assertEquals(10, CombatCalculator.roundDown(calculator.mitigate(40, 10)));
    }

    @Test
    void testArmor_negativeAmplifies() {
        // -3 * 0.1 = -0.3 -> 130% damage
        assertEquals(-0.3, calculator.armorReduction(-3), 1e-9);
        assertEquals(52, CombatCalculator.roundDown(calculator.mitigate(40, -3)));
    }

    @Test
    void testArmor_negativeCapped() {
        // -30 * 0.1 = -3.0, capped at -2.0 -> 300% damage
        assertEquals(-2.0, calculator.armorReduction(-30), 1e-9);
        assertEquals(120, CombatCalculator.roundDown(calculator.mitigate(40, -30)));
    }

    @Test
    @DisplayName("More armor never means more damage")
    void testArmor_monotonicNonNegative() {
        double previous = Double.MAX_VALUE;
        for (double armor = 0; armor <= 12; armor += 0.25) {
            double dmg = calculator.mitigate(100, armor);
            assertTrue(dmg <= previous, "armor " + armor + " increased damage");
            previous = dmg;
        }
    }

    @Test
    @DisplayName("Decreasing negative armor strictly increases damage until the cap")
    void testArmor_monotonicNegative() {
        double previous = calculator.mitigate(100, 0);
        for (double armor = -0.5; armor >= -20; armor -= 0.5) {
            double dmg = calculator.mitigate(100, armor);
            assertTrue(dmg > previous, "armor " + armor + " did not increase damage");
            previous = dmg;
        }
    }

    // === Coordination ===

    @Test
    void testCoordination_twoActors() {
        double m = calculator.coordinationMultiplier(2, 10);
        assertEquals(1.1, m, 1e-9);
        assertEquals(33, CombatCalculator.roundDown(30 * m));
    }

    @Test
    void testCoordination_soloHasNoBonus() {
        assertEquals(1.0, calculator.coordinationMultiplier(1, 10), 1e-9);
        assertEquals(1.0, calculator.coordinationMultiplier(0, 10), 1e-9);
    }

    @Test
    void testCoordination_capped() {
        // maxCoordinators 5 -> at most 4 extra
        assertEquals(1.4, calculator.coordinationMultiplier(9, 10), 1e-9);
    }

    // === Comeback ===

    @Test
    void testComeback_threshold() {
        assertTrue(calculator.isComebackActive(1, 4));   // 25%
        assertFalse(calculator.isComebackActive(2, 4));  // 50%
        assertTrue(calculator.isComebackActive(0, 4));
    }

    @Test
    void testComeback_disabled() {
        CombatCalculator quiet = new CombatCalculator(Fixtures.quietBalance());
        assertFalse(quiet.isComebackActive(0, 4));
    }

    // === Healing and adversary ===

    @Test
    void testHealModifier() {
        assertEquals(1.0, calculator.healModifier(1.0), 1e-9);
        assertEquals(0.5, calculator.healModifier(1.5), 1e-9);
        assertEquals(0.0, calculator.healModifier(3.0), 1e-9);
    }

    @Test
    void testAdversaryScaling() {
        assertEquals(100, calculator.adversaryMaxHp(1));
        // 100 * 2^1.3 = 246.2...
        assertEquals(246, calculator.adversaryMaxHp(2));
        assertEquals(25, calculator.adversaryDamage(0));
        assertEquals(75, calculator.adversaryDamage(2));
    }

    @Test
    void testRoundDown() {
        assertEquals(0, CombatCalculator.roundDown(-5));
        assertEquals(32, CombatCalculator.roundDown(32.999));
        assertEquals(33, CombatCalculator.roundDown(32.9999999999));
    }
}
