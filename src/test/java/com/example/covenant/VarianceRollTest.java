package com.example.covenant;

import com.example.covenant.combat.VarianceRoll;
import com.example.covenant.config.GameBalance;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class VarianceRollTest {

    @Test
    void testNoLuck() {
        GameBalance.Variance v = Fixtures.quietBalance().getVariance();
        Random random = new Random(5);
        for (int i = 0; i < 100; i++) {
            assertEquals(VarianceRoll.NORMAL, VarianceRoll.roll(random, v));
        }
    }

    @Test
    void testCertainOutcomes() {
        assertEquals(VarianceRoll.CRITICAL, VarianceRoll.roll(new Random(1),
                Fixtures.quietBalance("variance.critChance", 1.0).getVariance()));
        assertEquals(VarianceRoll.FAILURE, VarianceRoll.roll(new Random(1),
                Fixtures.quietBalance("variance.failChance", 1.0).getVariance()));
        assertEquals(VarianceRoll.WILD, VarianceRoll.roll(new Random(1),
                Fixtures.quietBalance("variance.wildChance", 1.0).getVariance()));
    }

    @Test
    void testFrequenciesRoughlyMatch() {
        GameBalance.Variance v = Fixtures.quietBalance(
                "variance.critChance", 0.2, "variance.failChance", 0.1, "variance.wildChance", 0.3).getVariance();
        Map<VarianceRoll, Integer> counts = new EnumMap<>(VarianceRoll.class);
        Random random = new Random(11);
        for (int i = 0; i < 20000; i++) {
            counts.merge(VarianceRoll.roll(random, v), 1, Integer::sum);
        }
        assertEquals(0.2, counts.get(VarianceRoll.CRITICAL) / 20000.0, 0.02);
        assertEquals(0.1, counts.get(VarianceRoll.FAILURE) / 20000.0, 0.02);
        assertEquals(0.3, counts.get(VarianceRoll.WILD) / 20000.0, 0.02);
        assertEquals(0.4, counts.get(VarianceRoll.NORMAL) / 20000.0, 0.02);
    }

    @Test
    void testMultipliers() {
        GameBalance.Variance v = Fixtures.quietBalance().getVariance();
        assertEquals(1.5, VarianceRoll.CRITICAL.multiplier(v), 1e-9);
        assertEquals(1.5, VarianceRoll.WILD.multiplier(v), 1e-9);
        assertEquals(0.0, VarianceRoll.FAILURE.multiplier(v), 1e-9);
        assertEquals(1.0, VarianceRoll.NORMAL.multiplier(v), 1e-9);
    }
}
