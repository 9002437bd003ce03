package com.example.covenant.combat;

import com.example.covenant.config.GameBalance;

import java.util.Random;

/**
 * The once-per-action luck roll. Outcomes are mutually exclusive.
 */
public enum VarianceRoll {
    NORMAL,
    CRITICAL,
    FAILURE,
    /** Failure that lands on a random other target, at critical strength */
    WILD;

    public static VarianceRoll roll(Random random, GameBalance.Variance v) {
        double r = random.nextDouble();
        if (r < v.getCritChance()) return CRITICAL;
        r -= v.getCritChance();
        if (r < v.getFailChance()) return FAILURE;
        r -= v.getFailChance();
        if (r < v.getWildChance()) return WILD;
        return NORMAL;
    }

    public double multiplier(GameBalance.Variance v) {
        switch (this) {
            case CRITICAL:
            case WILD:
                return v.getCritMultiplier();
            case FAILURE:
                return 0.0;
            default:
                return 1.0;
        }
    }
}
