package com.example.covenant.corruption;

import com.example.covenant.config.GameBalance;

/**
 * How a conversion attempt was triggered; each context scales the chance differently.
 */
public enum CorruptionContext {
    /** Attack on one participant */
    SINGLE_TARGET,
    /** Area attack, one attempt per participant hit */
    AREA,
    /** Attack on the adversary; the victim is picked at random */
    UNTARGETED;

    public double modifier(GameBalance.Corruption cfg) {
        switch (this) {
            case AREA:
                return cfg.getAoeModifier();
            case UNTARGETED:
                return cfg.getUntargetedModifier();
            case SINGLE_TARGET:
            default:
                return cfg.getSingleTargetModifier();
        }
    }
}
