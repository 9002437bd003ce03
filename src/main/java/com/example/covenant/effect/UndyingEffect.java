package com.example.covenant.effect;

import java.util.Map;

/**
 * Passive revival. When its owner's death is about to be committed, one use is spent and
 * the owner returns with {@code resurrectHp}.
 */
public class UndyingEffect implements EffectHandler {

    public static final String RESURRECT_HP = "resurrectHp";
    public static final String USES = "uses";

    public static final class Instance extends EffectInstance {
        private final int resurrectHp;
        private int usesLeft;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns, int resurrectHp, int uses) {
            super(def, ownerId, sourceId, turns);
            this.resurrectHp = resurrectHp;
            this.usesLeft = uses;
        }

        public int getResurrectHp() { return resurrectHp; }
        public int getUsesLeft() { return usesLeft; }
        public boolean isSpent() { return usesLeft <= 0; }

        /**
         * @return hp to revive with, or 0 if no uses remain
         */
        public int consume() {
            if (usesLeft <= 0) return 0;
            usesLeft--;
            return Math.max(1, resurrectHp);
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        int hp = (int) Math.floor(EffectHandler.magnitude(def, overrides, RESURRECT_HP));
        double usesRaw = EffectHandler.magnitude(def, overrides, USES);
        int uses = usesRaw > 0 ? (int) usesRaw : 1;
        return new Instance(def, ownerId, sourceId, duration, hp, uses);
    }
}
