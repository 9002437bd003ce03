package com.example.covenant.effect;

import java.util.Map;

/**
 * Armor that wears down by {@code degradationPerHit} every time its owner is struck,
 * bottoming out at {@code minimum} (which may be negative).
 */
public class StoneArmorEffect implements EffectHandler {

    public static final String ARMOR = "armor";
    public static final String DEGRADATION = "degradationPerHit";
    public static final String MINIMUM = "minimum";

    public static final class Instance extends EffectInstance {
        private double armor;
        private final double degradationPerHit;
        private final double minimum;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns,
                 double armor, double degradationPerHit, double minimum) {
            super(def, ownerId, sourceId, turns);
            this.armor = armor;
            this.degradationPerHit = degradationPerHit;
            this.minimum = minimum;
        }

        /**
         * @return true if the armor value changed
         */
        public boolean degrade() {
            double next = Math.max(minimum, armor - degradationPerHit);
            if (next == armor) return false;
            armor = next;
            return true;
        }

        public double getArmor() { return armor; }

        @Override
        public double armorBonus() { return armor; }

        @Override
        public String describe() {
            return getDefinition().getName() + " (" + armor + " armor)";
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        return new Instance(def, ownerId, sourceId, duration,
                EffectHandler.magnitude(def, overrides, ARMOR),
                EffectHandler.magnitude(def, overrides, DEGRADATION),
                EffectHandler.magnitude(def, overrides, MINIMUM));
    }
}
