package com.example.covenant.effect;

import java.util.Map;

/**
 * Temporary flat armor (shield wall, spirit guard).
 */
public class ArmorEffect implements EffectHandler {

    public static final String ARMOR = "armor";

    public static final class Instance extends EffectInstance {
        private final double armor;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns, double armor) {
            super(def, ownerId, sourceId, turns);
            this.armor = armor;
        }

        @Override
        public double armorBonus() { return armor; }

        @Override
        public String describe() {
            return getDefinition().getName() + " (+" + armor + " armor)";
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        return new Instance(def, ownerId, sourceId, duration, EffectHandler.magnitude(def, overrides, ARMOR));
    }
}
