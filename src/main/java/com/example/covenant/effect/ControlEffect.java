package com.example.covenant.effect;

import java.util.Map;

/**
 * Stun and stealth. The behaviour lives entirely in the definition's flags
 * ({@link EffectDefinition.Flag#PREVENTS_ACTIONS}, {@link EffectDefinition.Flag#PREVENTS_TARGETING}).
 */
public class ControlEffect implements EffectHandler {

    public static final class Instance extends EffectInstance {
        Instance(EffectDefinition def, String ownerId, String sourceId, int turns) {
            super(def, ownerId, sourceId, turns);
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        return new Instance(def, ownerId, sourceId, duration);
    }
}
