package com.example.covenant.effect;

import com.example.covenant.model.Participant;

import java.util.Map;

/**
 * Behaviour for one effect type.
 */
public interface EffectHandler {

    /**
     * Build a new instance. Magnitudes come from the definition defaults, replaced by any
     * entries in {@code overrides}.
     */
    EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                          Map<String, Double> overrides);

    /**
     * Per-round consequence, run during the end-of-round pass before the duration is decremented.
     */
    default void tick(EffectInstance instance, Participant owner, EffectTickContext ctx) {}

    static double magnitude(EffectDefinition def, Map<String, Double> overrides, String key) {
        if (overrides != null && overrides.containsKey(key)) {
            return overrides.get(key);
        }
        return def.getMagnitude(key, 0);
    }
}
