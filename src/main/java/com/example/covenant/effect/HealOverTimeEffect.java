package com.example.covenant.effect;

import com.example.covenant.model.Participant;

import java.util.Map;

/**
 * Restores a flat {@code amount} each end-of-round pass. The heal goes through the normal
 * healing path, so it is blocked by rage and can expose a corrupted caster.
 */
public class HealOverTimeEffect implements EffectHandler {

    public static final String AMOUNT = "amount";

    public static final class Instance extends EffectInstance {
        private final int healPerTurn;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns, int healPerTurn) {
            super(def, ownerId, sourceId, turns);
            this.healPerTurn = healPerTurn;
        }

        public int getHealPerTurn() { return healPerTurn; }

        @Override
        public String describe() {
            return getDefinition().getName() + " (+" + healPerTurn + "/turn)";
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        int amount = (int) Math.max(0, Math.floor(EffectHandler.magnitude(def, overrides, AMOUNT)));
        return new Instance(def, ownerId, sourceId, duration, amount);
    }

    @Override
    public void tick(EffectInstance instance, Participant owner, EffectTickContext ctx) {
        Instance hot = (Instance) instance;
        if (hot.healPerTurn > 0) {
            ctx.applyTickHealing(owner, hot.healPerTurn, hot);
        }
    }
}
