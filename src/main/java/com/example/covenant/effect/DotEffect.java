package com.example.covenant.effect;

import com.example.covenant.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Damage-over-time (poison, bleed).
 *
 * Deals a flat {@code damage} to its owner in every end-of-round pass. Periodic damage
 * bypasses armor; incoming damage modifiers do not apply to it either.
 */
public class DotEffect implements EffectHandler {

    private static final Logger logger = LoggerFactory.getLogger(DotEffect.class);

    public static final String DAMAGE = "damage";

    public static final class Instance extends EffectInstance {
        private final int damagePerTurn;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns, int damagePerTurn) {
            super(def, ownerId, sourceId, turns);
            this.damagePerTurn = damagePerTurn;
        }

        public int getDamagePerTurn() { return damagePerTurn; }

        @Override
        public String describe() {
            return getDefinition().getName() + " (" + damagePerTurn + "/turn)";
        }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        int dmg = (int) Math.max(0, Math.floor(EffectHandler.magnitude(def, overrides, DAMAGE)));
        return new Instance(def, ownerId, sourceId, duration, dmg);
    }

    @Override
    public void tick(EffectInstance instance, Participant owner, EffectTickContext ctx) {
        Instance dot = (Instance) instance;
        if (dot.damagePerTurn <= 0) return;
        int dealt = ctx.applyTickDamage(owner, dot.damagePerTurn, dot);
        logger.debug("[DotEffect] {} took {} from {}", owner.getId(), dealt, dot.getDefinition().getId());
    }
}
