package com.example.covenant.effect;

import com.example.covenant.model.Adversary;
import com.example.covenant.model.Participant;

import java.util.Map;

/**
 * Heals its owner each round for a share of the adversary's current hp.
 * Does nothing while the adversary is down.
 */
public class LifeBondEffect implements EffectHandler {

    public static final String HEALING_PERCENT = "healingPercent";

    public static final class Instance extends EffectInstance {
        private final double healingPercent;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns, double healingPercent) {
            super(def, ownerId, sourceId, turns);
            this.healingPercent = healingPercent;
        }

        public double getHealingPercent() { return healingPercent; }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        return new Instance(def, ownerId, sourceId, duration, EffectHandler.magnitude(def, overrides, HEALING_PERCENT));
    }

    @Override
    public void tick(EffectInstance instance, Participant owner, EffectTickContext ctx) {
        Instance bond = (Instance) instance;
        Adversary adversary = ctx.getAdversary();
        if (adversary == null || !adversary.isAlive()) return;
        int amount = (int) Math.floor(adversary.getHp() * bond.healingPercent + 1e-9);
        if (amount > 0) {
            ctx.applyTickHealing(owner, amount, bond);
        }
    }
}
