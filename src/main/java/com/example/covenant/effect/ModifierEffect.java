package com.example.covenant.effect;

import java.util.Map;

/**
 * Percent modifiers on damage taken and damage dealt.
 *
 * {@code incomingPercent} scales damage the owner receives (vulnerable +25, sanctuary -50);
 * {@code outgoingPercent} scales damage the owner deals (weakened -25, enraged +50).
 * Several modifiers multiply together.
 */
public class ModifierEffect implements EffectHandler {

    public static final String INCOMING = "incomingPercent";
    public static final String OUTGOING = "outgoingPercent";

    public static final class Instance extends EffectInstance {
        private final double incomingPercent;
        private final double outgoingPercent;

        Instance(EffectDefinition def, String ownerId, String sourceId, int turns,
                 double incomingPercent, double outgoingPercent) {
            super(def, ownerId, sourceId, turns);
            this.incomingPercent = incomingPercent;
            this.outgoingPercent = outgoingPercent;
        }

        @Override
        public double incomingPercent() { return incomingPercent; }

        @Override
        public double outgoingPercent() { return outgoingPercent; }
    }

    @Override
    public EffectInstance create(EffectDefinition def, String ownerId, String sourceId, int duration,
                                 Map<String, Double> overrides) {
        return new Instance(def, ownerId, sourceId, duration,
                EffectHandler.magnitude(def, overrides, INCOMING),
                EffectHandler.magnitude(def, overrides, OUTGOING));
    }
}
