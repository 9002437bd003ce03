package com.example.covenant.combat;

import com.example.covenant.model.Participant;

/**
 * Immutable value flowing through the {@link ModifierPipeline}. Each stage returns a copy
 * with a new {@code value}; nothing else changes on the way through.
 */
public final class HitContext {

    private enum Kind { DAMAGE, HEAL }

    private final Kind kind;
    private final double base;
    private final double value;
    private final Participant actor; // null when the adversary strikes
    private final CombatTarget target;
    private final VarianceRoll variance;
    private final int coordinators;
    private final boolean comebackActive;

    private HitContext(Kind kind, double base, double value, Participant actor, CombatTarget target,
                       VarianceRoll variance, int coordinators, boolean comebackActive) {
        this.kind = kind;
        this.base = base;
        this.value = value;
        this.actor = actor;
        this.target = target;
        this.variance = variance;
        this.coordinators = coordinators;
        this.comebackActive = comebackActive;
    }

    public static HitContext damage(double base, Participant actor, CombatTarget target, VarianceRoll variance,
                                    int coordinators, boolean comebackActive) {
        return new HitContext(Kind.DAMAGE, base, base, actor, target, variance, coordinators, comebackActive);
    }

    public static HitContext heal(double base, Participant actor, CombatTarget target, VarianceRoll variance,
                                  int coordinators, boolean comebackActive) {
        return new HitContext(Kind.HEAL, base, base, actor, target, variance, coordinators, comebackActive);
    }

    /**
     * The adversary's strike: no actor modifiers, variance, or coordination.
     */
    public static HitContext adversaryStrike(double base, CombatTarget target, boolean comebackActive) {
        return new HitContext(Kind.DAMAGE, base, base, null, target, VarianceRoll.NORMAL, 0, comebackActive);
    }

    public HitContext withValue(double newValue) {
        return new HitContext(kind, base, newValue, actor, target, variance, coordinators, comebackActive);
    }

    public boolean isDamage() { return kind == Kind.DAMAGE; }
    public boolean isHeal() { return kind == Kind.HEAL; }
    public double getValue() { return value; }
    public Participant getActor() { return actor; }
    public boolean isFromAdversary() { return actor == null; }
    public CombatTarget getTarget() { return target; }
    public VarianceRoll getVariance() { return variance; }
    public int getCoordinators() { return coordinators; }
    public boolean isComebackActive() { return comebackActive; }

    @Override
    public String toString() {
        return String.format("HitContext[%s %.2f -> %.2f, %s]", kind, base, value, variance);
    }
}
