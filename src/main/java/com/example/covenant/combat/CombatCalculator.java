package com.example.covenant.combat;

import com.example.covenant.config.GameBalance;

/**
 * Pure combat formulas: armor mitigation, coordination, comeback and adversary scaling.
 *
 * Armor mitigation:
 *   armor > 0   reduction = min(maxReduction, armor * reductionRate)
 *   armor <= 0  reduction = max(-negativeCap, armor * reductionRate)
 *   final       damage * (1 - reduction)
 * so negative armor amplifies damage, up to (1 + negativeCap) times.
 *
 * Adversary:
 *   maxHp(L)  = floor(baseHp * L^hpExponent + (L - 1) * hpPerLevel)
 *   damage(a) = baseDamage * (a + ageMultiplier)
 */
public class CombatCalculator {

    /** Absorbs floating-point noise before rounding down (30 * 1.1 must give 33, not 32). */
    private static final double ROUNDING_EPSILON = 1e-9;

    private final GameBalance balance;

    public CombatCalculator(GameBalance balance) {
        this.balance = balance;
    }

    public GameBalance getBalance() { return balance; }

    /**
     * Fraction of damage removed by armor; negative means damage is amplified.
     */
    public double armorReduction(double armor) {
        GameBalance.Armor cfg = balance.getArmor();
        double raw = armor * cfg.getReductionRate();
        if (armor > 0) {
            return Math.min(cfg.getMaxReduction(), raw);
        }
        return Math.max(-cfg.getNegativeCap(), raw);
    }

    public double mitigate(double damage, double armor) {
        return damage * (1.0 - armorReduction(armor));
    }

    /**
     * @param coordinators actors on the same target with the same category, including this one
     * @param bonusPercent percent added per extra coordinator
     */
    public double coordinationMultiplier(int coordinators, double bonusPercent) {
        GameBalance.Coordination cfg = balance.getCoordination();
        if (!cfg.isEnabled() || coordinators <= 1) return 1.0;
        int extra = Math.min(coordinators - 1, cfg.getMaxCoordinators() - 1);
        return 1.0 + Math.max(0, extra) * bonusPercent / 100.0;
    }

    /**
     * Comeback switches on when the cooperative share of the table drops to the threshold.
     */
    public boolean isComebackActive(int cooperativeAlive, int totalParticipants) {
        GameBalance.Comeback cfg = balance.getComeback();
        if (!cfg.isEnabled() || totalParticipants <= 0) return false;
        double percent = cooperativeAlive * 100.0 / totalParticipants;
        return percent <= cfg.getThresholdPercent();
    }

    /**
     * Heal modifier is the inverse of the damage modifier around {@code healing.modifierBase}.
     */
    public double healModifier(double damageModifier) {
        return Math.max(0, balance.getHealing().getModifierBase() - damageModifier);
    }

    public int adversaryMaxHp(int level) {
        GameBalance.AdversaryTuning cfg = balance.getAdversary();
        double hp = cfg.getBaseHp() * Math.pow(level, cfg.getHpExponent()) + (level - 1) * (double) cfg.getHpPerLevel();
        return Math.max(1, roundDown(hp));
    }

    public int adversaryDamage(int age) {
        GameBalance.AdversaryTuning cfg = balance.getAdversary();
        return cfg.getBaseDamage() * (age + cfg.getAgeMultiplier());
    }

    /**
     * Floor, never below zero.
     */
    public static int roundDown(double value) {
        if (value <= 0) return 0;
        return (int) Math.floor(value + ROUNDING_EPSILON);
    }
}
