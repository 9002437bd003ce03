package com.example.covenant.config;

import com.example.covenant.model.AbilityCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable tuning for one game session.
 *
 * Built once by {@link GameBalanceLoader} and shared read-only by every component of the
 * session. Nothing in the round engine hard-codes a balance number; it reads it from here.
 */
public final class GameBalance {

    private final Armor armor;
    private final Variance variance;
    private final Coordination coordination;
    private final Comeback comeback;
    private final Healing healing;
    private final Corruption corruption;
    private final Threat threat;
    private final AdversaryTuning adversary;
    private final Effects effects;
    private final int pendingDeathHp;
    private final PriorityBands priorityBands;
    private final Map<String, Integer> abilityCooldowns;

    GameBalance(ConfigSection root) {
        this.armor = new Armor(root.getSection("armor"));
        this.variance = new Variance(root.getSection("variance"));
        this.coordination = new Coordination(root.getSection("coordination"));
        this.comeback = new Comeback(root.getSection("comeback"));
        this.healing = new Healing(root.getSection("healing"));
        this.corruption = new Corruption(root.getSection("corruption"));
        this.threat = new Threat(root.getSection("threat"));
        this.adversary = new AdversaryTuning(root.getSection("adversary"));
        this.effects = new Effects(root.getSection("effects"));
        this.pendingDeathHp = nonNegative(root.getSection("death"), "pendingDeathHp");
        this.priorityBands = new PriorityBands(root.getSection("priorityBands"));

        Map<String, Integer> cooldowns = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : root.getOptionalSection("abilityCooldowns").asDoubleMap().entrySet()) {
            if (e.getValue() < 0) {
                throw new ConfigurationException("Cooldown override for '" + e.getKey() + "' is negative");
            }
            cooldowns.put(e.getKey(), e.getValue().intValue());
        }
        this.abilityCooldowns = Collections.unmodifiableMap(cooldowns);
    }

    public Armor getArmor() { return armor; }
    public Variance getVariance() { return variance; }
    public Coordination getCoordination() { return coordination; }
    public Comeback getComeback() { return comeback; }
    public Healing getHealing() { return healing; }
    public Corruption getCorruption() { return corruption; }
    public Threat getThreat() { return threat; }
    public AdversaryTuning getAdversary() { return adversary; }
    public Effects getEffects() { return effects; }
    public int getPendingDeathHp() { return pendingDeathHp; }
    public PriorityBands getPriorityBands() { return priorityBands; }

    /**
     * Cooldown override for an ability, or null when the catalog value applies.
     */
    public Integer getCooldownOverride(String abilityId) {
        return abilityCooldowns.get(abilityId);
    }

    // ========== Sections ==========

    public static final class Armor {
        private final double reductionRate;
        private final double maxReduction;
        private final double negativeCap;

        Armor(ConfigSection s) {
            this.reductionRate = nonNegativeDouble(s, "reductionRate");
            this.maxReduction = fraction(s, "maxReduction");
            this.negativeCap = nonNegativeDouble(s, "negativeCap");
        }

        public double getReductionRate() { return reductionRate; }
        public double getMaxReduction() { return maxReduction; }
        public double getNegativeCap() { return negativeCap; }
    }

    public static final class Variance {
        private final double critChance;
        private final double failChance;
        private final double wildChance;
        private final double critMultiplier;

        Variance(ConfigSection s) {
            this.critChance = fraction(s, "critChance");
            this.failChance = fraction(s, "failChance");
            this.wildChance = fraction(s, "wildChance");
            this.critMultiplier = nonNegativeDouble(s, "critMultiplier");
            if (critChance + failChance + wildChance > 1.0) {
                throw new ConfigurationException("variance chances add up to more than 1.0");
            }
        }

        public double getCritChance() { return critChance; }
        public double getFailChance() { return failChance; }
        public double getWildChance() { return wildChance; }
        public double getCritMultiplier() { return critMultiplier; }
    }

    public static final class Coordination {
        private final boolean enabled;
        private final double damageBonusPercent;
        private final double healingBonusPercent;
        private final boolean appliesToAdversary;
        private final int maxCoordinators;

        Coordination(ConfigSection s) {
            this.enabled = s.getBoolean("enabled");
            this.damageBonusPercent = nonNegativeDouble(s, "damageBonusPercent");
            this.healingBonusPercent = nonNegativeDouble(s, "healingBonusPercent");
            this.appliesToAdversary = s.getBoolean("appliesToAdversary");
            this.maxCoordinators = nonNegative(s, "maxCoordinators");
        }

        public boolean isEnabled() { return enabled; }
        public double getDamageBonusPercent() { return damageBonusPercent; }
        public double getHealingBonusPercent() { return healingBonusPercent; }
        public boolean appliesToAdversary() { return appliesToAdversary; }
        public int getMaxCoordinators() { return maxCoordinators; }
    }

    public static final class Comeback {
        private final boolean enabled;
        private final double thresholdPercent;
        private final double damageIncreasePercent;
        private final double healingIncreasePercent;
        private final double armorIncrease;
        private final double corruptionResistancePercent;

        Comeback(ConfigSection s) {
            this.enabled = s.getBoolean("enabled");
            this.thresholdPercent = nonNegativeDouble(s, "thresholdPercent");
            this.damageIncreasePercent = nonNegativeDouble(s, "damageIncreasePercent");
            this.healingIncreasePercent = nonNegativeDouble(s, "healingIncreasePercent");
            this.armorIncrease = s.getDouble("armorIncrease");
            this.corruptionResistancePercent = nonNegativeDouble(s, "corruptionResistancePercent");
        }

        public boolean isEnabled() { return enabled; }
        public double getThresholdPercent() { return thresholdPercent; }
        public double getDamageIncreasePercent() { return damageIncreasePercent; }
        public double getHealingIncreasePercent() { return healingIncreasePercent; }
        public double getArmorIncrease() { return armorIncrease; }
        public double getCorruptionResistancePercent() { return corruptionResistancePercent; }
    }

    public static final class Healing {
        private final double modifierBase;
        private final double detectionChance;
        private final boolean detectionRequiresActualHealing;
        private final boolean detectionOnHealOverTime;

        Healing(ConfigSection s) {
            this.modifierBase = nonNegativeDouble(s, "modifierBase");
            this.detectionChance = fraction(s, "detectionChance");
            this.detectionRequiresActualHealing = s.getBoolean("detectionRequiresActualHealing");
            this.detectionOnHealOverTime = s.getBoolean("detectionOnHealOverTime");
        }

        public double getModifierBase() { return modifierBase; }
        public double getDetectionChance() { return detectionChance; }
        public boolean isDetectionRequiresActualHealing() { return detectionRequiresActualHealing; }
        public boolean isDetectionOnHealOverTime() { return detectionOnHealOverTime; }
    }

    public static final class Corruption {
        private final double baseChance;
        private final double maxChance;
        private final double scalingFactor;
        private final int maxPerRound;
        private final int maxPerActor;
        private final int cooldownRounds;
        private final double singleTargetModifier;
        private final double aoeModifier;
        private final double untargetedModifier;
        private final boolean canCorruptWhenDetected;
        private final double detectionDamagePenaltyPercent;
        private final int detectionPenaltyDuration;
        private final double maxResistance;

        Corruption(ConfigSection s) {
            this.baseChance = fraction(s, "baseChance");
            this.maxChance = fraction(s, "maxChance");
            this.scalingFactor = nonNegativeDouble(s, "scalingFactor");
            this.maxPerRound = nonNegative(s, "maxPerRound");
            this.maxPerActor = nonNegative(s, "maxPerActor");
            this.cooldownRounds = nonNegative(s, "cooldownRounds");
            this.singleTargetModifier = nonNegativeDouble(s, "singleTargetModifier");
            this.aoeModifier = nonNegativeDouble(s, "aoeModifier");
            this.untargetedModifier = nonNegativeDouble(s, "untargetedModifier");
            this.canCorruptWhenDetected = s.getBoolean("canCorruptWhenDetected");
            this.detectionDamagePenaltyPercent = nonNegativeDouble(s, "detectionDamagePenaltyPercent");
            this.detectionPenaltyDuration = nonNegative(s, "detectionPenaltyDuration");
            this.maxResistance = fraction(s, "maxResistance");
        }

        public double getBaseChance() { return baseChance; }
        public double getMaxChance() { return maxChance; }
        public double getScalingFactor() { return scalingFactor; }
        public int getMaxPerRound() { return maxPerRound; }
        public int getMaxPerActor() { return maxPerActor; }
        public int getCooldownRounds() { return cooldownRounds; }
        public double getSingleTargetModifier() { return singleTargetModifier; }
        public double getAoeModifier() { return aoeModifier; }
        public double getUntargetedModifier() { return untargetedModifier; }
        public boolean canCorruptWhenDetected() { return canCorruptWhenDetected; }
        public double getDetectionDamagePenaltyPercent() { return detectionDamagePenaltyPercent; }
        public int getDetectionPenaltyDuration() { return detectionPenaltyDuration; }
        public double getMaxResistance() { return maxResistance; }
    }

    public static final class Threat {
        private final boolean enabled;
        private final double armorWeight;
        private final double damageWeight;
        private final double healWeight;
        private final double decayRate;
        private final double deathReduction;
        private final int avoidLastTargetRounds;
        private final boolean ignoreStealth;
        private final boolean tiebreakRandom;
        private final double epsilon;

        Threat(ConfigSection s) {
            this.enabled = s.getBoolean("enabled");
            this.armorWeight = nonNegativeDouble(s, "armorWeight");
            this.damageWeight = nonNegativeDouble(s, "damageWeight");
            this.healWeight = nonNegativeDouble(s, "healWeight");
            this.decayRate = fraction(s, "decayRate");
            this.deathReduction = fraction(s, "deathReduction");
            this.avoidLastTargetRounds = nonNegative(s, "avoidLastTargetRounds");
            this.ignoreStealth = s.getBoolean("ignoreStealth");
            this.tiebreakRandom = s.getBoolean("tiebreakRandom");
            this.epsilon = nonNegativeDouble(s, "epsilon");
        }

        public boolean isEnabled() { return enabled; }
        public double getArmorWeight() { return armorWeight; }
        public double getDamageWeight() { return damageWeight; }
        public double getHealWeight() { return healWeight; }
        public double getDecayRate() { return decayRate; }
        public double getDeathReduction() { return deathReduction; }
        public int getAvoidLastTargetRounds() { return avoidLastTargetRounds; }
        public boolean isIgnoreStealth() { return ignoreStealth; }
        public boolean isTiebreakRandom() { return tiebreakRandom; }
        public double getEpsilon() { return epsilon; }
    }

    public static final class AdversaryTuning {
        private final int baseHp;
        private final int baseDamage;
        private final int ageMultiplier;
        private final double hpExponent;
        private final int hpPerLevel;

        AdversaryTuning(ConfigSection s) {
            this.baseHp = positive(s, "baseHp");
            this.baseDamage = nonNegative(s, "baseDamage");
            this.ageMultiplier = nonNegative(s, "ageMultiplier");
            this.hpExponent = nonNegativeDouble(s, "hpExponent");
            this.hpPerLevel = nonNegative(s, "hpPerLevel");
        }

        public int getBaseHp() { return baseHp; }
        public int getBaseDamage() { return baseDamage; }
        public int getAgeMultiplier() { return ageMultiplier; }
        public double getHpExponent() { return hpExponent; }
        public int getHpPerLevel() { return hpPerLevel; }
    }

    public static final class Effects {
        private final int maxPerParticipant;
        private final int maxTurns;

        Effects(ConfigSection s) {
            this.maxPerParticipant = positive(s, "maxPerParticipant");
            this.maxTurns = positive(s, "maxTurns");
        }

        public int getMaxPerParticipant() { return maxPerParticipant; }
        public int getMaxTurns() { return maxTurns; }
    }

    /**
     * Expected priority ranges. A band is a convention, not a constraint: abilities outside
     * their band still load, with a warning.
     */
    public static final class PriorityBands {
        public enum Band { REFLEXIVE, DEFENSIVE, SPECIAL, OFFENSIVE, RESTORATIVE }

        private final Map<Band, int[]> ranges = new EnumMap<>(Band.class);

        PriorityBands(ConfigSection s) {
            for (Band band : Band.values()) {
                ConfigSection r = s.getSection(band.name().toLowerCase());
                int min = r.getInt("min");
                int max = r.getInt("max");
                if (min > max) {
                    throw new ConfigurationException("Priority band '" + r.getPath() + "' has min > max");
                }
                ranges.put(band, new int[] { min, max });
            }
        }

        public int getMin(Band band) { return ranges.get(band)[0]; }
        public int getMax(Band band) { return ranges.get(band)[1]; }

        public boolean contains(Band band, int priority) {
            int[] r = ranges.get(band);
            return priority >= r[0] && priority <= r[1];
        }

        public Band expectedBand(AbilityCategory category) {
            switch (category) {
                case ATTACK: return Band.OFFENSIVE;
                case DEFENSE: return Band.DEFENSIVE;
                case HEAL: return Band.RESTORATIVE;
                case SPECIAL:
                default: return Band.SPECIAL;
            }
        }

        /**
         * Reflexive priorities are legal for every category.
         */
        public boolean isWithinExpectedBand(AbilityCategory category, int priority) {
            return contains(Band.REFLEXIVE, priority) || contains(expectedBand(category), priority);
        }
    }

    // ========== Validation helpers ==========

    private static double nonNegativeDouble(ConfigSection s, String key) {
        double v = s.getDouble(key);
        if (v < 0 || Double.isNaN(v)) {
            throw new ConfigurationException("Setting '" + s.getPath() + "." + key + "' must not be negative");
        }
        return v;
    }

    private static double fraction(ConfigSection s, String key) {
        double v = nonNegativeDouble(s, key);
        if (v > 1.0) {
            throw new ConfigurationException("Setting '" + s.getPath() + "." + key + "' must be between 0 and 1");
        }
        return v;
    }

    private static int nonNegative(ConfigSection s, String key) {
        int v = s.getInt(key);
        if (v < 0) {
            throw new ConfigurationException("Setting '" + s.getPath() + "." + key + "' must not be negative");
        }
        return v;
    }

    private static int positive(ConfigSection s, String key) {
        int v = s.getInt(key);
        if (v <= 0) {
            throw new ConfigurationException("Setting '" + s.getPath() + "." + key + "' must be positive");
        }
        return v;
    }
}
