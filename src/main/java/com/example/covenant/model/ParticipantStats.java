package com.example.covenant.model;

/**
 * Accumulated combat statistics for one participant, read by the analytics pipeline through
 * {@link #snapshot()}.
 */
public class ParticipantStats {

    private int damageDealt;
    private int damageToAdversary;
    private int damageTaken;
    private int healingDone;
    private int selfHealing;
    private int kills;
    private int abilitiesUsed;
    private int corruptionsPerformed;
    private int timesRevived;

    public void addDamageDealt(int amount, boolean toAdversary) {
        if (amount <= 0) return;
        damageDealt += amount;
        if (toAdversary) {
            damageToAdversary += amount;
        }
    }

    public void addDamageTaken(int amount) {
        if (amount > 0) damageTaken += amount;
    }

    public void addHealingDone(int amount, boolean self) {
        if (amount <= 0) return;
        healingDone += amount;
        if (self) {
            selfHealing += amount;
        }
    }

    public void addKill() { kills++; }
    public void addAbilityUsed() { abilitiesUsed++; }
    public void addCorruption() { corruptionsPerformed++; }
    public void addRevive() { timesRevived++; }

    public int getDamageDealt() { return damageDealt; }
    public int getDamageToAdversary() { return damageToAdversary; }
    public int getDamageTaken() { return damageTaken; }
    public int getHealingDone() { return healingDone; }
    public int getSelfHealing() { return selfHealing; }
    public int getKills() { return kills; }
    public int getAbilitiesUsed() { return abilitiesUsed; }
    public int getCorruptionsPerformed() { return corruptionsPerformed; }
    public int getTimesRevived() { return timesRevived; }

    public Snapshot snapshot() {
        return new Snapshot(this);
    }

    /**
     * Immutable copy of the counters at one point in time.
     */
    public static final class Snapshot {
        public final int damageDealt;
        public final int damageToAdversary;
        public final int damageTaken;
        public final int healingDone;
        public final int selfHealing;
        public final int kills;
        public final int abilitiesUsed;
        public final int corruptionsPerformed;
        public final int timesRevived;

        private Snapshot(ParticipantStats s) {
            this.damageDealt = s.damageDealt;
            this.damageToAdversary = s.damageToAdversary;
            this.damageTaken = s.damageTaken;
            this.healingDone = s.healingDone;
            this.selfHealing = s.selfHealing;
            this.kills = s.kills;
            this.abilitiesUsed = s.abilitiesUsed;
            this.corruptionsPerformed = s.corruptionsPerformed;
            this.timesRevived = s.timesRevived;
        }

        @Override
        public String toString() {
            return String.format("Stats[dealt=%d (adversary %d), taken=%d, healed=%d, kills=%d]",
                    damageDealt, damageToAdversary, damageTaken, healingDone, kills);
        }
    }
}
