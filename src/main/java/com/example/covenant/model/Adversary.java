package com.example.covenant.model;

/**
 * The shared hostile entity. Its age counts rounds survived and drives its damage.
 */
public class Adversary {

    /** Target id used by actions aimed at the adversary */
    public static final String ID = "adversary";

    private final String name;
    private int level;
    private int maxHp;
    private int hp;
    private int age;

    public Adversary(String name, int level, int maxHp, int age) {
        this.name = name != null ? name : "Adversary";
        this.level = Math.max(1, level);
        this.maxHp = Math.max(1, maxHp);
        this.hp = this.maxHp;
        this.age = Math.max(0, age);
    }

    public String getName() { return name; }
    public int getLevel() { return level; }
    public int getMaxHp() { return maxHp; }
    public int getHp() { return hp; }
    public int getAge() { return age; }

    public boolean isAlive() { return hp > 0; }

    public void setHp(int value) {
        this.hp = Math.max(0, Math.min(maxHp, value));
    }

    /**
     * Clamp-subtract damage.
     * @return the hp actually removed
     */
    public int takeDamage(int amount) {
        if (amount <= 0 || hp <= 0) return 0;
        int before = hp;
        hp = Math.max(0, hp - amount);
        return before - hp;
    }

    public void incrementAge() {
        age++;
    }

    /**
     * Come back one level higher, fully healed and young again.
     */
    public void respawn(int newMaxHp) {
        level++;
        maxHp = Math.max(1, newMaxHp);
        hp = maxHp;
        age = 0;
    }

    @Override
    public String toString() {
        return String.format("%s[L%d %d/%d hp, age %d]", name, level, hp, maxHp, age);
    }
}
