package com.example.covenant.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable ability definition from the catalog.
 *
 * Numeric parameters live in a bag keyed by name ({@code damage}, {@code heal}, {@code armor},
 * {@code duration}, {@code chance}, {@code effectDamage}, {@code effectAmount}); missing keys read as
 * their default. Priority is ascending: lower values resolve earlier in the round.
 */
public class Ability {

    public static final String PARAM_DAMAGE = "damage";
    public static final String PARAM_HEAL = "heal";
    public static final String PARAM_ARMOR = "armor";
    public static final String PARAM_DURATION = "duration";
    public static final String PARAM_CHANCE = "chance";
    public static final String PARAM_EFFECT_DAMAGE = "effectDamage";
    public static final String PARAM_EFFECT_AMOUNT = "effectAmount";
    public static final String PARAM_INCLUDE_ADVERSARY = "includeAdversary";

    private final String id;
    private final String name;
    private final AbilityCategory category;
    private final TargetShape targetShape;
    private final Map<String, Double> params;
    private final int priority;
    private final int cooldown; // rounds, 0 means usable every round
    private final String effectId; // status effect applied on resolution, may be null

    public Ability(String id, String name, AbilityCategory category, TargetShape targetShape,
                   Map<String, Double> params, int priority, int cooldown, String effectId) {
        this.id = id;
        this.name = name != null ? name : id;
        this.category = category;
        this.targetShape = targetShape;
        this.params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Collections.emptyMap();
        this.priority = priority;
        this.cooldown = Math.max(0, cooldown);
        this.effectId = effectId;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public AbilityCategory getCategory() { return category; }
    public TargetShape getTargetShape() { return targetShape; }
    public Map<String, Double> getParams() { return params; }
    public int getPriority() { return priority; }
    public int getCooldown() { return cooldown; }
    public String getEffectId() { return effectId; }

    public double getParam(String key, double defaultValue) {
        Double v = params.get(key);
        return v != null ? v : defaultValue;
    }

    public boolean hasParam(String key) {
        return params.containsKey(key);
    }

    public double getDamage() { return getParam(PARAM_DAMAGE, 0); }
    public double getHeal() { return getParam(PARAM_HEAL, 0); }

    /**
     * Area attacks also strike the adversary unless {@code includeAdversary} is 0.
     */
    public boolean includesAdversary() { return getParam(PARAM_INCLUDE_ADVERSARY, 1) != 0; }

    public boolean hasCooldown() { return cooldown > 0; }
    public boolean hasEffect() { return effectId != null && !effectId.isEmpty(); }
    public boolean isAttack() { return category == AbilityCategory.ATTACK; }
    public boolean isHeal() { return category == AbilityCategory.HEAL; }

    /**
     * Copy of this ability with a different cooldown (used for balance overrides).
     */
    public Ability withCooldown(int newCooldown) {
        return new Ability(id, name, category, targetShape, params, priority, newCooldown, effectId);
    }

    @Override
    public String toString() {
        return String.format("Ability[%s %s/%s prio=%d cd=%d]", id, category, targetShape, priority, cooldown);
    }
}
