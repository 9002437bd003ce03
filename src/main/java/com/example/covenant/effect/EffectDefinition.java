package com.example.covenant.effect;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable status effect type from the registry.
 *
 * The magnitude bag holds the type's default numbers ({@code damage}, {@code amount},
 * {@code armor}, {@code incomingPercent}, ...). Instances copy what they need at apply time, so
 * later registry edits never reach an effect that is already running.
 */
public class EffectDefinition {

    public enum Type { DOT, HEAL_OVER_TIME, ARMOR, MODIFIER, CONTROL, STONE_ARMOR, UNDYING, LIFE_BOND }

    public enum Flag {
        /** Owner cannot receive healing */
        BLOCKS_HEALING,
        /** Landing this effect wears down a decaying armor, unless the hit carrying it already did */
        TRIGGERS_SECONDARY_DECAY,
        /** This effect loses value each time its owner is hit */
        DEGRADES_ON_HIT,
        /** Owner skips its actions */
        PREVENTS_ACTIONS,
        /** Owner cannot be chosen as a target by attacks or the adversary */
        PREVENTS_TARGETING,
        /** Intercepts a pending death at round end */
        REVIVES,
        /** Part of the hidden protocol; its comings and goings are told only to its source */
        HIDDEN
    }

    /** Duration marker for effects that never count down */
    public static final int PERMANENT = -1;

    private final String id;
    private final String name;
    private final Type type;
    private final boolean stackable;
    private final boolean refreshable;
    private final int defaultDuration;
    private final int priority;
    private final Map<String, Double> magnitude;
    private final Set<Flag> flags;

    public EffectDefinition(String id, String name, Type type, boolean stackable, boolean refreshable,
                            int defaultDuration, int priority, Map<String, Double> magnitude, Set<Flag> flags) {
        this.id = id;
        this.name = name != null ? name : id;
        this.type = type;
        this.stackable = stackable;
        this.refreshable = refreshable;
        this.defaultDuration = defaultDuration;
        this.priority = priority;
        this.magnitude = magnitude != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(magnitude))
                : Collections.emptyMap();
        this.flags = flags == null || flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Flag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public Type getType() { return type; }
    public boolean isStackable() { return stackable; }
    public boolean isRefreshable() { return refreshable; }
    public int getDefaultDuration() { return defaultDuration; }
    public int getPriority() { return priority; }
    public Map<String, Double> getMagnitude() { return magnitude; }
    public Set<Flag> getFlags() { return flags; }

    public boolean hasFlag(Flag flag) { return flags.contains(flag); }
    public boolean isPermanent() { return defaultDuration == PERMANENT; }

    public double getMagnitude(String key, double defaultValue) {
        Double v = magnitude.get(key);
        return v != null ? v : defaultValue;
    }
}
