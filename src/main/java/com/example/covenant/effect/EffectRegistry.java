package com.example.covenant.effect;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only lookup of effect definitions and the handler for each effect type.
 * Built once at startup and shared by every session.
 */
public class EffectRegistry {

    private final Map<String, EffectDefinition> defs;
    private final Map<EffectDefinition.Type, EffectHandler> handlers;

    public EffectRegistry(Collection<EffectDefinition> definitions, Map<EffectDefinition.Type, EffectHandler> handlers) {
        Map<String, EffectDefinition> byId = new LinkedHashMap<>();
        for (EffectDefinition def : definitions) {
            if (byId.put(def.getId(), def) != null) {
                throw new IllegalArgumentException("Duplicate effect id: " + def.getId());
            }
        }
        this.defs = Collections.unmodifiableMap(byId);
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(handlers));
        for (EffectDefinition def : byId.values()) {
            if (!this.handlers.containsKey(def.getType())) {
                throw new IllegalArgumentException("No handler for effect type " + def.getType() + " (" + def.getId() + ")");
            }
        }
    }

    /**
     * Registry wired with the stock handler for every effect type.
     */
    public static EffectRegistry withDefaultHandlers(Collection<EffectDefinition> definitions) {
        return new EffectRegistry(definitions, defaultHandlers());
    }

    public static Map<EffectDefinition.Type, EffectHandler> defaultHandlers() {
        Map<EffectDefinition.Type, EffectHandler> h = new EnumMap<>(EffectDefinition.Type.class);
        h.put(EffectDefinition.Type.DOT, new DotEffect());
        h.put(EffectDefinition.Type.HEAL_OVER_TIME, new HealOverTimeEffect());
        h.put(EffectDefinition.Type.ARMOR, new ArmorEffect());
        h.put(EffectDefinition.Type.MODIFIER, new ModifierEffect());
        h.put(EffectDefinition.Type.CONTROL, new ControlEffect());
        h.put(EffectDefinition.Type.STONE_ARMOR, new StoneArmorEffect());
        h.put(EffectDefinition.Type.UNDYING, new UndyingEffect());
        h.put(EffectDefinition.Type.LIFE_BOND, new LifeBondEffect());
        return h;
    }

    public EffectDefinition getDefinition(String id) { return defs.get(id); }

    public boolean contains(String id) { return defs.containsKey(id); }

    public Collection<EffectDefinition> getDefinitions() { return defs.values(); }

    public EffectHandler getHandler(EffectDefinition def) {
        return def == null ? null : handlers.get(def.getType());
    }
}
