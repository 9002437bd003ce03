package com.example.covenant.config;

import com.example.covenant.effect.EffectDefinition;
import com.example.covenant.effect.EffectRegistry;
import com.example.covenant.model.Ability;
import com.example.covenant.model.AbilityCategory;
import com.example.covenant.model.AbilityCatalog;
import com.example.covenant.model.TargetShape;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the ability catalog and status effect registry from YAML resources.
 *
 * Every ability must reference a registered effect (if any) and declare a known category and
 * target shape; anything else is a {@link ConfigurationException}. A priority outside the
 * category's expected band is only logged, since designers move abilities between bands on purpose.
 */
public class CatalogLoader {

    private static final Logger logger = LoggerFactory.getLogger(CatalogLoader.class);

    public static final String DEFAULT_EFFECTS = "/data/status-effects.yaml";
    public static final String DEFAULT_ABILITIES = "/data/abilities.yaml";

    public static EffectRegistry loadDefaultEffects() {
        return loadEffects(open(DEFAULT_EFFECTS), DEFAULT_EFFECTS);
    }

    public static AbilityCatalog loadDefaultAbilities(GameBalance balance, EffectRegistry effects) {
        return loadAbilities(open(DEFAULT_ABILITIES), DEFAULT_ABILITIES, balance, effects);
    }

    public static EffectRegistry loadEffects(InputStream in, String source) {
        List<EffectDefinition> defs = new ArrayList<>();
        for (ConfigSection e : readList(in, source, "effects")) {
            String id = e.getString("id");
            EffectDefinition.Type type = parseEnum(EffectDefinition.Type.class, e.getString("type"), e, "type");
            Set<EffectDefinition.Flag> flags = EnumSet.noneOf(EffectDefinition.Flag.class);
            Object rawFlags = e.raw().get("flags");
            if (rawFlags instanceof List) {
                for (Object f : (List<?>) rawFlags) {
                    flags.add(parseEnum(EffectDefinition.Flag.class, String.valueOf(f), e, "flags"));
                }
            } else if (rawFlags != null) {
                throw new ConfigurationException("Setting '" + e.getPath() + ".flags' must be a list");
            }
            int duration = e.getInt("duration");
            if (duration == 0 || duration < EffectDefinition.PERMANENT) {
                throw new ConfigurationException("Effect '" + id + "' duration must be positive or -1");
            }
            defs.add(new EffectDefinition(id, e.getString("name", id), type,
                    e.getBoolean("stackable", false), e.getBoolean("refreshable", true),
                    duration, e.getInt("priority"),
                    e.getOptionalSection("magnitude").asDoubleMap(), flags));
        }
        try {
            EffectRegistry registry = EffectRegistry.withDefaultHandlers(defs);
            logger.info("Loaded {} status effect(s) from {}", defs.size(), source);
            return registry;
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(source + ": " + ex.getMessage(), ex);
        }
    }

    public static AbilityCatalog loadAbilities(InputStream in, String source, GameBalance balance,
                                               EffectRegistry effects) {
        List<Ability> list = new ArrayList<>();
        GameBalance.PriorityBands bands = balance.getPriorityBands();
        for (ConfigSection a : readList(in, source, "abilities")) {
            String id = a.getString("id");
            AbilityCategory category = parseEnum(AbilityCategory.class, a.getString("category"), a, "category");
            TargetShape shape = parseEnum(TargetShape.class, a.getString("target"), a, "target");
            int priority = a.getInt("priority");
            int cooldown = a.getInt("cooldown", 0);
            if (cooldown < 0) {
                throw new ConfigurationException("Ability '" + id + "' cooldown must not be negative");
            }
            Integer override = balance.getCooldownOverride(id);
            if (override != null) {
                logger.debug("Cooldown override for {}: {} -> {}", id, cooldown, override);
                cooldown = override;
            }
            String effectId = a.getString("effect", null);
            if (effectId != null && !effects.contains(effectId)) {
                throw new ConfigurationException("Ability '" + id + "' references unknown effect '" + effectId + "'");
            }
            if (!bands.isWithinExpectedBand(category, priority)) {
                logger.warn("Ability {} priority {} is outside the {} band for {}", id, priority,
                        bands.expectedBand(category), category);
            }
            list.add(new Ability(id, a.getString("name", id), category, shape,
                    a.getOptionalSection("params").asDoubleMap(), priority, cooldown, effectId));
        }
        try {
            AbilityCatalog catalog = new AbilityCatalog(list);
            logger.info("Loaded {} abilities from {}", catalog.size(), source);
            return catalog;
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(source + ": " + ex.getMessage(), ex);
        }
    }

    private static InputStream open(String resource) {
        InputStream is = CatalogLoader.class.getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Catalog resource not found: " + resource);
        }
        return is;
    }

    @SuppressWarnings("unchecked")
    private static List<ConfigSection> readList(InputStream in, String source, String key) {
        Object doc;
        try (InputStream is = in) {
            doc = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException(source + " is not valid YAML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + source, e);
        }
        if (!(doc instanceof Map) || !(((Map<String, Object>) doc).get(key) instanceof List)) {
            throw new ConfigurationException(source + " must contain a '" + key + "' list");
        }
        List<ConfigSection> out = new ArrayList<>();
        int i = 0;
        for (Object item : (List<Object>) ((Map<String, Object>) doc).get(key)) {
            if (!(item instanceof Map)) {
                throw new ConfigurationException(source + ": entry " + i + " of '" + key + "' is not a mapping");
            }
            out.add(new ConfigSection(key + "[" + i + "]", (Map<String, Object>) item));
            i++;
        }
        return out;
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, ConfigSection section, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Setting '" + section.getPath() + "." + key + "' has unknown value '"
                    + value + "'", e);
        }
    }
}
