package com.example.covenant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads {@link GameBalance} from YAML.
 *
 * The bundled defaults live at {@value #DEFAULT_RESOURCE}. Callers can layer overrides on top
 * using dotted keys, e.g. {@code "variance.critChance" -> 0.0}.
 */
public class GameBalanceLoader {

    private static final Logger logger = LoggerFactory.getLogger(GameBalanceLoader.class);

    public static final String DEFAULT_RESOURCE = "/config/game-balance.yaml";

    public static GameBalance loadDefaults() {
        return loadDefaults(Collections.emptyMap());
    }

    public static GameBalance loadDefaults(Map<String, ?> overrides) {
        return loadResource(DEFAULT_RESOURCE, overrides);
    }

    public static GameBalance loadResource(String resourcePath, Map<String, ?> overrides) {
        try (InputStream is = GameBalanceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new ConfigurationException("Balance resource not found: " + resourcePath);
            }
            return load(is, overrides);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read balance resource " + resourcePath, e);
        }
    }

    public static GameBalance load(InputStream in, Map<String, ?> overrides) {
        Map<String, Object> root = parse(in);
        if (overrides != null) {
            for (Map.Entry<String, ?> e : overrides.entrySet()) {
                applyOverride(root, e.getKey(), e.getValue());
            }
        }
        GameBalance balance = new GameBalance(new ConfigSection("", root));
        logger.info("Loaded game balance ({} override(s))", overrides == null ? 0 : overrides.size());
        return balance;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> parse(InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new ConfigurationException("Balance file is not valid YAML: " + e.getMessage(), e);
        }
        if (!(doc instanceof Map)) {
            throw new ConfigurationException("Balance file must contain a mapping at the top level");
        }
        return new LinkedHashMap<>((Map<String, Object>) doc);
    }

    @SuppressWarnings("unchecked")
    private static void applyOverride(Map<String, Object> root, String dottedKey, Object value) {
        String[] parts = dottedKey.split("\\.");
        Map<String, Object> current = root;
        for (int i = 0; i < parts.length - 1; i++) {
            Object child = current.get(parts[i]);
            Map<String, Object> next;
            if (child instanceof Map) {
                next = new LinkedHashMap<>((Map<String, Object>) child);
            } else {
                next = new LinkedHashMap<>();
            }
            current.put(parts[i], next);
            current = next;
        }
        current.put(parts[parts.length - 1], value);
        logger.debug("Balance override {} = {}", dottedKey, value);
    }
}
