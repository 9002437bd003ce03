package com.example.covenant.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view over one nested map of a parsed YAML document.
 * Every accessor fails with a {@link ConfigurationException} naming the full dotted path
 * when the key is missing or has the wrong type.
 */
public class ConfigSection {

    private final String path;
    private final Map<String, Object> values;

    public ConfigSection(String path, Map<String, Object> values) {
        this.path = path;
        this.values = values != null ? values : Collections.emptyMap();
    }

    public String getPath() { return path; }

    public boolean has(String key) {
        return values.containsKey(key) && values.get(key) != null;
    }

    public double getDouble(String key) {
        Object v = require(key);
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        throw malformed(key, "a number", v);
    }

    public double getDouble(String key, double defaultValue) {
        return has(key) ? getDouble(key) : defaultValue;
    }

    public int getInt(String key) {
        Object v = require(key);
        if (v instanceof Integer || v instanceof Long) {
            return ((Number) v).intValue();
        }
        throw malformed(key, "an integer", v);
    }

    public int getInt(String key, int defaultValue) {
        return has(key) ? getInt(key) : defaultValue;
    }

    public boolean getBoolean(String key) {
        Object v = require(key);
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        throw malformed(key, "true or false", v);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return has(key) ? getBoolean(key) : defaultValue;
    }

    public String getString(String key) {
        Object v = require(key);
        if (v instanceof String) {
            return (String) v;
        }
        throw malformed(key, "a string", v);
    }

    public String getString(String key, String defaultValue) {
        return has(key) ? getString(key) : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public ConfigSection getSection(String key) {
        Object v = require(key);
        if (v instanceof Map) {
            return new ConfigSection(childPath(key), (Map<String, Object>) v);
        }
        throw malformed(key, "a mapping", v);
    }

    /**
     * Like {@link #getSection(String)} but yields an empty section when the key is absent.
     */
    public ConfigSection getOptionalSection(String key) {
        if (!has(key)) {
            return new ConfigSection(childPath(key), Collections.emptyMap());
        }
        return getSection(key);
    }

    /**
     * Numeric entries of this section, in document order.
     */
    public Map<String, Double> asDoubleMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (!(e.getValue() instanceof Number)) {
                throw malformed(e.getKey(), "a number", e.getValue());
            }
            out.put(e.getKey(), ((Number) e.getValue()).doubleValue());
        }
        return out;
    }

    public Map<String, Object> raw() {
        return Collections.unmodifiableMap(values);
    }

    private Object require(String key) {
        Object v = values.get(key);
        if (v == null) {
            throw new ConfigurationException("Missing required setting '" + childPath(key) + "'");
        }
        return v;
    }

    private ConfigurationException malformed(String key, String expected, Object actual) {
        return new ConfigurationException("Setting '" + childPath(key) + "' must be " + expected
                + " but was '" + actual + "'");
    }

    private String childPath(String key) {
        return path.isEmpty() ? key : path + "." + key;
    }
}
