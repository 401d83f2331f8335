package com.nestack.mailqueue.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Map backed configuration container with type safe accessors.
 *
 * <p>Keys may address nested maps using dot notation, e.g. {@code cron.intervalSeconds}.
 * <p>Numbers parsed from JSON arrive as doubles and are narrowed by the accessors.
 */
@SuppressWarnings("unchecked")
public class BasicConfig {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new BasicConfig instance.
     */
    public BasicConfig() {
        // Empty map.
    }

    /**
     * Constructs a new BasicConfig instance with configuration map.
     *
     * @param map Configuration map.
     */
    public BasicConfig(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return resolve(name) != null;
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets string property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = resolve(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets long property.
     *
     * @param name Property name.
     * @return Long or null.
     */
    public Long getLongProperty(String name) {
        return getLongProperty(name, null);
    }

    /**
     * Gets long property with default.
     * <p>Accepts numeric values and numeric strings.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = resolve(name);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String string) {
            try {
                return (long) Double.parseDouble(string.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Property " + name + " is not numeric: " + string, e);
            }
        }
        return defaultValue;
    }

    /**
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean, false if missing.
     */
    public boolean getBooleanProperty(String name) {
        return getBooleanProperty(name, false);
    }

    /**
     * Gets boolean property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = resolve(name);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            return Boolean.parseBoolean(string.trim());
        }
        return defaultValue;
    }

    /**
     * Gets list property.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = resolve(name);
        return value instanceof List ? (List<Object>) value : new ArrayList<>();
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = resolve(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    /**
     * Resolves a property by exact key first, then by walking dotted segments.
     *
     * @param name Property name.
     * @return Value or null.
     */
    private Object resolve(String name) {
        if (name == null) {
            return null;
        }
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String segment : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(segment);
        }
        return current;
    }
}
