package com.mimecast.directoryauth.config;

import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Wraps a map of configuration values and provides type safe accessors with defaults.
 * <p>Keys may be dotted paths into nested maps (e.g. <code>sql.jdbcUrl</code>).
 * A literal key containing dots takes precedence over the nested lookup.
 *
 * <p>Files are JSON5 flavoured: comments, unquoted keys and single quotes are accepted.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new empty ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance from a map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = new HashMap<>(map);
        }
    }

    /**
     * Constructs a new ConfigFoundation instance from a file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        try (Reader reader = Files.newBufferedReader(Path.of(path), StandardCharsets.UTF_8)) {
            Map<String, Object> parsed = new GsonBuilder()
                    .setLenient()
                    .create()
                    .fromJson(reader, new TypeToken<Map<String, Object>>() {}.getType());
            if (parsed != null) {
                this.map = parsed;
            }
        }
    }

    /**
     * Gets the underlying map.
     *
     * @return Unmodifiable map.
     */
    public Map<String, Object> getMap() {
        return Collections.unmodifiableMap(map);
    }

    /**
     * Checks if a property is present.
     *
     * @param key Property key.
     * @return True if present.
     */
    public boolean hasProperty(String key) {
        return lookup(key) != null;
    }

    /**
     * Gets a string property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return String value.
     */
    public String getStringProperty(String key, String defaultValue) {
        Object value = lookup(key);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets a string property.
     *
     * @param key Property key.
     * @return String value or null.
     */
    public String getStringProperty(String key) {
        return getStringProperty(key, null);
    }

    /**
     * Gets a long property.
     * <p>Numbers parsed from files arrive as doubles and are truncated.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Long value.
     */
    public Long getLongProperty(String key, Long defaultValue) {
        Object value = lookup(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets a double property.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Double value.
     */
    public Double getDoubleProperty(String key, Double defaultValue) {
        Object value = lookup(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets a boolean property.
     * <p>Accepts booleans, "true"/"false" strings and non-zero numbers.
     *
     * @param key          Property key.
     * @param defaultValue Default value.
     * @return Boolean value.
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        Object value = lookup(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * Gets a boolean property defaulting to false.
     *
     * @param key Property key.
     * @return Boolean value.
     */
    public boolean getBooleanProperty(String key) {
        return getBooleanProperty(key, false);
    }

    /**
     * Gets a map property.
     *
     * @param key Property key.
     * @return Map value or empty map.
     */
    public Map<String, Object> getMapProperty(String key) {
        Object value = lookup(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }

    /**
     * Gets a list property.
     *
     * @param key Property key.
     * @return List value or empty list.
     */
    public List<Object> getListProperty(String key) {
        Object value = lookup(key);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        return new ArrayList<>();
    }

    /**
     * Keeps only the properties under the given namespace.
     * <p>Both nested maps (<code>{auth: {backend: ...}}</code>) and flat dotted keys
     * (<code>{"auth.backend": ...}</code>) are collected, with the prefix stripped.
     *
     * @param namespace Namespace name.
     * @return Filtered properties map.
     */
    public Map<String, Object> filter(String namespace) {
        Map<String, Object> params = new HashMap<>();
        Object nested = map.get(namespace);
        if (nested instanceof Map) {
            params.putAll((Map<String, Object>) nested);
        }

        String prefix = namespace + ".";
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            if (entry.getKey().startsWith(prefix) && entry.getKey().length() > prefix.length()) {
                params.put(entry.getKey().substring(prefix.length()), entry.getValue());
            }
        }
        return params;
    }

    /**
     * Resolves a key, first literally, then as a dotted path.
     *
     * @param key Property key.
     * @return Value or null.
     */
    private Object lookup(String key) {
        if (key == null) {
            return null;
        }
        if (map.containsKey(key)) {
            return map.get(key);
        }
        if (!key.contains(".")) {
            return null;
        }

        Object current = map;
        for (String part : key.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
            if (current == null) {
                return null;
            }
        }
        return current;
    }
}
