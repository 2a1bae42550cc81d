package com.mimecast.outpost.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.Strictness;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * Configuration foundation.
 *
 * <p>Holds a configuration map read from a JSON5 file and provides type safe accessors with defaults.
 * <p>Files are parsed with Gson in lenient mode so comments, unquoted keys and single quoted strings are accepted.
 * <p>Numbers come out of Gson as doubles and are narrowed by the accessors.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {

    /**
     * Lenient Gson instance used for JSON5 files.
     */
    private static final Gson GSON = new GsonBuilder()
            .setStrictness(Strictness.LENIENT)
            .create();

    /**
     * Map type token.
     */
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        this.map = readFile(Paths.get(path));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Map instance, never null.
     * @throws IOException Unable to read file.
     */
    public static Map<String, Object> readFile(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Map<String, Object> parsed = GSON.fromJson(reader, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse configuration file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON5 string into a map.
     *
     * @param json JSON5 string.
     * @return Map instance, never null.
     */
    public static Map<String, Object> parse(String json) {
        Map<String, Object> parsed = GSON.fromJson(json, MAP_TYPE);
        return parsed != null ? parsed : new HashMap<>();
    }

    /**
     * Gets the underlying map.
     *
     * @return Map.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name) && map.get(name) != null;
    }

    /**
     * Gets property raw value.
     *
     * @param name Property name.
     * @return Object or null.
     */
    public Object getProperty(String name) {
        return map.get(name);
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
        Object value = map.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Double && ((Double) value) == Math.rint((Double) value)) {
            return String.valueOf(((Double) value).longValue());
        }
        return String.valueOf(value);
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
     * <p>String values are parsed, unparseable ones yield the default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long defaultValue) {
        Object value = map.get(name);
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
     * Gets boolean property.
     *
     * @param name Property name.
     * @return Boolean.
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
        Object value = map.get(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        return defaultValue;
    }

    /**
     * Gets map property.
     *
     * @param name Property name.
     * @return Map, empty if missing or not a map.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = map.get(name);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return new HashMap<>();
    }

    /**
     * Gets list property.
     * <p>A scalar value is returned as a single element list.
     *
     * @param name Property name.
     * @return List, empty if missing.
     */
    public List<Object> getListProperty(String name) {
        Object value = map.get(name);
        if (value instanceof List) {
            return (List<Object>) value;
        }
        if (value != null) {
            return new ArrayList<>(Collections.singletonList(value));
        }
        return new ArrayList<>();
    }
}
