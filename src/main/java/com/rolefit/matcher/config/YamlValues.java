package com.rolefit.matcher.config;

import java.util.Map;

/**
 * Typed reads from a parsed YAML tree. A value of the wrong type raises
 * {@link ConfigException} naming the offending key.
 */
final class YamlValues {

    private YamlValues() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> root(Object document, String source) {
        if (document == null) {
            return null;
        }
        if (!(document instanceof Map)) {
            throw new ConfigException("Configuration file " + source + " must contain a mapping at the top level");
        }
        return (Map<String, Object>) document;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> section(Map<String, Object> parent, String key, String path) {
        Object value = parent.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw invalid(path, key, "a mapping", value);
        }
        return (Map<String, Object>) value;
    }

    static int intValue(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof Number)) {
            throw invalid(path, key, "a number", value);
        }
        return ((Number) value).intValue();
    }

    static double doubleValue(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof Number)) {
            throw invalid(path, key, "a number", value);
        }
        return ((Number) value).doubleValue();
    }

    static String string(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (value != null && !(value instanceof String)) {
            throw invalid(path, key, "a string", value);
        }
        return (String) value;
    }

    static boolean bool(Map<String, Object> map, String key, String path) {
        Object value = map.get(key);
        if (!(value instanceof Boolean)) {
            throw invalid(path, key, "true or false", value);
        }
        return (Boolean) value;
    }

    private static ConfigException invalid(String path, String key, String expected, Object value) {
        String name = path == null || path.isEmpty() ? key : path + "." + key;
        return new ConfigException("Configuration key '" + name + "' must be " + expected + ", got: " + value);
    }
}
