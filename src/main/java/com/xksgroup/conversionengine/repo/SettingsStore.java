package com.xksgroup.conversionengine.repo;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;

/**
 * Flat key to string settings with typed accessors. Malformed stored values fall back
 * to the supplied default.
 */
public interface SettingsStore {

    Optional<String> get(String key);

    void put(String key, String value);

    Map<String, String> all();

    default String getString(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        return get(key)
                .map(String::trim)
                .filter(value -> value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"))
                .map(Boolean::parseBoolean)
                .orElse(defaultValue);
    }

    default int getInt(String key, int defaultValue) {
        return get(key).map(value -> Parsing.parse(key, value, Integer::parseInt, defaultValue)).orElse(defaultValue);
    }

    default long getLong(String key, long defaultValue) {
        return get(key).map(value -> Parsing.parse(key, value, Long::parseLong, defaultValue)).orElse(defaultValue);
    }

    default double getDouble(String key, double defaultValue) {
        return get(key).map(value -> Parsing.parse(key, value, Double::parseDouble, defaultValue)).orElse(defaultValue);
    }

    @Slf4j
    final class Parsing {

        private Parsing() {
        }

        static <T> T parse(String key, String raw, java.util.function.Function<String, T> parser, T defaultValue) {
            try {
                return parser.apply(raw.trim());
            } catch (NumberFormatException e) {
                log.warn("Setting {} has malformed value '{}', using default {}", key, raw, defaultValue);
                return defaultValue;
            }
        }
    }
}
