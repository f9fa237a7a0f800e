package dev.extractioneval.config;

import java.util.HashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Reads settings from environment variables, with explicit overrides taking precedence.
 *
 * <p>An override equal to {@link #NULL_OVERRIDE} hides the environment variable of the same name.
 */
abstract class BaseConfig {
    static final String NULL_OVERRIDE = "__EXTRACTION_EVAL_NULL__";

    private final Map<String, String> envOverrides;

    BaseConfig(@Nonnull Map<String, String> envOverrides) {
        this.envOverrides = new HashMap<>(envOverrides);
    }

    @Nullable
    private String lookup(String key) {
        if (envOverrides.containsKey(key)) {
            var value = envOverrides.get(key);
            return NULL_OVERRIDE.equals(value) ? null : value;
        }
        return System.getenv(key);
    }

    @Nullable
    <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        return convert(key, value, type);
    }

    double getConfig(String key, double defaultValue) {
        return getConfig(key, defaultValue, Double.class);
    }

    private static <T> T convert(String key, String value, Class<T> type) {
        try {
            if (type == String.class) {
                return type.cast(value);
            } else if (type == Boolean.class) {
                return type.cast(Boolean.parseBoolean(value.strip()));
            } else if (type == Double.class) {
                return type.cast(Double.parseDouble(value.strip()));
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    "invalid value for %s: '%s'".formatted(key, value), e);
        }
        throw new ConfigurationException(
                "unsupported config type for %s: %s".formatted(key, type.getName()));
    }
}
