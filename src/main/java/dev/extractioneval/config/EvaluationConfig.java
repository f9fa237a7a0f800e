package dev.extractioneval.config;

import java.util.HashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Settings of an evaluation session with sane defaults.
 *
 * <p>Values come from environment variables unless overridden during construction.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
@ToString
public final class EvaluationConfig extends BaseConfig {
    /** weight of a top-level field that has no entry in the weight table */
    private final double defaultWeight = getConfig("EXTRACTION_EVAL_DEFAULT_WEIGHT", 1.0);

    /** weight of a line-item sub-field without an entry when scoring item similarity */
    private final double itemDefaultWeight = getConfig("EXTRACTION_EVAL_ITEM_DEFAULT_WEIGHT", 1.0);

    /** minimum shared-word ratio for two item names to be considered the same */
    private final double nameTokenRatio = getConfig("EXTRACTION_EVAL_NAME_TOKEN_RATIO", 0.5);

    /** similarity at or above which the aggregate items metric counts as correct */
    private final double itemsPassThreshold =
            getConfig("EXTRACTION_EVAL_ITEMS_PASS_THRESHOLD", 0.8);

    /** weight of the aggregate items metric */
    private final double itemsBaseWeight = getConfig("EXTRACTION_EVAL_ITEMS_BASE_WEIGHT", 5.0);

    public static EvaluationConfig fromEnvironment() {
        return of();
    }

    public static EvaluationConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new ConfigurationException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new EvaluationConfig(overridesMap);
    }

    private EvaluationConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        requireWeight("EXTRACTION_EVAL_DEFAULT_WEIGHT", defaultWeight);
        requireWeight("EXTRACTION_EVAL_ITEM_DEFAULT_WEIGHT", itemDefaultWeight);
        requireWeight("EXTRACTION_EVAL_ITEMS_BASE_WEIGHT", itemsBaseWeight);
        requireRatio("EXTRACTION_EVAL_NAME_TOKEN_RATIO", nameTokenRatio);
        requireRatio("EXTRACTION_EVAL_ITEMS_PASS_THRESHOLD", itemsPassThreshold);
    }

    private static void requireWeight(String key, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new ConfigurationException(
                    "%s must be a non-negative number: %s".formatted(key, value));
        }
    }

    private static void requireRatio(String key, double value) {
        if (!(value > 0.0 && value <= 1.0)) {
            throw new ConfigurationException(
                    "%s must be in (0, 1]: %s".formatted(key, value));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder defaultWeight(double value) {
            envOverrides.put("EXTRACTION_EVAL_DEFAULT_WEIGHT", String.valueOf(value));
            return this;
        }

        public Builder itemDefaultWeight(double value) {
            envOverrides.put("EXTRACTION_EVAL_ITEM_DEFAULT_WEIGHT", String.valueOf(value));
            return this;
        }

        public Builder nameTokenRatio(double value) {
            envOverrides.put("EXTRACTION_EVAL_NAME_TOKEN_RATIO", String.valueOf(value));
            return this;
        }

        public Builder itemsPassThreshold(double value) {
            envOverrides.put("EXTRACTION_EVAL_ITEMS_PASS_THRESHOLD", String.valueOf(value));
            return this;
        }

        public Builder itemsBaseWeight(double value) {
            envOverrides.put("EXTRACTION_EVAL_ITEMS_BASE_WEIGHT", String.valueOf(value));
            return this;
        }

        public EvaluationConfig build() {
            return new EvaluationConfig(envOverrides);
        }
    }
}
