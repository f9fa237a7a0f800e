package dev.extractioneval.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.extractioneval.json.EvalJsonMapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Field weights of an evaluation.
 *
 * <p>Read from a {@code field_weights} document such as:
 *
 * <pre>{@code
 * {
 *   "default_weight": 1.0,
 *   "total_price": 3,
 *   "items": {"name": 2, "price": 2, "default_weight": 0.5}
 * }
 * }</pre>
 *
 * The nested {@code items} object is flattened to {@code items.<sub-field>} keys. Flat {@code
 * items.<sub-field>} keys are accepted as well; the nested form wins when both are given.
 */
@EqualsAndHashCode
@ToString
public final class WeightTable {
    public static final String DEFAULT_WEIGHT_KEY = "default_weight";
    private static final String ITEMS_KEY = "items";
    private static final String ITEM_PREFIX = ITEMS_KEY + ".";
    private static final String ITEM_DEFAULT_KEY = ITEM_PREFIX + DEFAULT_WEIGHT_KEY;

    private final Map<String, Double> weights;
    private final double defaultWeight;
    private final @Nullable Double itemDefaultWeight;

    private WeightTable(Map<String, Double> weights, double defaultWeight) {
        var copy = new LinkedHashMap<>(weights);
        this.itemDefaultWeight = copy.remove(ITEM_DEFAULT_KEY);
        this.weights = Collections.unmodifiableMap(copy);
        this.defaultWeight = defaultWeight;
    }

    /** A table from already flattened weights. */
    public static WeightTable of(@Nonnull Map<String, Double> weights, double defaultWeight) {
        var checked = new LinkedHashMap<String, Double>();
        weights.forEach((field, weight) -> checked.put(field, requireWeight(field, weight)));
        return new WeightTable(checked, requireWeight(DEFAULT_WEIGHT_KEY, defaultWeight));
    }

    /**
     * Parse a {@code field_weights} JSON document.
     *
     * @throws ConfigurationException if the document is malformed or a weight is invalid
     */
    public static WeightTable fromJson(@Nonnull String json, double fallbackDefaultWeight) {
        Map<String, Object> document;
        try {
            document = EvalJsonMapper.readObject(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("malformed weight table: " + e.getMessage(), e);
        }
        return fromDocument(document, fallbackDefaultWeight);
    }

    /** Build a table from a parsed {@code field_weights} document. */
    public static WeightTable fromDocument(
            @Nonnull Map<String, ?> document, double fallbackDefaultWeight) {
        var flat = new LinkedHashMap<String, Double>();
        var nestedItems = new LinkedHashMap<String, Double>();
        double defaultWeight = fallbackDefaultWeight;
        for (var entry : document.entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue();
            if (DEFAULT_WEIGHT_KEY.equals(key)) {
                defaultWeight = toWeight(key, value);
            } else if (ITEMS_KEY.equals(key) && value instanceof Map<?, ?> items) {
                for (var item : items.entrySet()) {
                    var itemKey = ITEM_PREFIX + item.getKey();
                    nestedItems.put(itemKey, toWeight(itemKey, item.getValue()));
                }
            } else {
                flat.put(key, toWeight(key, value));
            }
        }
        flat.putAll(nestedItems);
        return new WeightTable(flat, requireWeight(DEFAULT_WEIGHT_KEY, defaultWeight));
    }

    private static double toWeight(String key, Object value) {
        if (value instanceof Number number) {
            return requireWeight(key, number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return requireWeight(key, Double.parseDouble(text.strip()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(
                        "weight of %s is not a number: '%s'".formatted(key, text), e);
            }
        }
        throw new ConfigurationException(
                "weight of %s is not a number: %s".formatted(key, value));
    }

    private static double requireWeight(String key, Double weight) {
        if (weight == null || !Double.isFinite(weight) || weight < 0) {
            throw new ConfigurationException(
                    "weight of %s must be a non-negative number: %s".formatted(key, weight));
        }
        return weight;
    }

    /** Flattened weights, without the default entries. */
    public Map<String, Double> weights() {
        return weights;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    public double weightOf(String field) {
        return weights.getOrDefault(field, defaultWeight);
    }

    /** Line-item sub-field weights with the {@code items.} prefix removed. */
    public Map<String, Double> itemFieldWeights() {
        var result = new LinkedHashMap<String, Double>();
        for (var entry : weights.entrySet()) {
            if (entry.getKey().startsWith(ITEM_PREFIX)) {
                result.put(entry.getKey().substring(ITEM_PREFIX.length()), entry.getValue());
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /** Weight of line-item sub-fields missing from the table, when one is configured. */
    public Optional<Double> itemDefaultWeight() {
        return Optional.ofNullable(itemDefaultWeight);
    }
}
