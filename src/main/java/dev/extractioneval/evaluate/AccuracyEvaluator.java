package dev.extractioneval.evaluate;

import dev.extractioneval.aggregate.ResultAggregator;
import dev.extractioneval.compare.ComparatorRegistry;
import dev.extractioneval.config.ConfigurationException;
import dev.extractioneval.config.WeightTable;
import dev.extractioneval.matching.ItemMatcher;
import dev.extractioneval.model.AlignedItems;
import dev.extractioneval.model.DocumentEvaluationResult;
import dev.extractioneval.model.FieldEvaluationResult;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Scores an extracted record against its expected record, field by field.
 *
 * <p>Every top-level field present on either side yields one result. The {@code items} list is
 * first aligned by the {@link ItemMatcher}; each aligned pair then yields one result per sub-field
 * seen on any item, named {@code items.<sub-field>} and tagged with the pair's position.
 *
 * <p>Instances hold no per-call state and can evaluate documents concurrently.
 */
@Slf4j
public final class AccuracyEvaluator {
    private static final String ITEM_PREFIX = ItemMatcher.ITEMS_FIELD + ".";

    private final @Nonnull ComparatorRegistry registry;
    private final @Nonnull ItemMatcher itemMatcher;
    private final @Nonnull Tracer tracer;

    public AccuracyEvaluator(
            @Nonnull ComparatorRegistry registry, @Nonnull ItemMatcher itemMatcher) {
        this(registry, itemMatcher, OpenTelemetry.noop().getTracer("extraction-eval"));
    }

    public AccuracyEvaluator(
            @Nonnull ComparatorRegistry registry,
            @Nonnull ItemMatcher itemMatcher,
            @Nonnull Tracer tracer) {
        this.registry = Objects.requireNonNull(registry);
        this.itemMatcher = Objects.requireNonNull(itemMatcher);
        this.tracer = Objects.requireNonNull(tracer);
    }

    public List<FieldEvaluationResult> evaluate(
            @Nonnull Map<String, Object> expected,
            @Nonnull Map<String, Object> actual,
            @Nonnull WeightTable weights) {
        return evaluate(expected, actual, weights.weights(), weights.defaultWeight());
    }

    /**
     * @param weights field weights, dotted ({@code items.price}) for line-item sub-fields
     * @param defaultWeight weight of fields missing from {@code weights}
     * @throws ConfigurationException if a weight is negative or not a number
     */
    public List<FieldEvaluationResult> evaluate(
            @Nonnull Map<String, Object> expected,
            @Nonnull Map<String, Object> actual,
            @Nonnull Map<String, Double> weights,
            double defaultWeight) {
        validateWeights(weights, defaultWeight);

        var span = tracer.spanBuilder("evaluate").startSpan();
        try (var unused = span.makeCurrent()) {
            var fields = new LinkedHashSet<>(expected.keySet());
            fields.addAll(actual.keySet());

            var results = new ArrayList<FieldEvaluationResult>();
            for (var field : fields) {
                if (ItemMatcher.ITEMS_FIELD.equals(field)) {
                    results.addAll(
                            evaluateItems(
                                    items(expected.get(field)),
                                    items(actual.get(field)),
                                    weights,
                                    defaultWeight));
                } else {
                    var weight = weightOf(weights, field, defaultWeight);
                    var comparator = registry.comparatorFor(field);
                    results.add(
                            comparator.compare(
                                    field, expected.get(field), actual.get(field), weight));
                }
            }
            span.setAttribute("evaluation.field_count", results.size());
            span.setAttribute(
                    "evaluation.accuracy", new ResultAggregator(results).overallAccuracy());
            return List.copyOf(results);
        } finally {
            span.end();
        }
    }

    private List<FieldEvaluationResult> evaluateItems(
            List<Map<String, Object>> expectedItems,
            List<Map<String, Object>> actualItems,
            Map<String, Double> weights,
            double defaultWeight) {
        AlignedItems aligned = itemMatcher.align(expectedItems, actualItems);

        var subFields = new LinkedHashSet<String>();
        aligned.expectedItems().forEach(item -> subFields.addAll(item.keySet()));
        aligned.actualItems().forEach(item -> subFields.addAll(item.keySet()));

        var results = new ArrayList<FieldEvaluationResult>();
        for (int index = 0; index < aligned.size(); index++) {
            var expectedItem = aligned.expectedItems().get(index);
            var actualItem = aligned.actualItems().get(index);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("match_score", aligned.pairScores().get(index));
            for (var subField : subFields) {
                var key = ITEM_PREFIX + subField;
                var weight = weightOf(weights, key, defaultWeight);
                var result =
                        registry.comparatorFor(key)
                                .compare(
                                        key,
                                        expectedItem.get(subField),
                                        actualItem.get(subField),
                                        weight,
                                        index);
                results.add(result.withDetails(details));
            }
        }
        log.debug(
                "evaluated {} aligned item pairs, item list similarity {}",
                aligned.size(),
                aligned.matchResult().score());
        return results;
    }

    /**
     * Evaluate a document and wrap the outcome with its identity and timing.
     *
     * @param extractionTimeMs how long the extraction took, when known
     */
    public DocumentEvaluationResult evaluateDocument(
            @Nonnull String documentId,
            @Nonnull Map<String, Object> expected,
            @Nonnull Map<String, Object> actual,
            @Nonnull WeightTable weights,
            @Nullable Long extractionTimeMs) {
        var results = evaluate(expected, actual, weights);
        return DocumentEvaluationResult.success(
                documentId, expected, actual, results, extractionTimeMs);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> items(@Nullable Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        var items = new ArrayList<Map<String, Object>>(list.size());
        for (var element : list) {
            if (element instanceof Map<?, ?> item) {
                items.add((Map<String, Object>) item);
            } else {
                log.debug("ignoring line item that is not a record: {}", element);
            }
        }
        return items;
    }

    private static double weightOf(Map<String, Double> weights, String field, double fallback) {
        var weight = weights.get(field);
        return weight == null ? fallback : weight;
    }

    private static void validateWeights(Map<String, Double> weights, double defaultWeight) {
        if (!Double.isFinite(defaultWeight) || defaultWeight < 0) {
            throw new ConfigurationException(
                    "default weight must be a non-negative number: " + defaultWeight);
        }
        for (var entry : weights.entrySet()) {
            var weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new ConfigurationException(
                        "weight of %s must be a non-negative number: %s"
                                .formatted(entry.getKey(), weight));
            }
        }
    }
}
