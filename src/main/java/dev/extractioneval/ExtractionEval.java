package dev.extractioneval;

import dev.extractioneval.compare.ComparatorRegistry;
import dev.extractioneval.config.EvaluationConfig;
import dev.extractioneval.config.WeightTable;
import dev.extractioneval.evaluate.AccuracyEvaluator;
import dev.extractioneval.matching.ExternalMatcher;
import dev.extractioneval.matching.ItemMatcher;
import dev.extractioneval.matching.ItemSimilarity;
import dev.extractioneval.model.DocumentEvaluationResult;
import dev.extractioneval.model.FieldEvaluationResult;
import dev.extractioneval.model.ItemsMetric;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point: one evaluation session.
 *
 * <p>A session owns its comparator registry, weight table and item matcher. Sessions share no
 * state, so independent runs can evaluate side by side. Register comparator bindings before the
 * first evaluation; afterwards the session is read-only and can be used from several threads.
 *
 * <pre>{@code
 * var eval = ExtractionEval.builder().weights(WeightTable.fromJson(json, 1.0)).build();
 * var results = eval.evaluate(expected, actual);
 * }</pre>
 */
@Slf4j
@Getter
@Accessors(fluent = true)
public final class ExtractionEval {
    private final @Nonnull EvaluationConfig config;
    private final @Nonnull WeightTable weights;
    private final @Nonnull ComparatorRegistry registry;
    private final @Nonnull ItemMatcher itemMatcher;
    private final @Nonnull AccuracyEvaluator evaluator;

    private ExtractionEval(Builder builder) {
        this.config = Objects.requireNonNull(builder.config);
        this.weights = Objects.requireNonNull(builder.weights);
        this.registry = Objects.requireNonNull(builder.registry);
        var similarity =
                new ItemSimilarity(
                        itemFieldWeights(weights),
                        weights.itemDefaultWeight().orElse(config.itemDefaultWeight()),
                        config.nameTokenRatio());
        this.itemMatcher = new ItemMatcher(similarity, builder.externalMatcher, builder.tracer);
        this.evaluator = new AccuracyEvaluator(registry, itemMatcher, builder.tracer);
        log.debug(
                "evaluation session ready: {} weights, {} comparator bindings, {} item matching",
                weights.weights().size(),
                registry.bindings().size(),
                builder.externalMatcher == null ? "rule-based" : "external");
    }

    // an empty table means "use the built-in item weights"
    private static Map<String, Double> itemFieldWeights(WeightTable weights) {
        var configured = weights.itemFieldWeights();
        return configured.isEmpty() ? ItemSimilarity.DEFAULT_FIELD_WEIGHTS : configured;
    }

    /** Create a session with default settings and rule-based item matching. */
    public static ExtractionEval of(EvaluationConfig config) {
        return builder().config(config).build();
    }

    public List<FieldEvaluationResult> evaluate(
            @Nonnull Map<String, Object> expected, @Nonnull Map<String, Object> actual) {
        return evaluator.evaluate(expected, actual, weights);
    }

    public DocumentEvaluationResult evaluateDocument(
            @Nonnull String documentId,
            @Nonnull Map<String, Object> expected,
            @Nonnull Map<String, Object> actual,
            @Nullable Long extractionTimeMs) {
        return evaluator.evaluateDocument(documentId, expected, actual, weights, extractionTimeMs);
    }

    /** The whole item list scored as one field, using the configured base weight and threshold. */
    public ItemsMetric itemsMetric(
            @Nonnull List<Map<String, Object>> expectedItems,
            @Nonnull List<Map<String, Object>> actualItems) {
        return itemMatcher.itemsMetric(
                expectedItems,
                actualItems,
                config.itemsBaseWeight(),
                config.itemsPassThreshold());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private @Nullable EvaluationConfig config;
        private @Nullable WeightTable weights;
        private @Nullable ComparatorRegistry registry;
        private @Nullable ExternalMatcher externalMatcher;
        private @Nullable Tracer tracer;

        public ExtractionEval build() {
            if (config == null) {
                config = EvaluationConfig.fromEnvironment();
            }
            if (weights == null) {
                weights = WeightTable.of(Map.of(), config.defaultWeight());
            }
            if (registry == null) {
                registry = ComparatorRegistry.withDefaults();
            }
            if (tracer == null) {
                tracer = OpenTelemetry.noop().getTracer("extraction-eval");
            }
            return new ExtractionEval(this);
        }

        public Builder config(@Nonnull EvaluationConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        public Builder weights(@Nonnull WeightTable weights) {
            this.weights = Objects.requireNonNull(weights);
            return this;
        }

        public Builder registry(@Nonnull ComparatorRegistry registry) {
            this.registry = Objects.requireNonNull(registry);
            return this;
        }

        /** Delegate line-item pairing to the given matcher. */
        public Builder externalMatcher(@Nullable ExternalMatcher externalMatcher) {
            this.externalMatcher = externalMatcher;
            return this;
        }

        public Builder tracer(@Nonnull Tracer tracer) {
            this.tracer = Objects.requireNonNull(tracer);
            return this;
        }
    }
}
