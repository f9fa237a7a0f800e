package dev.extractioneval.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of comparing one expected/actual field pair.
 *
 * <p>A correct result scores its full weight and an incorrect one scores zero. Use {@link
 * #createCorrect} and {@link #createIncorrect}; the canonical constructor rejects any other
 * combination.
 */
public record FieldEvaluationResult(
        /** field name, dotted for line-item sub-fields (e.g. {@code items.price}) */
        @Nonnull String fieldName,
        @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable Object expectedValue,
        @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable Object actualValue,
        double weight,
        /** equal to weight when correct, zero otherwise */
        double score,
        @JsonProperty("is_correct") boolean correct,
        /** position of the aligned item pair. only set for line-item sub-fields */
        @Nullable Integer itemIndex,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) @Nullable Map<String, Object> details) {

    public FieldEvaluationResult {
        if (fieldName == null) {
            throw new IllegalArgumentException("field name is required");
        }
        if (!(weight >= 0)) {
            throw new IllegalArgumentException(
                    "weight must be non-negative: %s=%s".formatted(fieldName, weight));
        }
        if (!(score >= 0)) {
            throw new IllegalArgumentException(
                    "score must be non-negative: %s=%s".formatted(fieldName, score));
        }
        if (correct && score != weight) {
            throw new IllegalArgumentException(
                    "a correct result must score its weight: %s score=%s weight=%s"
                            .formatted(fieldName, score, weight));
        }
        if (!correct && score != 0) {
            throw new IllegalArgumentException(
                    "an incorrect result must score zero: %s score=%s".formatted(fieldName, score));
        }
        if (itemIndex != null && itemIndex < 0) {
            throw new IllegalArgumentException(
                    "item index must be non-negative: %s[%s]".formatted(fieldName, itemIndex));
        }
        if (details != null) {
            details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
        }
    }

    public static FieldEvaluationResult createCorrect(
            String fieldName, @Nullable Object expected, @Nullable Object actual, double weight) {
        return createCorrect(fieldName, expected, actual, weight, null, null);
    }

    public static FieldEvaluationResult createCorrect(
            String fieldName,
            @Nullable Object expected,
            @Nullable Object actual,
            double weight,
            @Nullable Integer itemIndex,
            @Nullable Map<String, Object> details) {
        return new FieldEvaluationResult(
                fieldName, expected, actual, weight, weight, true, itemIndex, details);
    }

    public static FieldEvaluationResult createIncorrect(
            String fieldName, @Nullable Object expected, @Nullable Object actual, double weight) {
        return createIncorrect(fieldName, expected, actual, weight, null, null);
    }

    public static FieldEvaluationResult createIncorrect(
            String fieldName,
            @Nullable Object expected,
            @Nullable Object actual,
            double weight,
            @Nullable Integer itemIndex,
            @Nullable Map<String, Object> details) {
        return new FieldEvaluationResult(
                fieldName, expected, actual, weight, 0.0, false, itemIndex, details);
    }

    /** Copy of this result carrying the given details. */
    public FieldEvaluationResult withDetails(@Nullable Map<String, Object> details) {
        return new FieldEvaluationResult(
                fieldName, expectedValue, actualValue, weight, score, correct, itemIndex, details);
    }

    /** {@code field[index]} for line-item results, the plain field name otherwise. */
    public String displayName() {
        return itemIndex == null ? fieldName : "%s[%d]".formatted(fieldName, itemIndex);
    }
}
