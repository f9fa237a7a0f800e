package dev.extractioneval.model;

import java.util.List;

/**
 * Whole-list view of line-item accuracy, scored as a single weighted field.
 *
 * <p>Unlike {@link FieldEvaluationResult} the score is proportional: {@code fieldScore = weight *
 * accuracy}. {@code correct} only reports whether accuracy reached the pass threshold.
 */
public record ItemsMetric(
        String fieldName,
        double weight,
        double accuracy,
        double fieldScore,
        boolean correct,
        List<ItemMatch> matches) {

    public ItemsMetric {
        matches = List.copyOf(matches);
    }

    public static ItemsMetric of(
            String fieldName, double weight, double passThreshold, ItemsMatchResult result) {
        return new ItemsMetric(
                fieldName,
                weight,
                result.score(),
                weight * result.score(),
                result.score() >= passThreshold,
                result.matches());
    }
}
