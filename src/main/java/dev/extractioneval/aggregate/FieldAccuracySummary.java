package dev.extractioneval.aggregate;

/**
 * Accuracy of all results sharing one display name.
 *
 * @param accuracy share of correct results, unweighted
 * @param weightedAccuracy total score over total weight
 */
public record FieldAccuracySummary(
        double accuracy,
        double weightedAccuracy,
        int correctCount,
        int totalCount,
        double totalScore,
        double totalWeight) {}
