package dev.extractioneval.aggregate;

/** Accuracy of the sub-field results of one aligned item pair. */
public record ItemSummary(double accuracy, double totalScore, double totalWeight, int fieldCount) {}
