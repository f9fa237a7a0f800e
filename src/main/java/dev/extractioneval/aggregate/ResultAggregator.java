package dev.extractioneval.aggregate;

import dev.extractioneval.model.FieldEvaluationResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/** Read-only roll-ups over a flat list of field results. */
public final class ResultAggregator {
    public static final String ITEM_PREFIX = "items.";

    private final List<FieldEvaluationResult> results;

    public ResultAggregator(@Nonnull List<FieldEvaluationResult> results) {
        this.results = List.copyOf(results);
    }

    public List<FieldEvaluationResult> results() {
        return results;
    }

    /** Total score over total weight, zero when there is no weight at all. */
    public double overallAccuracy() {
        return weightedAccuracy(results);
    }

    /** Weighted accuracy of line-item sub-fields only. */
    public double itemsAccuracy() {
        return weightedAccuracy(itemsResults());
    }

    public double totalScore() {
        return results.stream().mapToDouble(FieldEvaluationResult::score).sum();
    }

    public double totalWeight() {
        return results.stream().mapToDouble(FieldEvaluationResult::weight).sum();
    }

    public List<FieldEvaluationResult> byFieldName(String fieldName) {
        return results.stream().filter(r -> r.fieldName().equals(fieldName)).toList();
    }

    public List<FieldEvaluationResult> byItemIndex(int itemIndex) {
        return results.stream().filter(r -> Objects.equals(r.itemIndex(), itemIndex)).toList();
    }

    public Optional<FieldEvaluationResult> byFieldAndItem(String fieldName, int itemIndex) {
        return results.stream()
                .filter(r -> r.fieldName().equals(fieldName))
                .filter(r -> Objects.equals(r.itemIndex(), itemIndex))
                .findFirst();
    }

    public List<FieldEvaluationResult> itemsResults() {
        return results.stream().filter(r -> r.fieldName().startsWith(ITEM_PREFIX)).toList();
    }

    public List<FieldEvaluationResult> nonItemsResults() {
        return results.stream().filter(r -> !r.fieldName().startsWith(ITEM_PREFIX)).toList();
    }

    /** Accuracy of each aligned item pair, keyed and ordered by item index. */
    public Map<Integer, ItemSummary> itemSummary() {
        var groups = new TreeMap<Integer, List<FieldEvaluationResult>>();
        for (var result : itemsResults()) {
            if (result.itemIndex() != null) {
                groups.computeIfAbsent(result.itemIndex(), k -> new ArrayList<>()).add(result);
            }
        }
        var summary = new LinkedHashMap<Integer, ItemSummary>();
        groups.forEach(
                (index, group) ->
                        summary.put(
                                index,
                                new ItemSummary(
                                        weightedAccuracy(group),
                                        sumScore(group),
                                        sumWeight(group),
                                        group.size())));
        return Collections.unmodifiableMap(summary);
    }

    /**
     * Accuracy per display name, in first-seen order. Line-item results are keyed {@code
     * field[index]}, so each item pair reports separately.
     */
    public Map<String, FieldAccuracySummary> fieldAccuracySummary() {
        var groups = new LinkedHashMap<String, List<FieldEvaluationResult>>();
        for (var result : results) {
            groups.computeIfAbsent(result.displayName(), k -> new ArrayList<>()).add(result);
        }
        var summary = new LinkedHashMap<String, FieldAccuracySummary>();
        groups.forEach(
                (name, group) -> {
                    int correct =
                            (int) group.stream().filter(FieldEvaluationResult::correct).count();
                    summary.put(
                            name,
                            new FieldAccuracySummary(
                                    (double) correct / group.size(),
                                    weightedAccuracy(group),
                                    correct,
                                    group.size(),
                                    sumScore(group),
                                    sumWeight(group)));
                });
        return Collections.unmodifiableMap(summary);
    }

    /** Correctness keyed by display name. */
    public Map<String, Boolean> fieldAccuracies() {
        var accuracies = new LinkedHashMap<String, Boolean>();
        for (var result : results) {
            accuracies.put(result.displayName(), result.correct());
        }
        return Collections.unmodifiableMap(accuracies);
    }

    private static double weightedAccuracy(List<FieldEvaluationResult> group) {
        var weight = sumWeight(group);
        return weight > 0 ? sumScore(group) / weight : 0.0;
    }

    private static double sumScore(List<FieldEvaluationResult> group) {
        return group.stream().mapToDouble(FieldEvaluationResult::score).sum();
    }

    private static double sumWeight(List<FieldEvaluationResult> group) {
        return group.stream().mapToDouble(FieldEvaluationResult::weight).sum();
    }
}
