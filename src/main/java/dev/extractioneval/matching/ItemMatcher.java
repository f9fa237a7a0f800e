package dev.extractioneval.matching;

import dev.extractioneval.model.AlignedItems;
import dev.extractioneval.model.ItemMatch;
import dev.extractioneval.model.ItemsMatchResult;
import dev.extractioneval.model.ItemsMetric;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Aligns an expected and an actual list of line items, which may come in any order.
 *
 * <p>Without an {@link ExternalMatcher} items are paired greedily: each expected item, in list
 * order, takes the most similar actual item not yet taken, the earliest one on ties. An item whose
 * best similarity is zero stays unmatched. The result is not a globally optimal assignment: an
 * earlier expected item keeps its pick even when a later one would have scored higher with it.
 *
 * <p>With an external matcher the pairing decisions and their confidences come from it, while the
 * per-field agreement of each chosen pair is still computed here.
 */
@Slf4j
public final class ItemMatcher {
    public static final String ITEMS_FIELD = "items";

    private final @Nonnull ItemSimilarity similarity;
    private final @Nullable ExternalMatcher externalMatcher;
    private final @Nonnull Tracer tracer;

    public ItemMatcher(@Nonnull ItemSimilarity similarity) {
        this(similarity, null, OpenTelemetry.noop().getTracer("extraction-eval"));
    }

    public ItemMatcher(
            @Nonnull ItemSimilarity similarity,
            @Nullable ExternalMatcher externalMatcher,
            @Nonnull Tracer tracer) {
        this.similarity = Objects.requireNonNull(similarity);
        this.externalMatcher = externalMatcher;
        this.tracer = Objects.requireNonNull(tracer);
    }

    /** Pair every expected item with at most one actual item. */
    public ItemsMatchResult match(
            @Nonnull List<Map<String, Object>> expectedItems,
            @Nonnull List<Map<String, Object>> actualItems) {
        if (expectedItems.isEmpty()) {
            // nothing to attribute a surplus of actual items to
            return new ItemsMatchResult(actualItems.isEmpty() ? 1.0 : 0.0, List.of());
        }
        if (actualItems.isEmpty()) {
            var unmatched =
                    expectedItems.stream().map(item -> ItemMatch.unmatched(item, null)).toList();
            return new ItemsMatchResult(0.0, unmatched);
        }

        var span =
                tracer.spanBuilder("match_items")
                        .setAttribute("items.expected_count", expectedItems.size())
                        .setAttribute("items.actual_count", actualItems.size())
                        .setAttribute(
                                "items.strategy", externalMatcher == null ? "rules" : "external")
                        .startSpan();
        try (var unused = span.makeCurrent()) {
            var matches =
                    externalMatcher == null
                            ? matchByRules(expectedItems, actualItems)
                            : matchExternally(expectedItems, actualItems, span);
            var score = matches.stream().mapToDouble(ItemMatch::matchScore).average().orElse(0.0);
            span.setAttribute("items.score", score);
            return new ItemsMatchResult(score, matches);
        } finally {
            span.end();
        }
    }

    private List<ItemMatch> matchByRules(
            List<Map<String, Object>> expectedItems, List<Map<String, Object>> actualItems) {
        var used = new boolean[actualItems.size()];
        var matches = new ArrayList<ItemMatch>(expectedItems.size());
        for (var expectedItem : expectedItems) {
            int bestIndex = ItemMatch.NO_MATCH;
            ItemSimilarity.Similarity best = null;
            for (int i = 0; i < actualItems.size(); i++) {
                if (used[i]) {
                    continue;
                }
                var candidate = similarity.similarity(expectedItem, actualItems.get(i));
                if (candidate.score() > (best == null ? 0.0 : best.score())) {
                    bestIndex = i;
                    best = candidate;
                }
            }
            if (best == null) {
                matches.add(ItemMatch.unmatched(expectedItem, null));
            } else {
                used[bestIndex] = true;
                matches.add(
                        new ItemMatch(
                                expectedItem,
                                actualItems.get(bestIndex),
                                bestIndex,
                                best.score(),
                                best.fieldMatches(),
                                null));
            }
        }
        return matches;
    }

    private List<ItemMatch> matchExternally(
            List<Map<String, Object>> expectedItems,
            List<Map<String, Object>> actualItems,
            Span span) {
        List<ExternalMatch> decisions;
        try {
            decisions = externalMatcher.match(candidates(expectedItems), candidates(actualItems));
            if (decisions == null) {
                throw new IllegalStateException("external matcher returned no decisions");
            }
        } catch (RuntimeException e) {
            log.warn(
                    "external item matcher failed, leaving {} expected items unmatched: {}",
                    expectedItems.size(),
                    e.getMessage(),
                    e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            var reason = "external matcher failed: " + e.getMessage();
            return expectedItems.stream().map(item -> ItemMatch.unmatched(item, reason)).toList();
        }

        // first decision per expected index wins
        var byExpected = new ExternalMatch[expectedItems.size()];
        for (var decision : decisions) {
            if (decision != null
                    && decision.expectedIndex() >= 0
                    && decision.expectedIndex() < byExpected.length
                    && byExpected[decision.expectedIndex()] == null) {
                byExpected[decision.expectedIndex()] = decision;
            }
        }

        var claimed = new boolean[actualItems.size()];
        var matches = new ArrayList<ItemMatch>(expectedItems.size());
        for (int i = 0; i < expectedItems.size(); i++) {
            var expectedItem = expectedItems.get(i);
            var decision = byExpected[i];
            if (decision == null
                    || decision.actualIndex() < 0
                    || decision.actualIndex() >= actualItems.size()) {
                var reason = decision == null ? null : decision.reason();
                matches.add(
                        ItemMatch.unmatched(
                                expectedItem, reason == null ? "no corresponding item" : reason));
                continue;
            }
            if (claimed[decision.actualIndex()]) {
                log.debug(
                        "actual item {} already paired, leaving expected item {} unmatched",
                        decision.actualIndex(),
                        i);
                matches.add(ItemMatch.unmatched(expectedItem, "actual item already matched"));
                continue;
            }
            claimed[decision.actualIndex()] = true;
            var actualItem = actualItems.get(decision.actualIndex());
            var confidence = clamp(decision.confidence());
            matches.add(
                    new ItemMatch(
                            expectedItem,
                            actualItem,
                            decision.actualIndex(),
                            confidence,
                            similarity.similarity(expectedItem, actualItem).fieldMatches(),
                            decision.reason() == null
                                    ? String.format(
                                            Locale.ROOT, "external confidence: %.2f", confidence)
                                    : decision.reason()));
        }
        return matches;
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static List<MatchCandidate> candidates(List<Map<String, Object>> items) {
        return IntStream.range(0, items.size())
                .mapToObj(
                        i -> new MatchCandidate(i, items.get(i), ItemFormatter.render(items.get(i))))
                .toList();
    }

    /**
     * Match the two lists and re-sequence them so that aligned pairs share an index. Matched pairs
     * come first in expected order, then unmatched expected items, then unmatched actual items,
     * each paired with an empty item.
     */
    public AlignedItems align(
            @Nonnull List<Map<String, Object>> expectedItems,
            @Nonnull List<Map<String, Object>> actualItems) {
        var result = match(expectedItems, actualItems);
        var alignedExpected = new ArrayList<Map<String, Object>>();
        var alignedActual = new ArrayList<Map<String, Object>>();
        var pairScores = new ArrayList<Double>();
        var used = new boolean[actualItems.size()];

        for (var match : result.matches()) {
            if (match.hasMatch()) {
                alignedExpected.add(match.expectedItem());
                alignedActual.add(match.matchedItem());
                pairScores.add(match.matchScore());
                used[match.matchedIndex()] = true;
            }
        }
        for (var match : result.matches()) {
            if (!match.hasMatch()) {
                alignedExpected.add(match.expectedItem());
                alignedActual.add(Map.of());
                pairScores.add(0.0);
            }
        }
        for (int i = 0; i < actualItems.size(); i++) {
            if (!used[i]) {
                alignedExpected.add(Map.of());
                alignedActual.add(actualItems.get(i));
                pairScores.add(0.0);
            }
        }
        return new AlignedItems(alignedExpected, alignedActual, pairScores, result);
    }

    /** The whole item list scored as one field worth {@code baseWeight}. */
    public ItemsMetric itemsMetric(
            @Nonnull List<Map<String, Object>> expectedItems,
            @Nonnull List<Map<String, Object>> actualItems,
            double baseWeight,
            double passThreshold) {
        return ItemsMetric.of(
                ITEMS_FIELD, baseWeight, passThreshold, match(expectedItems, actualItems));
    }
}
