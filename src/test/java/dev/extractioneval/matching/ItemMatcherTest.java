package dev.extractioneval.matching;

import static org.junit.jupiter.api.Assertions.*;

import dev.extractioneval.TestTracing;
import dev.extractioneval.model.ItemMatch;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ItemMatcherTest {
    private static final Map<String, Object> APPLE = item("apple", 100);
    private static final Map<String, Object> BANANA = item("banana", 200);
    private static final Map<String, Object> CHERRY = item("cherry", 300);

    private final ItemMatcher matcher = new ItemMatcher(ItemSimilarity.withDefaults());

    private static Map<String, Object> item(String name, int price) {
        return Map.of("name", name, "price", price);
    }

    @Test
    void emptyListsMatchPerfectly() {
        var result = matcher.match(List.of(), List.of());
        assertEquals(1.0, result.score());
        assertTrue(result.matches().isEmpty());
    }

    @Test
    void nothingExpectedButSomethingExtracted() {
        var result = matcher.match(List.of(), List.of(APPLE));
        assertEquals(0.0, result.score());
        assertTrue(result.matches().isEmpty());
    }

    @Test
    void nothingExtracted() {
        var result = matcher.match(List.of(APPLE, BANANA), List.of());
        assertEquals(0.0, result.score());
        assertEquals(2, result.matches().size());
        assertTrue(result.matches().stream().noneMatch(ItemMatch::hasMatch));
        assertEquals(ItemMatch.NO_MATCH, result.matches().get(0).matchedIndex());
    }

    @Test
    void reorderedItemsMatchPerfectly() {
        var result = matcher.match(List.of(APPLE, BANANA, CHERRY), List.of(CHERRY, APPLE, BANANA));
        assertEquals(1.0, result.score());
        assertEquals(
                List.of(1, 2, 0),
                result.matches().stream().map(ItemMatch::matchedIndex).toList());
    }

    @Test
    void missingItemsLowerTheScore() {
        var result = matcher.match(List.of(APPLE, BANANA, CHERRY), List.of(BANANA));
        assertEquals(1.0 / 3, result.score(), 1e-9);
        assertFalse(result.matches().get(0).hasMatch());
        assertEquals(0, result.matches().get(1).matchedIndex());
        assertFalse(result.matches().get(2).hasMatch());
    }

    @Test
    void earlierExpectedItemsPickFirst() {
        var first = item("bolt", 100);
        var second = item("bolt", 200);
        var result =
                matcher.match(
                        List.of(first, second), List.of(item("bolt", 200), item("bolt", 999)));

        // both candidates tie for the first item, so it takes the earlier one
        assertEquals(0, result.matches().get(0).matchedIndex());
        assertEquals(1, result.matches().get(1).matchedIndex());
        assertEquals(0.6, result.score(), 1e-9);
    }

    @Test
    void zeroSimilarityLeavesItemUnmatched() {
        var result = matcher.match(List.of(APPLE), List.of(item("grape", 999)));
        assertFalse(result.matches().get(0).hasMatch());
        assertEquals(0.0, result.score());
    }

    @Test
    void matchCarriesFieldAgreement() {
        var result = matcher.match(List.of(APPLE), List.of(item("apple", 150)));
        var match = result.matches().get(0);
        assertEquals(Map.of("name", true, "price", false), match.fieldMatches());
        assertEquals(0.6, match.matchScore(), 1e-9);
        assertNull(match.matchReason());
    }

    @Test
    void alignPutsPairsFirstThenLeftovers() {
        var extra = item("extra", 1);
        var stray = item("stray", 2);
        var aligned = matcher.align(List.of(APPLE, BANANA, extra), List.of(BANANA, stray, APPLE));

        assertEquals(4, aligned.size());
        assertEquals(List.of(APPLE, BANANA, extra, Map.of()), aligned.expectedItems());
        assertEquals(List.of(APPLE, BANANA, Map.of(), stray), aligned.actualItems());
        assertEquals(List.of(1.0, 1.0, 0.0, 0.0), aligned.pairScores());
    }

    @Test
    void itemsMetricScalesByAccuracy() {
        var metric = matcher.itemsMetric(List.of(APPLE, BANANA), List.of(APPLE), 5.0, 0.8);
        assertEquals(ItemMatcher.ITEMS_FIELD, metric.fieldName());
        assertEquals(0.5, metric.accuracy());
        assertEquals(2.5, metric.fieldScore());
        assertFalse(metric.correct());

        var perfect = matcher.itemsMetric(List.of(APPLE), List.of(APPLE), 5.0, 0.8);
        assertEquals(5.0, perfect.fieldScore());
        assertTrue(perfect.correct());
    }

    @Test
    void externalDecisionsDrivePairing() {
        var seen = new ArrayList<List<MatchCandidate>>();
        ExternalMatcher external =
                (expected, actual) -> {
                    seen.add(expected);
                    seen.add(actual);
                    return List.of(
                            new ExternalMatch(1, 0, 0.7, "same fruit"),
                            ExternalMatch.of(0, 1, 0.9));
                };
        var tracing = new TestTracing();
        var result =
                new ItemMatcher(ItemSimilarity.withDefaults(), external, tracing.tracer())
                        .match(List.of(APPLE, BANANA), List.of(BANANA, item("apple", 101)));

        var first = result.matches().get(0);
        assertEquals(1, first.matchedIndex());
        assertEquals(0.9, first.matchScore());
        assertEquals("external confidence: 0.90", first.matchReason());
        assertEquals(Map.of("name", true, "price", false), first.fieldMatches());
        assertEquals("same fruit", result.matches().get(1).matchReason());
        assertEquals(0.8, result.score(), 1e-9);

        assertEquals("name: apple / unit price: 100", seen.get(0).get(0).rendering());
        assertEquals(1, seen.get(1).get(1).index());

        var span = tracing.awaitExportedSpans().get(0);
        assertEquals("match_items", span.getName());
        assertEquals(
                "external", span.getAttributes().get(AttributeKey.stringKey("items.strategy")));
    }

    @Test
    void externalDecisionsAreSanitized() {
        ExternalMatcher external =
                (expected, actual) ->
                        List.of(
                                ExternalMatch.of(0, 0, 1.5),
                                ExternalMatch.of(0, 1, 1.0),
                                ExternalMatch.of(1, 0, 0.8),
                                new ExternalMatch(2, 7, 0.5, "out of range"),
                                ExternalMatch.of(9, 1, 1.0));
        var result =
                new ItemMatcher(
                                ItemSimilarity.withDefaults(),
                                external,
                                new TestTracing().tracer())
                        .match(List.of(APPLE, BANANA, CHERRY, APPLE), List.of(APPLE, BANANA));

        assertEquals(0, result.matches().get(0).matchedIndex());
        assertEquals(1.0, result.matches().get(0).matchScore());
        assertFalse(result.matches().get(1).hasMatch());
        assertEquals("actual item already matched", result.matches().get(1).matchReason());
        assertFalse(result.matches().get(2).hasMatch());
        assertEquals("out of range", result.matches().get(2).matchReason());
        assertEquals("no corresponding item", result.matches().get(3).matchReason());
        assertEquals(0.25, result.score(), 1e-9);
    }

    @Test
    void externalFailureLeavesEverythingUnmatched() {
        ExternalMatcher external =
                (expected, actual) -> {
                    throw new IllegalStateException("service unavailable");
                };
        var tracing = new TestTracing();
        var result =
                new ItemMatcher(ItemSimilarity.withDefaults(), external, tracing.tracer())
                        .match(List.of(APPLE, BANANA), List.of(APPLE, BANANA));

        assertEquals(0.0, result.score());
        assertTrue(result.matches().stream().noneMatch(ItemMatch::hasMatch));
        assertEquals(
                "external matcher failed: service unavailable",
                result.matches().get(0).matchReason());

        var span = tracing.awaitExportedSpans().get(0);
        assertEquals(StatusCode.ERROR, span.getStatus().getStatusCode());
    }

    @Test
    void rulesSpanRecordsCountsAndScore() {
        var tracing = new TestTracing();
        new ItemMatcher(ItemSimilarity.withDefaults(), null, tracing.tracer())
                .match(List.of(APPLE, BANANA), List.of(APPLE));

        var spans = tracing.awaitExportedSpans();
        assertEquals(1, spans.size());
        var attributes = spans.get(0).getAttributes();
        assertEquals(2L, attributes.get(AttributeKey.longKey("items.expected_count")));
        assertEquals(1L, attributes.get(AttributeKey.longKey("items.actual_count")));
        assertEquals("rules", attributes.get(AttributeKey.stringKey("items.strategy")));
        assertEquals(0.5, attributes.get(AttributeKey.doubleKey("items.score")));
    }
}
