package dev.extractioneval.evaluate;

import static org.junit.jupiter.api.Assertions.*;

import dev.extractioneval.TestTracing;
import dev.extractioneval.compare.ComparatorRegistry;
import dev.extractioneval.config.ConfigurationException;
import dev.extractioneval.config.WeightTable;
import dev.extractioneval.matching.ItemMatcher;
import dev.extractioneval.matching.ItemSimilarity;
import dev.extractioneval.model.FieldEvaluationResult;
import io.opentelemetry.api.common.AttributeKey;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.junit.jupiter.api.Test;

class AccuracyEvaluatorTest {
    private final AccuracyEvaluator evaluator =
            new AccuracyEvaluator(
                    ComparatorRegistry.withDefaults(),
                    new ItemMatcher(ItemSimilarity.withDefaults()));

    private static Map<String, Object> item(String name, Object price) {
        return Map.of("name", name, "price", price);
    }

    private static FieldEvaluationResult only(List<FieldEvaluationResult> results, String field) {
        var matching = results.stream().filter(r -> r.fieldName().equals(field)).toList();
        assertEquals(1, matching.size(), field);
        return matching.get(0);
    }

    private static FieldEvaluationResult at(
            List<FieldEvaluationResult> results, String field, int index) {
        return results.stream()
                .filter(r -> r.fieldName().equals(field) && Objects.equals(r.itemIndex(), index))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void scoresTopLevelFieldsWithTheirComparators() {
        var expected =
                Map.<String, Object>of(
                        "doc_date", "2024-01-15", "total_price", 1000, "customer", "ACME");
        var actual =
                Map.<String, Object>of(
                        "doc_date", "2024年1月15日", "total_price", "¥1,000", "customer", "Acme Corp");

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertEquals(3, results.size());
        assertTrue(only(results, "doc_date").correct());
        assertTrue(only(results, "total_price").correct());
        assertFalse(only(results, "customer").correct());
        assertNull(only(results, "customer").itemIndex());
    }

    @Test
    void fieldsFollowExpectedThenActualOrder() {
        var expected = new LinkedHashMap<String, Object>();
        expected.put("b", 1);
        expected.put("a", 2);
        var actual = new LinkedHashMap<String, Object>();
        actual.put("c", 3);
        actual.put("a", 2);

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertEquals(
                List.of("b", "a", "c"),
                results.stream().map(FieldEvaluationResult::fieldName).toList());
        var missing = results.get(2);
        assertNull(missing.expectedValue());
        assertEquals(3, missing.actualValue());
        assertFalse(missing.correct());
    }

    @Test
    void appliesWeights() {
        var expected = Map.<String, Object>of("total_price", 1000, "customer", "ACME");
        var actual = Map.<String, Object>of("total_price", 1000, "customer", "Other");

        var results =
                evaluator.evaluate(expected, actual, Map.of("total_price", 3.0), 1.0);

        assertEquals(3.0, only(results, "total_price").score());
        assertEquals(1.0, only(results, "customer").weight());
        assertEquals(0.0, only(results, "customer").score());
    }

    @Test
    void reorderedItemsAreFullyCorrect() {
        var expected =
                Map.<String, Object>of("items", List.of(item("apple", 100), item("banana", 200)));
        var actual =
                Map.<String, Object>of("items", List.of(item("banana", 200), item("apple", "100")));

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertEquals(4, results.size());
        assertTrue(results.stream().allMatch(FieldEvaluationResult::correct));
        assertEquals("apple", at(results, "items.name", 0).actualValue());
        assertEquals("banana", at(results, "items.name", 1).actualValue());
        assertEquals(1.0, at(results, "items.price", 1).details().get("match_score"));
    }

    @Test
    void itemSubFieldsUseDottedWeightsAndComparators() {
        var expected = Map.<String, Object>of("items", List.of(item("apple", 100)));
        var actual = Map.<String, Object>of("items", List.of(item("apple", "1,50")));

        var results = evaluator.evaluate(expected, actual, Map.of("items.price", 2.0), 1.0);

        var price = at(results, "items.price", 0);
        assertFalse(price.correct());
        assertEquals(2.0, price.weight());
        assertEquals(0.6, (double) price.details().get("match_score"), 1e-9);
        assertTrue(at(results, "items.name", 0).correct());
    }

    @Test
    void unmatchedItemsOnEitherSideCountAsWrong() {
        var expected =
                Map.<String, Object>of("items", List.of(item("apple", 100), item("kiwi", 50)));
        var actual =
                Map.<String, Object>of("items", List.of(item("apple", 100), item("cherry", 300)));

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertEquals(6, results.size());
        assertTrue(at(results, "items.name", 0).correct());
        var lostExpected = at(results, "items.name", 1);
        assertEquals("kiwi", lostExpected.expectedValue());
        assertNull(lostExpected.actualValue());
        var strayActual = at(results, "items.name", 2);
        assertNull(strayActual.expectedValue());
        assertEquals("cherry", strayActual.actualValue());
        assertEquals(0.0, strayActual.details().get("match_score"));
    }

    @Test
    void itemResultsAreFoundAmongTopLevelResults() {
        var expected = new LinkedHashMap<String, Object>();
        expected.put("customer", "ACME");
        expected.put("items", List.of(item("apple", 100)));
        var actual = new LinkedHashMap<String, Object>();
        actual.put("customer", "ACME");
        actual.put("items", List.of(item("apple", 100)));

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertNull(results.get(0).itemIndex());
        assertTrue(at(results, "items.price", 0).correct());
        assertEquals("apple", at(results, "items.name", 0).expectedValue());
    }

    @Test
    void malformedItemListsAreTreatedAsEmpty() {
        var expected = Map.<String, Object>of("items", "not a list");
        var actual = Map.<String, Object>of("items", List.of("junk", item("apple", 1)));

        var results = evaluator.evaluate(expected, actual, Map.of(), 1.0);

        assertEquals(2, results.size());
        assertTrue(results.stream().noneMatch(FieldEvaluationResult::correct));
        assertTrue(results.stream().allMatch(r -> Objects.equals(r.itemIndex(), 0)));
    }

    @Test
    void emptyItemListsYieldNoResults() {
        var results =
                evaluator.evaluate(
                        Map.of("items", List.of()), Map.of("items", List.of()), Map.of(), 1.0);
        assertTrue(results.isEmpty());
    }

    @Test
    void evaluationIsDeterministic() {
        var expected =
                Map.<String, Object>of(
                        "customer", "ACME", "items", List.of(item("bolt", 1), item("bolt", 2)));
        var actual =
                Map.<String, Object>of("customer", "ACME", "items", List.of(item("bolt", 2)));
        var first = evaluator.evaluate(expected, actual, Map.of(), 1.0);
        var second = evaluator.evaluate(expected, actual, Map.of(), 1.0);
        assertEquals(first, second);
    }

    @Test
    void rejectsInvalidWeights() {
        assertThrows(
                ConfigurationException.class,
                () -> evaluator.evaluate(Map.of(), Map.of(), Map.of("a", -1.0), 1.0));
        assertThrows(
                ConfigurationException.class,
                () -> evaluator.evaluate(Map.of(), Map.of(), Map.of(), Double.NaN));
    }

    @Test
    void evaluatesDocuments() {
        var weights = WeightTable.of(Map.of("total_price", 2.0), 1.0);
        var document =
                evaluator.evaluateDocument(
                        "invoice-001",
                        Map.of("total_price", 1000, "customer", "ACME"),
                        Map.of("total_price", 1000, "customer", "nobody"),
                        weights,
                        1200L);

        assertEquals("invoice-001", document.documentId());
        assertTrue(document.isSuccess());
        assertEquals(1200L, document.extractionTimeMs().orElseThrow());
        assertEquals(2.0 / 3, document.accuracy(), 1e-9);
        assertEquals(Map.of("total_price", true, "customer", false), document.fieldAccuracies());
    }

    @Test
    void recordsEvaluationSpans() {
        var tracing = new TestTracing();
        var traced =
                new AccuracyEvaluator(
                        ComparatorRegistry.withDefaults(),
                        new ItemMatcher(ItemSimilarity.withDefaults(), null, tracing.tracer()),
                        tracing.tracer());

        traced.evaluate(
                Map.of("customer", "ACME", "items", List.of(item("apple", 1))),
                Map.of("customer", "ACME", "items", List.of(item("apple", 2))),
                Map.of(),
                1.0);

        var spans = tracing.awaitExportedSpans();
        assertEquals(2, spans.size());
        var matchSpan = spans.get(0);
        var evaluateSpan = spans.get(1);
        assertEquals("match_items", matchSpan.getName());
        assertEquals("evaluate", evaluateSpan.getName());
        assertEquals(evaluateSpan.getSpanId(), matchSpan.getParentSpanId());
        var attributes = evaluateSpan.getAttributes();
        assertEquals(3L, attributes.get(AttributeKey.longKey("evaluation.field_count")));
        assertEquals(
                2.0 / 3,
                attributes.get(AttributeKey.doubleKey("evaluation.accuracy")),
                1e-9);
    }
}
