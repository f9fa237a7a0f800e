package dev.extractioneval.matching;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class PromptingExternalMatcherTest {
    private static final List<MatchCandidate> EXPECTED =
            List.of(
                    new MatchCandidate(0, Map.of("name", "pump"), "name: pump"),
                    new MatchCandidate(1, Map.of("name", "valve"), "name: valve"));
    private static final List<MatchCandidate> ACTUAL =
            List.of(new MatchCandidate(0, Map.of("name", "pump unit"), "name: pump unit"));

    @Test
    void promptListsBothSides() {
        var prompt = PromptingExternalMatcher.buildPrompt(EXPECTED, ACTUAL);
        assertTrue(prompt.contains("0: name: pump\n1: name: valve\n"));
        assertTrue(prompt.contains("# Actual items\n0: name: pump unit\n"));
        assertTrue(prompt.contains("\"matches\""));
    }

    @Test
    void readsDecisionsFromSurroundingText() {
        var prompt = new AtomicReference<String>();
        var matcher =
                new PromptingExternalMatcher(
                        p -> {
                            prompt.set(p);
                            return """
                                    Here you go:
                                    {"matches": [
                                      {"expected_index": 1, "actual_index": -1, "confidence": 0.0},
                                      {"expected_index": 0, "actual_index": 0, "confidence": 0.95,
                                       "reason": "same product"}
                                    ]}
                                    """;
                        });

        var decisions = matcher.match(EXPECTED, ACTUAL);
        assertNotNull(prompt.get());
        assertEquals(
                List.of(
                        new ExternalMatch(0, 0, 0.95, "same product"),
                        new ExternalMatch(1, ExternalMatch.NO_MATCH, 0.0, null)),
                decisions);
    }

    @Test
    void acceptsDataEnvelope() {
        var decisions =
                PromptingExternalMatcher.parseResponse(
                        "{\"data\": {\"matches\": [{\"expected_index\": 0, \"actual_index\": 2,"
                                + " \"confidence\": 0.5}]}}",
                        1);
        assertEquals(List.of(ExternalMatch.of(0, 2, 0.5)), decisions);
    }

    @Test
    void fillsMissingAndDropsInvalidEntries() {
        var decisions =
                PromptingExternalMatcher.parseResponse(
                        """
                        {"matches": [
                          {"expected_index": 2, "actual_index": 0, "confidence": 0.8},
                          {"expected_index": 2, "actual_index": 1, "confidence": 0.9},
                          {"expected_index": 7, "actual_index": 1, "confidence": 0.9},
                          {"actual_index": 1, "confidence": 0.9}
                        ]}
                        """,
                        3);
        assertEquals(
                List.of(
                        ExternalMatch.unmatched(0),
                        ExternalMatch.unmatched(1),
                        ExternalMatch.of(2, 0, 0.8)),
                decisions);
    }

    @Test
    void unreadableAnswerLeavesEverythingUnmatched() {
        for (var response : new String[] {"no idea", "{\"result\": []}", "{broken", null}) {
            assertEquals(
                    List.of(ExternalMatch.unmatched(0), ExternalMatch.unmatched(1)),
                    PromptingExternalMatcher.parseResponse(response, 2),
                    String.valueOf(response));
        }
    }

    @Test
    void emptySidesSkipTheCompletion() {
        var matcher =
                new PromptingExternalMatcher(
                        p -> {
                            throw new AssertionError("completion should not be called");
                        });
        assertTrue(matcher.match(EXPECTED, List.of()).isEmpty());
        assertTrue(matcher.match(List.of(), ACTUAL).isEmpty());
    }

    @Test
    void completionFailuresPropagate() {
        var matcher =
                new PromptingExternalMatcher(
                        p -> {
                            throw new IllegalStateException("rate limited");
                        });
        assertThrows(IllegalStateException.class, () -> matcher.match(EXPECTED, ACTUAL));
    }
}
