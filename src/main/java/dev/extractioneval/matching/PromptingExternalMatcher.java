package dev.extractioneval.matching;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.extractioneval.json.EvalJsonMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.IntStream;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/**
 * An {@link ExternalMatcher} that asks a text-completion model to pair the items.
 *
 * <p>The completion function receives a prompt listing both item lists and must answer with a JSON
 * object of the form {@code {"matches": [{"expected_index": 0, "actual_index": 3, "confidence":
 * 0.95, "reason": "..."}]}}, optionally surrounded by other text. An answer that cannot be read
 * leaves every expected item unmatched. Exceptions thrown by the completion function propagate to
 * the caller.
 */
@Slf4j
public class PromptingExternalMatcher implements ExternalMatcher {
    private final @Nonnull Function<String, String> completion;

    public PromptingExternalMatcher(@Nonnull Function<String, String> completion) {
        this.completion = Objects.requireNonNull(completion);
    }

    @Override
    public List<ExternalMatch> match(
            List<MatchCandidate> expectedItems, List<MatchCandidate> actualItems) {
        if (expectedItems.isEmpty() || actualItems.isEmpty()) {
            return List.of();
        }
        var response = completion.apply(buildPrompt(expectedItems, actualItems));
        return parseResponse(response, expectedItems.size());
    }

    static String buildPrompt(
            List<MatchCandidate> expectedItems, List<MatchCandidate> actualItems) {
        var prompt = new StringBuilder();
        prompt.append("Match the items of the expected list to the items of the actual list.\n\n");
        prompt.append("# Expected items\n");
        for (var item : expectedItems) {
            prompt.append(item.index()).append(": ").append(item.rendering()).append('\n');
        }
        prompt.append("\n# Actual items\n");
        for (var item : actualItems) {
            prompt.append(item.index()).append(": ").append(item.rendering()).append('\n');
        }
        prompt.append(
                """

                # Matching rules
                1. Match items whose names are the same or similar.
                2. Allow for abbreviations, spelling variants and partial matches \
                (e.g. "pump" and "pump motor unit").
                3. Prefer pairs whose quantity and unit price agree.
                4. Treat supplied items (price 0) with care.

                # Output format
                Answer with JSON only:
                {
                  "matches": [
                    {"expected_index": 0, "actual_index": 3, "confidence": 0.95, \
                "reason": "same name and quantity"},
                    {"expected_index": 1, "actual_index": -1, "confidence": 0.0, \
                "reason": "no corresponding item"}
                  ]
                }

                Return exactly one entry for every expected item.
                Use actual_index -1 when an expected item has no counterpart.
                """);
        return prompt.toString();
    }

    /**
     * Read the decisions from a model answer. The first entry per valid expected index is kept,
     * expected indices without an entry are reported as unmatched, and the result is sorted by
     * expected index.
     */
    static List<ExternalMatch> parseResponse(String response, int expectedCount) {
        JsonNode matches;
        try {
            matches = extractMatches(response);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("could not read item matching response: {}", e.getMessage());
            return IntStream.range(0, expectedCount).mapToObj(ExternalMatch::unmatched).toList();
        }

        var result = new ArrayList<ExternalMatch>();
        var seen = new HashSet<Integer>();
        for (var entry : matches) {
            int expectedIndex = entry.path("expected_index").asInt(-1);
            if (expectedIndex < 0 || expectedIndex >= expectedCount || !seen.add(expectedIndex)) {
                continue;
            }
            var reason = entry.path("reason");
            result.add(
                    new ExternalMatch(
                            expectedIndex,
                            entry.path("actual_index").asInt(ExternalMatch.NO_MATCH),
                            entry.path("confidence").asDouble(0.0),
                            reason.isTextual() ? reason.asText() : null));
        }
        for (int i = 0; i < expectedCount; i++) {
            if (!seen.contains(i)) {
                result.add(ExternalMatch.unmatched(i));
            }
        }
        result.sort(Comparator.comparingInt(ExternalMatch::expectedIndex));
        return List.copyOf(result);
    }

    private static JsonNode extractMatches(String response) throws JsonProcessingException {
        if (response == null) {
            throw new IllegalArgumentException("empty response");
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("no JSON object in response");
        }
        var root = EvalJsonMapper.readTree(response.substring(start, end + 1));
        if (root.path("data").isObject()) {
            root = root.get("data");
        }
        var matches = root.path("matches");
        if (!matches.isArray()) {
            throw new IllegalArgumentException("response has no matches array");
        }
        return matches;
    }
}
