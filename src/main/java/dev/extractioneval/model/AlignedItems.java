package dev.extractioneval.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two item lists re-sequenced so that position {@code k} of each holds the same aligned pair.
 *
 * <p>Matched pairs come first in expected order, then unmatched expected items against an empty
 * placeholder, then unmatched actual items against an empty placeholder.
 */
public record AlignedItems(
        List<Map<String, Object>> expectedItems,
        List<Map<String, Object>> actualItems,
        /** match score of the pair at each position. zero for unmatched positions */
        List<Double> pairScores,
        ItemsMatchResult matchResult) {

    public AlignedItems {
        if (expectedItems.size() != actualItems.size()) {
            throw new IllegalArgumentException(
                    "aligned lists differ in size: %d != %d"
                            .formatted(expectedItems.size(), actualItems.size()));
        }
        if (pairScores.size() != expectedItems.size()) {
            throw new IllegalArgumentException(
                    "expected %d pair scores, got %d"
                            .formatted(expectedItems.size(), pairScores.size()));
        }
        pairScores = List.copyOf(pairScores);
        expectedItems = immutableItems(expectedItems);
        actualItems = immutableItems(actualItems);
    }

    public int size() {
        return expectedItems.size();
    }

    private static List<Map<String, Object>> immutableItems(List<Map<String, Object>> items) {
        return items.stream()
                .map(item -> Collections.unmodifiableMap(new LinkedHashMap<>(item)))
                .toList();
    }
}
