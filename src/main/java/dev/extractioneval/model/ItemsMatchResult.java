package dev.extractioneval.model;

import java.util.List;

/**
 * Alignment of two line-item lists.
 *
 * @param score mean match score over the expected items, in [0, 1]
 * @param matches one entry per expected item, in expected-list order
 */
public record ItemsMatchResult(double score, List<ItemMatch> matches) {
    public ItemsMatchResult {
        matches = List.copyOf(matches);
    }
}
