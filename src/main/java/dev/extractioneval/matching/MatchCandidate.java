package dev.extractioneval.matching;

import java.util.Map;

/**
 * A line item as handed to an {@link ExternalMatcher}.
 *
 * @param index position of the item in its original list
 * @param item the item's fields
 * @param rendering one-line human-readable form of the item, see {@link ItemFormatter}
 */
public record MatchCandidate(int index, Map<String, Object> item, String rendering) {}
