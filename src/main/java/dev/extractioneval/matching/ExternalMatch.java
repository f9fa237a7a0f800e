package dev.extractioneval.matching;

import javax.annotation.Nullable;

/**
 * One pairing decision returned by an {@link ExternalMatcher}.
 *
 * @param expectedIndex index into the expected items
 * @param actualIndex index into the actual items, or {@link #NO_MATCH}
 * @param confidence confidence in [0, 1]; becomes the match score of the pair
 * @param reason optional explanation of the decision
 */
public record ExternalMatch(
        int expectedIndex, int actualIndex, double confidence, @Nullable String reason) {
    public static final int NO_MATCH = -1;

    public static ExternalMatch of(int expectedIndex, int actualIndex, double confidence) {
        return new ExternalMatch(expectedIndex, actualIndex, confidence, null);
    }

    public static ExternalMatch unmatched(int expectedIndex) {
        return new ExternalMatch(expectedIndex, NO_MATCH, 0.0, null);
    }
}
