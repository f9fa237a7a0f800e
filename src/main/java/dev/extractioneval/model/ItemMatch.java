package dev.extractioneval.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Pairing of one expected line item with its best counterpart on the actual side. */
public record ItemMatch(
        /** the expected item. empty when the pair has no expected side */
        @Nonnull Map<String, Object> expectedItem,
        /** the paired actual item, or null when no counterpart was found */
        @Nullable Map<String, Object> matchedItem,
        /** index of {@link #matchedItem} in the actual list, or -1 */
        int matchedIndex,
        /** similarity in [0, 1] */
        double matchScore,
        /** per sub-field agreement behind the score */
        @Nonnull Map<String, Boolean> fieldMatches,
        /** explanation supplied by an external matcher */
        @Nullable String matchReason) {

    public static final int NO_MATCH = -1;

    public ItemMatch {
        if (!(matchScore >= 0.0 && matchScore <= 1.0)) {
            throw new IllegalArgumentException("match score must be in [0, 1]: " + matchScore);
        }
        if ((matchedItem == null) != (matchedIndex == NO_MATCH)) {
            throw new IllegalArgumentException(
                    "matched item and index disagree: index=" + matchedIndex);
        }
        expectedItem = Collections.unmodifiableMap(new LinkedHashMap<>(expectedItem));
        if (matchedItem != null) {
            matchedItem = Collections.unmodifiableMap(new LinkedHashMap<>(matchedItem));
        }
        fieldMatches = Collections.unmodifiableMap(new LinkedHashMap<>(fieldMatches));
    }

    /** An expected item for which no actual item was found. */
    public static ItemMatch unmatched(Map<String, Object> expectedItem, @Nullable String reason) {
        return new ItemMatch(expectedItem, null, NO_MATCH, 0.0, Map.of(), reason);
    }

    @JsonIgnore
    public boolean hasMatch() {
        return matchedItem != null;
    }
}
