package dev.extractioneval.matching;

import java.util.List;

/**
 * A pairing capability that {@link ItemMatcher} can delegate to instead of its own rules, typically
 * backed by a language model.
 *
 * <p>Implementations should return one decision per expected item. Missing, duplicate or
 * out-of-range decisions are tolerated and read as "no match". Any exception thrown is logged by
 * the caller and every expected item is then left unmatched. Timeouts and retries are the
 * implementation's concern.
 */
@FunctionalInterface
public interface ExternalMatcher {
    List<ExternalMatch> match(List<MatchCandidate> expectedItems, List<MatchCandidate> actualItems);
}
