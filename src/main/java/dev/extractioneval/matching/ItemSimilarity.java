package dev.extractioneval.matching;

import dev.extractioneval.normalize.ValueNormalizer;
import dev.extractioneval.normalize.ValueParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Weighted similarity between two line items.
 *
 * <p>Every field present on either side contributes its weight to the denominator, except fields
 * empty on both sides: those count as agreeing but carry no weight. The {@code name} field is
 * compared with a layered fuzzy heuristic; other fields compare numerically when both sides parse
 * as numbers and as case-insensitive text otherwise.
 */
public final class ItemSimilarity {
    public static final String NAME_FIELD = "name";

    /** Sub-field weights used when no table is configured. */
    public static final Map<String, Double> DEFAULT_FIELD_WEIGHTS = defaultFieldWeights();

    private static final double NUMERIC_TOLERANCE = 0.01;
    private static final Pattern WORD_SEPARATORS =
            Pattern.compile("[\\s\\-_]+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, Double> fieldWeights;
    private final double defaultWeight;
    private final double nameTokenRatio;

    /**
     * @param fieldWeights weight of each sub-field, without the {@code items.} prefix
     * @param defaultWeight weight of sub-fields missing from the table
     * @param nameTokenRatio minimum shared-word ratio for the last name heuristic
     */
    public ItemSimilarity(
            @Nonnull Map<String, Double> fieldWeights,
            double defaultWeight,
            double nameTokenRatio) {
        this.fieldWeights = Map.copyOf(fieldWeights);
        this.defaultWeight = defaultWeight;
        this.nameTokenRatio = nameTokenRatio;
    }

    public static ItemSimilarity withDefaults() {
        return new ItemSimilarity(DEFAULT_FIELD_WEIGHTS, 1.0, 0.5);
    }

    private static Map<String, Double> defaultFieldWeights() {
        var weights = new LinkedHashMap<String, Double>();
        weights.put("name", 3.0);
        weights.put("quantity", 2.0);
        weights.put("price", 2.0);
        weights.put("sub_total", 2.0);
        weights.put("unit", 1.0);
        weights.put("spec", 1.0);
        weights.put("note", 0.5);
        weights.put("account_item", 1.0);
        return Collections.unmodifiableMap(weights);
    }

    /**
     * @param score weighted share of agreeing fields, in [0, 1]. zero when every field is empty on
     *     both sides
     * @param fieldMatches agreement of each field from either item
     */
    public record Similarity(double score, Map<String, Boolean> fieldMatches) {}

    public Similarity similarity(
            @Nonnull Map<String, Object> expectedItem, @Nonnull Map<String, Object> actualItem) {
        var fields = new LinkedHashSet<>(expectedItem.keySet());
        fields.addAll(actualItem.keySet());

        double totalWeight = 0.0;
        double matchedWeight = 0.0;
        var fieldMatches = new LinkedHashMap<String, Boolean>();
        for (var field : fields) {
            var expected = expectedItem.get(field);
            var actual = actualItem.get(field);
            if (ValueNormalizer.isEmpty(expected) && ValueNormalizer.isEmpty(actual)) {
                fieldMatches.put(field, true);
                continue;
            }
            var weight = weightOf(field);
            totalWeight += weight;
            var isMatch =
                    NAME_FIELD.equals(field)
                            ? namesMatch(expected, actual)
                            : valuesMatch(expected, actual);
            fieldMatches.put(field, isMatch);
            if (isMatch) {
                matchedWeight += weight;
            }
        }
        var score = totalWeight > 0 ? matchedWeight / totalWeight : 0.0;
        return new Similarity(score, Collections.unmodifiableMap(fieldMatches));
    }

    public double weightOf(String field) {
        return fieldWeights.getOrDefault(field, defaultWeight);
    }

    /**
     * Fuzzy item-name comparison. In order: exact match, containment either way, containment
     * ignoring kana sound marks, then the share of common words against the shorter name. Words are
     * split on any Unicode whitespace, hyphens and underscores. A blank name is contained in every
     * other name and so matches it; only a missing name never matches.
     */
    boolean namesMatch(@Nullable Object expected, @Nullable Object actual) {
        if (expected == null || actual == null) {
            return false;
        }
        var expectedName = ValueNormalizer.normalizeText(expected);
        var actualName = ValueNormalizer.normalizeText(actual);
        if (expectedName.equals(actualName)) {
            return true;
        }
        if (containsEitherWay(expectedName, actualName)) {
            return true;
        }
        if (containsEitherWay(
                ValueNormalizer.foldSoundMarks(expectedName),
                ValueNormalizer.foldSoundMarks(actualName))) {
            return true;
        }
        var expectedWords = words(expectedName);
        var actualWords = words(actualName);
        if (expectedWords.isEmpty() || actualWords.isEmpty()) {
            return false;
        }
        var common = new HashSet<>(expectedWords);
        common.retainAll(actualWords);
        double ratio = (double) common.size() / Math.min(expectedWords.size(), actualWords.size());
        return ratio >= nameTokenRatio;
    }

    private static boolean containsEitherWay(String a, String b) {
        return a.contains(b) || b.contains(a);
    }

    private static Set<String> words(String text) {
        return Arrays.stream(WORD_SEPARATORS.split(text))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toSet());
    }

    boolean valuesMatch(@Nullable Object expected, @Nullable Object actual) {
        if (ValueNormalizer.isEmpty(expected) && ValueNormalizer.isEmpty(actual)) {
            return true;
        }
        if (expected == null || actual == null) {
            return false;
        }
        try {
            var difference =
                    ValueNormalizer.parseNumber(expected) - ValueNormalizer.parseNumber(actual);
            return Math.abs(difference) < NUMERIC_TOLERANCE;
        } catch (ValueParseException e) {
            return ValueNormalizer.normalizeText(expected)
                    .equals(ValueNormalizer.normalizeText(actual));
        }
    }
}
