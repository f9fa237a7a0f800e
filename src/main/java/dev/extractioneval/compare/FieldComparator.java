package dev.extractioneval.compare;

import dev.extractioneval.model.FieldEvaluationResult;
import dev.extractioneval.normalize.ValueNormalizer;
import dev.extractioneval.normalize.ValueParseException;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Compares one expected/actual value pair under a fixed strategy.
 *
 * <p>Both values null is always a match and exactly one null is always a mismatch, whatever the
 * strategy. Values that the amount or date strategies cannot parse are compared as text instead,
 * so a malformed value never aborts the evaluation of a document.
 *
 * @param strategy how values are read before comparison
 * @param tolerance maximum absolute difference between two amounts. ignored by other strategies
 * @param inclusive whether a difference equal to the tolerance still matches
 */
@Slf4j
public record FieldComparator(@Nonnull Strategy strategy, double tolerance, boolean inclusive) {

    public enum Strategy {
        /** case-insensitive, whitespace-trimmed text equality */
        SIMPLE,
        /** numeric equality within a tolerance */
        AMOUNT,
        /** same calendar day */
        DATE,
        /** text equality after unifying legal-entity designations */
        COMPANY_NAME
    }

    public static final FieldComparator SIMPLE = new FieldComparator(Strategy.SIMPLE, 0.0, false);
    public static final FieldComparator AMOUNT = amount(0.01, false);
    public static final FieldComparator TOTAL_PRICE = amount(1.0, false);
    public static final FieldComparator TAX_PRICE = amount(10.0, true);
    public static final FieldComparator DATE = new FieldComparator(Strategy.DATE, 0.0, false);
    public static final FieldComparator COMPANY_NAME =
            new FieldComparator(Strategy.COMPANY_NAME, 0.0, false);

    private static final Map<Pattern, String> COMPANY_DESIGNATIONS =
            Map.of(
                    Pattern.compile("株式会社|㈱|\\(株\\)"), "kabushikigaisha",
                    Pattern.compile("有限会社|㈲|\\(有\\)"), "yuugengaisha",
                    Pattern.compile("合同会社|\\(合\\)"), "goudougaisha");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public FieldComparator {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        if (!Double.isFinite(tolerance) || tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be non-negative: " + tolerance);
        }
    }

    /** An amount comparator with the given absolute tolerance. */
    public static FieldComparator amount(double tolerance, boolean inclusive) {
        return new FieldComparator(Strategy.AMOUNT, tolerance, inclusive);
    }

    public FieldEvaluationResult compare(
            String fieldName, @Nullable Object expected, @Nullable Object actual, double weight) {
        return compare(fieldName, expected, actual, weight, null);
    }

    public FieldEvaluationResult compare(
            String fieldName,
            @Nullable Object expected,
            @Nullable Object actual,
            double weight,
            @Nullable Integer itemIndex) {
        if (matches(expected, actual)) {
            return FieldEvaluationResult.createCorrect(
                    fieldName, expected, actual, weight, itemIndex, null);
        }
        return FieldEvaluationResult.createIncorrect(
                fieldName, expected, actual, weight, itemIndex, null);
    }

    public boolean matches(@Nullable Object expected, @Nullable Object actual) {
        if (expected == null && actual == null) {
            return true;
        }
        if (expected == null || actual == null) {
            return false;
        }
        return switch (strategy) {
            case SIMPLE -> textMatches(expected, actual);
            case AMOUNT -> amountMatches(expected, actual);
            case DATE -> dateMatches(expected, actual);
            case COMPANY_NAME -> companyName(expected).equals(companyName(actual));
        };
    }

    private static boolean textMatches(Object expected, Object actual) {
        var normalized = ValueNormalizer.normalizeText(expected);
        return normalized.equals(ValueNormalizer.normalizeText(actual));
    }

    private boolean amountMatches(Object expected, Object actual) {
        try {
            var difference =
                    Math.abs(
                            ValueNormalizer.parseAmount(expected)
                                    - ValueNormalizer.parseAmount(actual));
            return inclusive ? difference <= tolerance : difference < tolerance;
        } catch (ValueParseException e) {
            log.debug("comparing amounts as text: {}", e.getMessage());
            return textMatches(expected, actual);
        }
    }

    private static boolean dateMatches(Object expected, Object actual) {
        try {
            return ValueNormalizer.parseDate(expected).equals(ValueNormalizer.parseDate(actual));
        } catch (ValueParseException e) {
            log.debug("comparing dates as text: {}", e.getMessage());
            return textMatches(expected, actual);
        }
    }

    private static String companyName(Object value) {
        var name = value.toString().strip().toLowerCase(Locale.ROOT);
        for (var designation : COMPANY_DESIGNATIONS.entrySet()) {
            name = designation.getKey().matcher(name).replaceAll(designation.getValue());
        }
        return WHITESPACE.matcher(name).replaceAll("");
    }
}
