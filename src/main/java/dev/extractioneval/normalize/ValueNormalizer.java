package dev.extractioneval.normalize;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** Parses raw extracted values into forms that can be compared. */
public final class ValueNormalizer {
    private static final Pattern CURRENCY_AND_SEPARATORS = Pattern.compile("[,¥￥$€£]");
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    /** Tried in order. Month-first wins over day-first for ambiguous slash dates. */
    private static final List<DateTimeFormatter> DATE_FORMATS =
            List.of(
                    strict("uuuu-M-d"),
                    strict("uuuu/M/d"),
                    strict("uuuu年M月d日"),
                    strict("M/d/uuuu"),
                    strict("d/M/uuuu"));

    // spacing forms must go before decomposition, NFKD turns them into a space plus a combining mark
    private static final Pattern SPACING_SOUND_MARKS = Pattern.compile("[\\u309B\\u309C]");
    private static final Pattern COMBINING_SOUND_MARKS = Pattern.compile("[\\u3099\\u309A]");

    private ValueNormalizer() {}

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * Read a monetary amount. Numbers are taken as-is; strings lose surrounding whitespace,
     * currency symbols and thousands separators before parsing.
     */
    public static double parseAmount(@Nullable Object value) throws ValueParseException {
        if (value instanceof Number number) {
            return requireFinite(number.doubleValue(), value);
        }
        if (value == null) {
            throw new ValueParseException("no amount to parse");
        }
        var cleaned = CURRENCY_AND_SEPARATORS.matcher(value.toString().strip()).replaceAll("");
        return parseDecimal(cleaned.strip(), value);
    }

    /**
     * Read a plain number, ignoring thousands separators. Unlike {@link #parseAmount} currency
     * symbols are not accepted.
     */
    public static double parseNumber(@Nullable Object value) throws ValueParseException {
        if (value instanceof Number number) {
            return requireFinite(number.doubleValue(), value);
        }
        if (value == null) {
            throw new ValueParseException("no number to parse");
        }
        return parseDecimal(value.toString().replace(",", "").strip(), value);
    }

    private static double parseDecimal(String text, Object original) throws ValueParseException {
        if (!DECIMAL.matcher(text).matches()) {
            throw new ValueParseException("not a number: '%s'".formatted(original));
        }
        return requireFinite(Double.parseDouble(text), original);
    }

    private static double requireFinite(double value, Object original)
            throws ValueParseException {
        if (!Double.isFinite(value)) {
            throw new ValueParseException("not a finite number: '%s'".formatted(original));
        }
        return value;
    }

    /** Read a calendar date. Time of day, when present, is dropped. */
    public static LocalDate parseDate(@Nullable Object value) throws ValueParseException {
        if (value instanceof LocalDate date) {
            return date;
        } else if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (value instanceof ZonedDateTime dateTime) {
            return dateTime.toLocalDate();
        } else if (value == null) {
            throw new ValueParseException("no date to parse");
        }
        var text = value.toString().strip();
        DateTimeParseException lastFailure = null;
        for (var format : DATE_FORMATS) {
            try {
                return LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new ValueParseException(
                "unrecognized date format: '%s'".formatted(text), lastFailure);
    }

    /** Case-folded, trimmed string form of a value. */
    @Nonnull
    public static String normalizeText(@Nullable Object value) {
        return String.valueOf(value).strip().toLowerCase(Locale.ROOT);
    }

    /**
     * Compatibility-normalize text and drop kana sound marks, so that {@code ポンプ} and {@code
     * ホンプ} read the same.
     */
    @Nonnull
    public static String foldSoundMarks(@Nonnull String text) {
        var withoutSpacing = SPACING_SOUND_MARKS.matcher(text).replaceAll("");
        var decomposed = Normalizer.normalize(withoutSpacing, Normalizer.Form.NFKD);
        var stripped = COMBINING_SOUND_MARKS.matcher(decomposed).replaceAll("");
        return Normalizer.normalize(stripped, Normalizer.Form.NFC);
    }

    /** null, the empty string and numeric zero all count as "no value". */
    public static boolean isEmpty(@Nullable Object value) {
        if (value == null) {
            return true;
        } else if (value instanceof CharSequence text) {
            return text.length() == 0;
        } else if (value instanceof Number number) {
            return number.doubleValue() == 0.0;
        }
        return false;
    }
}
