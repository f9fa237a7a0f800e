package dev.extractioneval.compare;

import dev.extractioneval.config.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Resolves the comparator for a field name.
 *
 * <p>Fields without a binding are compared with {@link FieldComparator#SIMPLE}. Line-item
 * sub-fields are looked up by their dotted name, e.g. {@code items.price}.
 *
 * <p>Bindings are meant to be registered while a session is set up. Once evaluation starts the
 * registry is only read, and may then be shared between threads.
 */
@NotThreadSafe
public final class ComparatorRegistry {
    public static final String SIMPLE = "simple";
    public static final String AMOUNT = "amount";
    public static final String DATE = "date";
    public static final String TOTAL_PRICE = "total_price";
    public static final String TAX_PRICE = "tax_price";
    public static final String COMPANY_NAME = "company_name";

    private static final Map<String, FieldComparator> STRATEGIES =
            Map.of(
                    SIMPLE, FieldComparator.SIMPLE,
                    AMOUNT, FieldComparator.AMOUNT,
                    DATE, FieldComparator.DATE,
                    TOTAL_PRICE, FieldComparator.TOTAL_PRICE,
                    TAX_PRICE, FieldComparator.TAX_PRICE,
                    COMPANY_NAME, FieldComparator.COMPANY_NAME);

    private static final Map<String, String> DEFAULT_BINDINGS = defaultBindings();

    private final Map<String, String> bindings;

    private ComparatorRegistry(Map<String, String> bindings) {
        this.bindings = new LinkedHashMap<>(bindings);
    }

    /** A registry holding the built-in bindings for amount and date fields. */
    public static ComparatorRegistry withDefaults() {
        return new ComparatorRegistry(DEFAULT_BINDINGS);
    }

    /** A registry without bindings. Every field is compared as text until registered. */
    public static ComparatorRegistry empty() {
        return new ComparatorRegistry(Map.of());
    }

    private static Map<String, String> defaultBindings() {
        var bindings = new LinkedHashMap<String, String>();
        bindings.put("total_price", AMOUNT);
        bindings.put("tax_price", AMOUNT);
        bindings.put("sub_total", AMOUNT);
        bindings.put("doc_date", DATE);
        bindings.put("expiration_date", DATE);
        bindings.put("items.price", AMOUNT);
        bindings.put("items.sub_total", AMOUNT);
        bindings.put("items.quantity", AMOUNT);
        return Collections.unmodifiableMap(bindings);
    }

    /**
     * Bind a field name to a strategy, replacing any earlier binding.
     *
     * @throws ConfigurationException if the strategy identifier is unknown
     */
    public ComparatorRegistry register(@Nonnull String fieldName, @Nonnull String strategyId) {
        if (fieldName == null || fieldName.isBlank()) {
            throw new ConfigurationException("field name is required");
        }
        strategy(strategyId);
        bindings.put(fieldName, strategyId);
        return this;
    }

    /** The comparator for a field, {@link FieldComparator#SIMPLE} when unbound. */
    @Nonnull
    public FieldComparator comparatorFor(@Nonnull String fieldName) {
        var strategyId = bindings.get(fieldName);
        return strategyId == null ? FieldComparator.SIMPLE : STRATEGIES.get(strategyId);
    }

    /**
     * The comparator registered under a strategy identifier.
     *
     * @throws ConfigurationException if the identifier is unknown
     */
    @Nonnull
    public static FieldComparator strategy(String strategyId) {
        var comparator = strategyId == null ? null : STRATEGIES.get(strategyId);
        if (comparator == null) {
            throw new ConfigurationException(
                    "Unknown comparator type: %s (known: %s)"
                            .formatted(strategyId, new TreeSet<>(STRATEGIES.keySet())));
        }
        return comparator;
    }

    /** Current field name to strategy identifier bindings. */
    public Map<String, String> bindings() {
        return Collections.unmodifiableMap(bindings);
    }
}
