package dev.extractioneval.matching;

import dev.extractioneval.normalize.ValueNormalizer;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;

/** Renders a line item as one readable line: name, quantity with unit, unit price, spec, note. */
public final class ItemFormatter {
    private ItemFormatter() {}

    public static String render(Map<String, Object> item) {
        var parts = new ArrayList<String>();
        if (!ValueNormalizer.isEmpty(item.get("name"))) {
            parts.add("name: " + item.get("name"));
        }
        if (item.get("quantity") != null) {
            var unit = item.get("unit");
            parts.add("quantity: " + item.get("quantity") + (unit == null ? "" : unit));
        }
        if (item.get("price") != null) {
            parts.add("unit price: " + formatPrice(item.get("price")));
        }
        if (!ValueNormalizer.isEmpty(item.get("spec"))) {
            parts.add("spec: " + item.get("spec"));
        }
        if (!ValueNormalizer.isEmpty(item.get("note"))) {
            parts.add("note: " + item.get("note"));
        }
        return String.join(" / ", parts);
    }

    private static String formatPrice(Object price) {
        if (price instanceof Number number) {
            var format = NumberFormat.getNumberInstance(Locale.ROOT);
            format.setGroupingUsed(true);
            format.setMaximumFractionDigits(10);
            return format.format(number);
        }
        return price.toString();
    }
}
