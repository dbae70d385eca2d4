package io.github.cyfko.cohortql.core.utils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Conversions applied to resolved values before they enter a filter.
 *
 * <h2>Rules</h2>
 * <dl>
 *   <dt><strong>Numbers</strong></dt>
 *   <dd>A string made only of digits once {@code '.'} and {@code '-'} are removed is parsed:
 *   to a {@link Double} when it contains a dot, to a {@link Long} otherwise. Anything else is
 *   kept as a string.</dd>
 *
 *   <dt><strong>Booleans</strong></dt>
 *   <dd>{@code true}, {@code yes}, {@code 1} and {@code y} (any case) are truthy; every other
 *   string is false.</dd>
 * </dl>
 *
 * @since 1.0.0
 */
public final class ValueCoercion {

    /** Strings read as {@code true}. */
    public static final Set<String> TRUTHY = Set.of("true", "yes", "1", "y");

    /** Strings read as {@code false} when a value must be recognised as boolean. */
    public static final Set<String> FALSY = Set.of("false", "no", "0", "n");

    private ValueCoercion() {
        // utility class
    }

    /**
     * Parses numeric-looking strings; numbers pass through, anything else becomes its string form.
     *
     * @param value the raw value
     * @return a {@link Number} or a {@link String}; {@code null} for {@code null}
     */
    public static Object toNumberIfNumeric(Object value) {
        if (value == null || value instanceof Number) return value;
        String text = value.toString();
        if (looksNumeric(text)) {
            try {
                if (text.contains(".")) return Double.parseDouble(text);
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return text;
            }
        }
        return text;
    }

    /**
     * @param text candidate text
     * @return true when the text is non-empty and only digits remain after removing dots and minus signs
     */
    public static boolean looksNumeric(String text) {
        String digits = text.replace(".", "").replace("-", "");
        if (digits.isEmpty()) return false;
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) return false;
        }
        return true;
    }

    /**
     * @param value a boolean or a string
     * @return the boolean reading of the value; non-string, non-boolean values are true unless null
     */
    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) return bool;
        if (value instanceof String text) return TRUTHY.contains(text.strip().toLowerCase(Locale.ROOT));
        if (value instanceof Number number) return number.doubleValue() != 0;
        return value != null;
    }

    /**
     * @param text a string
     * @return true when the text is one of {@link #TRUTHY} or {@link #FALSY}, ignoring case
     */
    public static boolean isBooleanLiteral(String text) {
        String normalized = text.strip().toLowerCase(Locale.ROOT);
        return TRUTHY.contains(normalized) || FALSY.contains(normalized);
    }

    /**
     * @param value a scalar or a collection
     * @return the non-null elements of a collection, a singleton list of a scalar, or an empty list for null
     */
    public static List<Object> toList(Object value) {
        List<Object> items = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null) items.add(item);
            }
        } else if (value != null) {
            items.add(value);
        }
        return items;
    }

    /**
     * @param value any value
     * @return true for null, blank strings and empty collections
     */
    public static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String text) return text.isBlank();
        if (value instanceof Collection<?> collection) return collection.isEmpty();
        return false;
    }
}
