package io.github.cyfko.cohortql.core.api;

import java.util.Locale;

/**
 * Logical operator joining sibling filter conditions.
 *
 * @since 1.0.0
 */
public enum Combinator {

    /** All children must match. */
    AND,

    /** At least one child must match. */
    OR;

    /**
     * Parses a combinator name, ignoring case and surrounding whitespace.
     *
     * @param value the name, e.g. {@code "and"} or {@code "OR"}
     * @return the matching combinator
     * @throws IllegalArgumentException if {@code value} is neither AND nor OR
     */
    public static Combinator fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Combinator value is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Combinator combinator : values()) {
            if (combinator.name().equals(normalized)) {
                return combinator;
            }
        }
        throw new IllegalArgumentException("Unknown combinator: " + value);
    }

    /**
     * @param name a candidate wire key
     * @return {@code true} if {@code name} is exactly {@code "AND"} or {@code "OR"}
     */
    public static boolean isCombinatorKey(String name) {
        return AND.name().equals(name) || OR.name().equals(name);
    }

    /**
     * @return the lower-case word used in human readable descriptions
     */
    public String word() {
        return name().toLowerCase(Locale.ROOT);
    }
}
