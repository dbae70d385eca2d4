package io.github.cyfko.cohortql.core.model;

import io.github.cyfko.cohortql.core.api.Combinator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Terms extracted from a user request together with the combinator that joins them.
 * <p>
 * Produced by a {@link io.github.cyfko.cohortql.core.spi.TermExtractor} or built directly by
 * callers that already know their terms.
 * </p>
 *
 * @param terms      extracted terms, in request order
 * @param logic      how the resulting conditions are combined
 * @param rawQuery   the request text, may be empty
 * @param confidence overall extraction confidence in {@code [0, 1]}
 * @since 1.0.0
 */
public record ParsedQuery(List<ParsedTerm> terms, Combinator logic, String rawQuery, double confidence) {

    public ParsedQuery {
        terms = List.copyOf(Objects.requireNonNull(terms, "terms"));
        logic = logic == null ? Combinator.AND : logic;
        rawQuery = rawQuery == null ? "" : rawQuery;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got: " + confidence);
        }
    }

    /**
     * Builds a query from plain normalized terms.
     *
     * @param logic the combinator
     * @param terms the terms, in order
     * @return the parsed query
     */
    public static ParsedQuery of(Combinator logic, String... terms) {
        List<ParsedTerm> parsed = new ArrayList<>(terms.length);
        for (int i = 0; i < terms.length; i++) {
            parsed.add(ParsedTerm.of(terms[i], i));
        }
        return new ParsedQuery(parsed, logic, String.join(" ", terms), 1.0);
    }
}
