package io.github.cyfko.cohortql.core.search;

import io.github.cyfko.cohortql.core.catalog.CatalogField;

import java.util.Objects;

/**
 * A catalog field considered as a possible match for a term.
 *
 * @param term        the cleaned term that matched
 * @param field       the matching field
 * @param matchScore  weighted score in [0, 1]
 * @param matchReason human readable explanation of the match
 * @param strategy    the strategy that produced the score
 * @since 1.0.0
 */
public record FieldCandidate(
        String term,
        CatalogField field,
        double matchScore,
        String matchReason,
        MatchStrategy strategy
) {

    public FieldCandidate {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(strategy, "strategy");
        if (matchScore < 0.0 || matchScore > 1.0 || Double.isNaN(matchScore)) {
            throw new IllegalArgumentException("matchScore must be within [0, 1], got: " + matchScore);
        }
        matchReason = matchReason == null ? "" : matchReason;
    }

    /**
     * @return the path of the matching field
     */
    public String fieldPath() {
        return field.path();
    }
}
