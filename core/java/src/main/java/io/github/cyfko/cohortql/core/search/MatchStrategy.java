package io.github.cyfko.cohortql.core.search;

/**
 * Strategy that produced a {@link FieldCandidate}.
 *
 * @since 1.0.0
 */
public enum MatchStrategy {
    /** The cleaned term equals an indexed term. */
    EXACT,
    /** Some tokens of the term are indexed tokens. */
    PARTIAL,
    /** The term is similar to a searchable term. */
    FUZZY
}
