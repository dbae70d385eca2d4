package io.github.cyfko.cohortql.core.catalog;

/**
 * Size of a built catalog index.
 *
 * @param totalFields  indexed fields
 * @param indexedTerms distinct indexed terms and tokens
 * @param pathsIndexed distinct field paths
 * @since 1.0.0
 */
public record IndexStats(int totalFields, int indexedTerms, int pathsIndexed) {
}
