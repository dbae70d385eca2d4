package io.github.cyfko.cohortql.core.search;

import java.util.List;

/**
 * Term lookup against the field catalog.
 *
 * @since 1.0.0
 */
public interface CatalogSearch {

    /**
     * Finds the fields matching {@code term}, best first.
     *
     * @param term          raw term; cleaned before lookup
     * @param maxCandidates maximum number of candidates, positive
     * @return at most {@code maxCandidates} candidates, one per field path, sorted by descending score
     */
    List<FieldCandidate> search(String term, int maxCandidates);

    /**
     * Same as {@link #search(String, int)} with the configured default number of candidates.
     *
     * @param term raw term
     * @return the candidates
     */
    List<FieldCandidate> search(String term);
}
