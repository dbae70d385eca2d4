package io.github.cyfko.cohortql.core.search;

import java.util.List;

/**
 * Candidates found for a batch of terms, and the terms nothing matched.
 *
 * @param candidates     all candidates, grouped by term in term order
 * @param unmatchedTerms terms without any candidate
 * @since 1.0.0
 */
public record FieldMatches(List<FieldCandidate> candidates, List<String> unmatchedTerms) {

    public FieldMatches {
        candidates = List.copyOf(candidates);
        unmatchedTerms = List.copyOf(unmatchedTerms);
    }
}
