package io.github.cyfko.cohortql.core.resolve;

import java.util.List;

/**
 * Audit record of a term that matched several fields.
 *
 * @param term           the ambiguous term
 * @param candidatePaths paths of every candidate, in candidate order
 * @param chosenPath     the path that was kept
 * @param reason         why it was kept
 * @param confidence     confidence of the choice
 * @since 1.0.0
 */
public record ConflictRecord(
        String term,
        List<String> candidatePaths,
        String chosenPath,
        String reason,
        double confidence
) {

    public ConflictRecord {
        candidatePaths = List.copyOf(candidatePaths);
    }
}
