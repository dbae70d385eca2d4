package io.github.cyfko.cohortql.core.resolve;

import java.util.List;

/**
 * Output of the conflict resolver.
 *
 * @param resolved  one resolved field per resolvable term, in term order
 * @param conflicts one record per term that had several candidates
 * @param warnings  unmatched terms, enum fallbacks and skipped terms
 * @since 1.0.0
 */
public record Resolution(List<ResolvedField> resolved, List<ConflictRecord> conflicts, List<String> warnings) {

    public Resolution {
        resolved = List.copyOf(resolved);
        conflicts = List.copyOf(conflicts);
        warnings = List.copyOf(warnings);
    }
}
