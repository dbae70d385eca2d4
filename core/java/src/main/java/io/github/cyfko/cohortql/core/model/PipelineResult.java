package io.github.cyfko.cohortql.core.model;

import io.github.cyfko.cohortql.core.api.FilterStructure;
import io.github.cyfko.cohortql.core.query.GraphQLQuery;
import io.github.cyfko.cohortql.core.resolve.Resolution;
import io.github.cyfko.cohortql.core.search.FieldMatches;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Every intermediate output of one pipeline run, in stage order.
 *
 * @param sessionId       caller supplied session id, or a generated one
 * @param parsedQuery     the input terms
 * @param fieldMatches    catalog candidates per term
 * @param resolution      chosen fields, conflicts and resolver warnings
 * @param filterStructure the composed filter
 * @param query           the generated query
 * @param warnings        composer and query advisory warnings
 * @param processingTime  wall clock time of the run
 * @since 1.0.0
 */
public record PipelineResult(
        String sessionId,
        ParsedQuery parsedQuery,
        FieldMatches fieldMatches,
        Resolution resolution,
        FilterStructure filterStructure,
        GraphQLQuery query,
        List<String> warnings,
        Duration processingTime
) {

    public PipelineResult {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(query, "query");
        warnings = List.copyOf(warnings);
    }
}
