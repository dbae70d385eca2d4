package io.github.cyfko.cohortql.core.spi;

import java.util.Map;

/**
 * Sends a generated query to the remote GraphQL endpoint.
 * <p>
 * Transport, authentication and retries are the implementation's business. A failed execution
 * may be reported either through {@link ExecutionResult#failure} or by throwing; the pipeline
 * wraps thrown exceptions as
 * {@link io.github.cyfko.cohortql.core.exception.PipelineException.Stage#QUERY_EXECUTION} failures.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface GraphQLExecutionClient {

    /**
     * @param query     query text
     * @param variables query variables
     * @return the execution outcome, never {@code null}
     */
    ExecutionResult execute(String query, Map<String, Object> variables);
}
