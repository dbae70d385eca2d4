package io.github.cyfko.cohortql.core.exception;

/**
 * Raised when query text or variables cannot be emitted from a filter structure.
 *
 * @since 1.0.0
 */
public class QueryGenerationException extends PipelineException {

    public QueryGenerationException(String message) {
        super(Stage.QUERY_GENERATION, message);
    }

    public QueryGenerationException(String message, Throwable cause) {
        super(Stage.QUERY_GENERATION, message, cause);
    }
}
