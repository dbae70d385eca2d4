package io.github.cyfko.cohortql.core.exception;

/**
 * Raised when resolved fields cannot be composed into a filter tree: malformed resolved-field
 * data (missing path or type) or a violated tree invariant such as a second nesting level.
 *
 * @since 1.0.0
 */
public class FilterCompositionException extends PipelineException {

    public FilterCompositionException(String message) {
        super(Stage.FILTER_COMPOSITION, message);
    }

    public FilterCompositionException(String message, Throwable cause) {
        super(Stage.FILTER_COMPOSITION, message, cause);
    }
}
