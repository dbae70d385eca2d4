package io.github.cyfko.cohortql.core.exception;

/**
 * Raised when candidate fields cannot be resolved to one field per term, for instance
 * when the candidate list itself is missing or an enum value cannot be matched under
 * {@link io.github.cyfko.cohortql.core.config.EnumFallbackPolicy#ESCALATE}.
 *
 * @since 1.0.0
 */
public class ConflictResolutionException extends PipelineException {

    public ConflictResolutionException(String message) {
        super(Stage.CONFLICT_RESOLUTION, message);
    }

    public ConflictResolutionException(String message, Throwable cause) {
        super(Stage.CONFLICT_RESOLUTION, message, cause);
    }
}
