package io.github.cyfko.cohortql.core.exception;

import java.util.Objects;

/**
 * Base class of the stage-specific errors raised while turning resolved terms into a query.
 * <p>
 * A {@code PipelineException} is fatal for the request that raised it, and for that request only:
 * the built catalog index and every service instance remain usable. Per-item problems (one bad enum
 * match, one empty value) never surface as a {@code PipelineException}; they are skipped and logged.
 * </p>
 *
 * <p><strong>Stages:</strong></p>
 * <ul>
 *   <li>{@link Stage#FIELD_MAPPING} - searching the catalog for each term</li>
 *   <li>{@link Stage#CONFLICT_RESOLUTION} - choosing one field per term</li>
 *   <li>{@link Stage#FILTER_COMPOSITION} - building the filter tree</li>
 *   <li>{@link Stage#QUERY_GENERATION} - emitting query text and variables</li>
 *   <li>{@link Stage#QUERY_EXECUTION} - delegating to the external GraphQL client</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class PipelineException extends RuntimeException {

    /**
     * Pipeline stage in which a failure occurred.
     */
    public enum Stage {
        TERM_EXTRACTION,
        FIELD_MAPPING,
        CONFLICT_RESOLUTION,
        FILTER_COMPOSITION,
        QUERY_GENERATION,
        QUERY_EXECUTION
    }

    private final Stage stage;

    /**
     * @param stage   the failing stage
     * @param message description of the failure
     */
    public PipelineException(Stage stage, String message) {
        super(message);
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    /**
     * @param stage   the failing stage
     * @param message description of the failure
     * @param cause   the original cause
     */
    public PipelineException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = Objects.requireNonNull(stage, "stage");
    }

    /**
     * @return the stage that raised this exception
     */
    public Stage getStage() {
        return stage;
    }
}
