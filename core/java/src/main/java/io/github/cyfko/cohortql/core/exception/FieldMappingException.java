package io.github.cyfko.cohortql.core.exception;

/**
 * Raised when catalog candidates cannot be looked up for the extracted terms.
 *
 * @since 1.0.0
 */
public class FieldMappingException extends PipelineException {

    public FieldMappingException(String message) {
        super(Stage.FIELD_MAPPING, message);
    }

    public FieldMappingException(String message, Throwable cause) {
        super(Stage.FIELD_MAPPING, message, cause);
    }
}
