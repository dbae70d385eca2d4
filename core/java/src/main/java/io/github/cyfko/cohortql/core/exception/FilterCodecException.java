package io.github.cyfko.cohortql.core.exception;

/**
 * Exception thrown when a filter cannot be converted between its wire form and a
 * {@link io.github.cyfko.cohortql.core.codec.FilterState}.
 * <p>
 * Raised for malformed wire input: an object carrying more than one key, a combinator whose
 * value is not an array, a {@code nested} block without a {@code path}, or an unknown operator.
 * The decoder validates its input instead of picking an arbitrary key.
 * </p>
 *
 * <pre>{@code
 * try {
 *     FilterNode node = mapper.read("{\"IN\":{\"sex\":[\"Male\"]},\"OR\":[]}");
 * } catch (FilterCodecException e) {
 *     // "Filter object must have exactly one key, got [IN, OR]"
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterCodecException extends RuntimeException {

    /**
     * @param message the description of the malformed input
     */
    public FilterCodecException(String message) {
        super(message);
    }

    /**
     * @param message the description of the malformed input
     * @param cause   the original cause, typically a JSON processing error
     */
    public FilterCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
