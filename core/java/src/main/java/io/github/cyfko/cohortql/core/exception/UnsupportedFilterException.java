package io.github.cyfko.cohortql.core.exception;

/**
 * Thrown when a {@link io.github.cyfko.cohortql.core.codec.FilterState} holds a selection the wire
 * grammar cannot express, such as an anchored (ordered) filter or an excluded option set.
 * <p>
 * The encoder fails loudly rather than dropping the user's selection without notice.
 * </p>
 *
 * @since 1.0.0
 */
public class UnsupportedFilterException extends FilterCodecException {

    private final String key;

    /**
     * @param key     the FilterState key holding the unsupported value
     * @param message description of what is unsupported
     */
    public UnsupportedFilterException(String key, String message) {
        super(message);
        this.key = key;
    }

    /**
     * @return the FilterState key holding the unsupported value
     */
    public String getKey() {
        return key;
    }
}
