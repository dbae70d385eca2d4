package io.github.cyfko.cohortql.core.codec;

/**
 * Shape of a {@link FilterState}.
 *
 * @since 1.0.0
 */
public enum FilterKind {
    /** {@code values} maps field keys to selections. */
    STANDARD,
    /** {@code children} holds sub-states joined by the combine mode. */
    COMPOSED
}
