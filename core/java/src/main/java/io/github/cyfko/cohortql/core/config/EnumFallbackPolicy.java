package io.github.cyfko.cohortql.core.config;

/**
 * What the conflict resolver does when a term chosen for an enumeration field matches none of
 * the field's enum values.
 *
 * @since 1.0.0
 */
public enum EnumFallbackPolicy {

    /**
     * Use the field's first enum value and record a warning. Matches the historical behaviour.
     */
    FIRST_VALUE,

    /**
     * Drop the term: no resolved field is produced and a warning is recorded.
     */
    DROP,

    /**
     * Fail the request with a {@link io.github.cyfko.cohortql.core.exception.ConflictResolutionException}.
     */
    ESCALATE
}
