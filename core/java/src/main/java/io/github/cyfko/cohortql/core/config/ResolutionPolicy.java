package io.github.cyfko.cohortql.core.config;

import java.util.Objects;

/**
 * Configuration of the conflict resolver.
 *
 * @param enumFallback behaviour when no enum value matches the term
 * @since 1.0.0
 */
public record ResolutionPolicy(EnumFallbackPolicy enumFallback) {

    public ResolutionPolicy {
        Objects.requireNonNull(enumFallback, "enumFallback");
    }

    /**
     * @return configuration with {@link EnumFallbackPolicy#FIRST_VALUE}
     */
    public static ResolutionPolicy defaults() {
        return new ResolutionPolicy(EnumFallbackPolicy.FIRST_VALUE);
    }

    /**
     * @return configuration with {@link EnumFallbackPolicy#ESCALATE}
     */
    public static ResolutionPolicy strict() {
        return new ResolutionPolicy(EnumFallbackPolicy.ESCALATE);
    }
}
