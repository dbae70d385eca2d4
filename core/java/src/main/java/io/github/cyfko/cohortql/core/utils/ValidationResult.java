package io.github.cyfko.cohortql.core.utils;

import java.util.List;

/**
 * Result of a validation operation.
 * <p>
 * A failed result carries every violation that was found, not only the first one, so callers can
 * report them all at once. Instances are immutable and created through {@link #success()},
 * {@link #failure(String)} or {@link #failures(List)}.
 * </p>
 *
 * <pre>{@code
 * ValidationResult result = validator.validateFilter(filter);
 * if (!result.isValid()) {
 *     result.getViolations().forEach(System.out::println);
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of());

    private final List<String> violations;

    private ValidationResult(List<String> violations) {
        this.violations = violations;
    }

    /**
     * @return a valid result with no violation
     */
    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @param errorMessage the single violation
     * @return an invalid result
     */
    public static ValidationResult failure(String errorMessage) {
        return new ValidationResult(List.of(errorMessage));
    }

    /**
     * @param violations all violations found; an empty list yields {@link #success()}
     * @return the corresponding result
     */
    public static ValidationResult failures(List<String> violations) {
        return violations.isEmpty() ? SUCCESS : new ValidationResult(List.copyOf(violations));
    }

    /**
     * @return true if no violation was found
     */
    public boolean isValid() {
        return violations.isEmpty();
    }

    /**
     * @return the violations in discovery order, empty when valid
     */
    public List<String> getViolations() {
        return violations;
    }

    /**
     * @return the first violation, or null if valid
     */
    public String getErrorMessage() {
        return violations.isEmpty() ? null : violations.get(0);
    }

    @Override
    public String toString() {
        return isValid() ? "ValidationResult[valid=true]"
                : "ValidationResult[valid=false, violations=" + violations + "]";
    }
}
