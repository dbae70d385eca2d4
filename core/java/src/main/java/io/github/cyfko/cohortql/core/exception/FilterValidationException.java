package io.github.cyfko.cohortql.core.exception;

import java.util.List;

/**
 * Exception thrown when a filter tree references unknown catalog fields or carries values of
 * the wrong type.
 * <p>
 * Unlike most validation errors this one does not stop at the first problem: every violation
 * found while walking the tree is collected and exposed through {@link #getViolations()}, so a
 * caller can report all of them at once.
 * </p>
 *
 * <pre>{@code
 * try {
 *     validator.requireValid(filter);
 * } catch (FilterValidationException e) {
 *     e.getViolations().forEach(v -> response.addError(v));
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see io.github.cyfko.cohortql.core.catalog.FieldValidator#validateFilter
 */
public class FilterValidationException extends RuntimeException {

    private final List<String> violations;

    /**
     * Creates an exception with a single violation.
     *
     * @param message the violation
     */
    public FilterValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    /**
     * Creates an exception carrying every violation found.
     *
     * @param violations all violations, must not be empty
     */
    public FilterValidationException(List<String> violations) {
        super("Filter validation failed with " + violations.size() + " violation(s): " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return immutable list of violation messages, in discovery order
     */
    public List<String> getViolations() {
        return violations;
    }
}
