package io.github.cyfko.cohortql.core.api;

import java.util.List;
import java.util.Objects;

/**
 * A leaf predicate of the filter tree: {@code field operator value}.
 * <p>
 * Inside a {@link FilterNode.Nested} block {@code field} is local to the nested entity
 * ({@code "tumor_site"}), elsewhere it is a subject-level field name or, in the flat condition list
 * of a {@link FilterStructure}, the full catalog path ({@code "tumor_assessments.tumor_site"}).
 * For {@link Op#IN} the value is always a {@link List}.
 * </p>
 *
 * @param field    field name or path
 * @param operator the wire operator
 * @param value    the operand, a list for {@link Op#IN}
 * @since 1.0.0
 */
public record FilterCondition(String field, Op operator, Object value) {

    public FilterCondition {
        if (field == null || field.isBlank()) {
            throw new IllegalArgumentException("Condition field is required");
        }
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (operator == Op.IN) {
            if (!(value instanceof List<?>)) {
                throw new IllegalArgumentException("IN condition on '" + field + "' requires a list value");
            }
            value = List.copyOf((List<?>) value);
        }
    }

    /**
     * Creates an {@link Op#IN} condition.
     *
     * @param field  field name
     * @param values accepted values
     * @return the condition
     */
    public static FilterCondition in(String field, List<?> values) {
        return new FilterCondition(field, Op.IN, values);
    }

    /**
     * @return the values of an {@link Op#IN} condition, or a singleton list of the scalar value
     */
    public List<?> valuesAsList() {
        return value instanceof List<?> list ? list : List.of(value);
    }
}
