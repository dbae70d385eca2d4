package io.github.cyfko.cohortql.core.resolve;

import io.github.cyfko.cohortql.core.catalog.FieldType;

/**
 * A term definitively mapped to one catalog field, with the value and operator to filter on.
 * <p>
 * {@code operator} is a resolver-level name ({@code eq}, {@code in}, {@code contains}, {@code gte}, ...);
 * the filter composer maps it to a wire operator. No validation happens here: the composer rejects
 * malformed records with a {@link io.github.cyfko.cohortql.core.exception.FilterCompositionException}.
 * </p>
 *
 * @param term       the term as matched
 * @param fieldPath  catalog field path
 * @param fieldType  field type
 * @param value      a scalar or a list of values
 * @param operator   resolver operator name
 * @param confidence resolution confidence in [0, 1]
 * @since 1.0.0
 */
public record ResolvedField(
        String term,
        String fieldPath,
        FieldType fieldType,
        Object value,
        String operator,
        double confidence
) {

    /**
     * Shortcut for a resolved field built by hand, with confidence 1.0.
     */
    public static ResolvedField of(String fieldPath, FieldType fieldType, Object value, String operator) {
        return new ResolvedField(String.valueOf(value), fieldPath, fieldType, value, operator, 1.0);
    }
}
