package io.github.cyfko.cohortql.core.compose;

import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.FilterStructure;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.catalog.FieldType;
import io.github.cyfko.cohortql.core.exception.FilterCompositionException;
import io.github.cyfko.cohortql.core.resolve.ResolvedField;
import io.github.cyfko.cohortql.core.utils.ValueCoercion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Composes resolved fields into a nested filter tree.
 *
 * <h2>Values</h2>
 * <ul>
 *   <li>enumeration: kept as given; a scalar becomes a one-element list for {@code IN}</li>
 *   <li>number: numeric-looking strings are parsed, other strings kept</li>
 *   <li>boolean: {@code true}, {@code yes}, {@code 1}, {@code y} are true, other strings false</li>
 *   <li>string: trimmed</li>
 *   <li>date: kept as a string</li>
 * </ul>
 * <p>A field whose coerced value is null, blank or an empty list is dropped and logged.</p>
 *
 * <h2>Tree Shape</h2>
 * <p>
 * A path such as {@code tumor_assessments.tumor_site} names the field {@code tumor_site} of the
 * entity {@code tumor_assessments}. All conditions on one entity merge into a single
 * {@code Nested(entity, AND, ...)} node: predicates on the same sub-entity are independent
 * constraints whatever the outer combinator. Subject-level conditions come first, then nested nodes
 * in first-seen order. No condition gives an empty structure, one is returned unwrapped, more are
 * joined under the requested combinator.
 * </p>
 *
 * <pre>{@code
 * compose([sex eq "Male"], AND)               -> {"IN": {"sex": ["Male"]}}
 * compose([consortium eq INRG, race eq Asian]) -> {"AND": [{"IN": {...}}, {"IN": {...}}]}
 * compose([tumor_assessments.tumor_site eq Liver, tumor_assessments.tumor_state eq Present])
 *   -> {"nested": {"path": "tumor_assessments", "AND": [{"IN": {"tumor_site": ["Liver"]}}, ...]}}
 * }</pre>
 *
 * @since 1.0.0
 */
public class FilterComposer {

    private static final Logger log = Logger.getLogger(FilterComposer.class.getName());

    /** Advisory threshold for CONTAINS conditions in one structure. */
    public static final int MAX_CONTAINS_FILTERS = 3;

    /**
     * Composes with {@link Combinator#AND}.
     *
     * @param fields resolved fields
     * @return the structure
     */
    public FilterStructure compose(List<ResolvedField> fields) {
        return compose(fields, Combinator.AND);
    }

    /**
     * Composes resolved fields joined by {@code combinator}.
     *
     * @param fields     resolved fields, in order
     * @param combinator sibling combinator; {@code null} means AND
     * @return the structure, with a {@code null} root when no usable condition remains
     * @throws FilterCompositionException on malformed resolved fields (missing path or type) or a path
     *                                    with more than one nesting level
     */
    public FilterStructure compose(List<ResolvedField> fields, Combinator combinator) {
        if (fields == null) {
            throw new FilterCompositionException("Resolved field list is required");
        }
        Combinator siblings = combinator == null ? Combinator.AND : combinator;

        List<FilterCondition> conditions = new ArrayList<>();
        List<FilterNode> direct = new ArrayList<>();
        Map<String, List<FilterNode>> nested = new LinkedHashMap<>();

        for (ResolvedField field : fields) {
            requireWellFormed(field);
            Op op = Op.fromResolverOperator(field.operator());
            Object value = coerce(field, op);
            if (value == null) {
                continue;
            }
            FilterCondition condition;
            try {
                condition = new FilterCondition(field.fieldPath(), op, value);
            } catch (IllegalArgumentException e) {
                throw new FilterCompositionException("Invalid condition for field '" + field.fieldPath() + "': " + e.getMessage(), e);
            }
            conditions.add(condition);

            String path = field.fieldPath();
            int separator = path.indexOf('.');
            if (separator < 0) {
                direct.add(FilterNode.leaf(condition));
            } else {
                String entity = path.substring(0, separator);
                String localField = path.substring(separator + 1);
                nested.computeIfAbsent(entity, e -> new ArrayList<>())
                        .add(FilterNode.leaf(new FilterCondition(localField, op, value)));
            }
        }

        List<FilterNode> nodes = new ArrayList<>(direct);
        nested.forEach((entity, children) -> nodes.add(new FilterNode.Nested(entity, Combinator.AND, children)));
        FilterNode root = FilterNode.combine(siblings, nodes);
        log.fine(() -> String.format("Composed filter with %d conditions using %s logic", conditions.size(), siblings));
        return new FilterStructure(conditions, siblings, root);
    }

    /**
     * Advisory checks on a composed structure. Never blocks anything.
     *
     * @param structure the structure
     * @return warnings, empty when nothing looks suspicious
     */
    public List<String> validateStructure(FilterStructure structure) {
        List<String> warnings = new ArrayList<>();
        if (structure.conditions().isEmpty()) {
            warnings.add("No filters generated - query may return all records");
        }
        long containsCount = structure.conditions().stream().filter(c -> c.operator() == Op.CONTAINS).count();
        if (containsCount > MAX_CONTAINS_FILTERS) {
            warnings.add("Many string containment filters (" + containsCount + ") may impact performance");
        }
        Map<String, Integer> perField = new LinkedHashMap<>();
        structure.conditions().forEach(c -> perField.merge(c.field(), 1, Integer::sum));
        perField.forEach((field, count) -> {
            if (count > 1) {
                warnings.add("Multiple filters on field '" + field + "' - may be conflicting");
            }
        });
        return warnings;
    }

    private static void requireWellFormed(ResolvedField field) {
        if (field == null) {
            throw new FilterCompositionException("Resolved field list contains a null entry");
        }
        String path = field.fieldPath();
        if (path == null || path.isBlank()) {
            throw new FilterCompositionException("Resolved field for term '" + field.term() + "' has no field path");
        }
        if (field.fieldType() == null) {
            throw new FilterCompositionException("Resolved field '" + path + "' has no field type");
        }
        int separator = path.indexOf('.');
        if (separator >= 0) {
            if (path.indexOf('.', separator + 1) >= 0) {
                throw new FilterCompositionException("Field path '" + path + "' has more than one nesting level");
            }
            if (separator == 0 || separator == path.length() - 1) {
                throw new FilterCompositionException("Field path '" + path + "' has an empty segment");
            }
        }
    }

    /**
     * @return the coerced value, a list for IN, or {@code null} when the field must be dropped
     */
    private static Object coerce(ResolvedField field, Op op) {
        Object raw = field.value();
        Object coerced;
        if (op == Op.IN) {
            List<Object> values = new ArrayList<>();
            for (Object item : ValueCoercion.toList(raw)) {
                Object value = coerceScalar(field.fieldType(), op, item);
                if (!ValueCoercion.isEmpty(value)) values.add(value);
            }
            coerced = values;
        } else if (raw instanceof Collection<?>) {
            log.warning(() -> "Dropping filter on '" + field.fieldPath() + "': operator " + op.getCode()
                    + " does not accept a list value");
            return null;
        } else {
            coerced = coerceScalar(field.fieldType(), op, raw);
        }

        if (ValueCoercion.isEmpty(coerced)) {
            log.warning(() -> "Dropping filter on '" + field.fieldPath() + "': empty value " + raw);
            return null;
        }
        return coerced;
    }

    private static Object coerceScalar(FieldType type, Op op, Object value) {
        if (value == null) return null;
        switch (type) {
            case NUMBER:
                return ValueCoercion.toNumberIfNumeric(value);
            case BOOLEAN:
                return ValueCoercion.toBoolean(value);
            case STRING:
                return op == Op.CONTAINS ? value.toString().strip() : value.toString();
            case ENUMERATION:
            case DATE:
            default:
                return value instanceof String ? value : value.toString();
        }
    }
}
