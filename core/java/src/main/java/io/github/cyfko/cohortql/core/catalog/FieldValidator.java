package io.github.cyfko.cohortql.core.catalog;

import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.exception.FilterValidationException;
import io.github.cyfko.cohortql.core.utils.SequenceSimilarity;
import io.github.cyfko.cohortql.core.utils.ValidationResult;
import io.github.cyfko.cohortql.core.utils.ValueCoercion;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validation of field paths, enum values and value types against the catalog.
 *
 * <h2>Value Types</h2>
 * <ul>
 *   <li>{@link FieldType#STRING}, {@link FieldType#DATE}: a {@link String}</li>
 *   <li>{@link FieldType#NUMBER}: a {@link Number}</li>
 *   <li>{@link FieldType#BOOLEAN}: a {@link Boolean}, or a string such as {@code "yes"} or {@code "0"}</li>
 *   <li>{@link FieldType#ENUMERATION}: one of the field's enum values (any case), or a list of them</li>
 * </ul>
 *
 * <h2>Filter Validation</h2>
 * <p>
 * {@link #validateFilter(FilterNode)} walks a whole filter tree and reports <em>every</em> unknown
 * path, unsupported operator and mistyped value it finds. {@link #requireValid(FilterNode)} turns
 * a failed result into a {@link FilterValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
public class FieldValidator {

    /** Syntax of a GraphQL field path: identifiers joined by dots. */
    public static final Pattern GRAPHQL_PATH = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*$");

    /** Similarity a value must reach to be suggested without sharing a prefix. */
    public static final double SUGGESTION_THRESHOLD = 0.6;

    private final CatalogIndex index;

    public FieldValidator(CatalogIndex index) {
        this.index = Objects.requireNonNull(index, "index");
    }

    /**
     * @param path a field path
     * @return true if the catalog has a field with exactly this path
     */
    public boolean validateFieldPath(String path) {
        return path != null && index.getFieldByPath(path).isPresent();
    }

    /**
     * Matches a value against the enum values of a field, ignoring case and surrounding spaces.
     *
     * @param path  an enumeration field path
     * @param value candidate value
     * @return the value in catalog casing, or empty when the field is unknown, not an enumeration,
     *         or has no such value
     */
    public Optional<String> validateEnumerationValue(String path, String value) {
        if (value == null) return Optional.empty();
        Optional<CatalogField> field = enumerationField(path);
        if (field.isEmpty()) return Optional.empty();
        String wanted = value.strip().toLowerCase(Locale.ROOT);
        for (String enumValue : field.get().enumValues()) {
            if (enumValue.strip().toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(enumValue);
            }
        }
        return Optional.empty();
    }

    /**
     * Splits values into those accepted by the field, in catalog casing, and those rejected, as given.
     *
     * @param path   an enumeration field path
     * @param values candidate values
     * @return the accepted and rejected values
     */
    public EnumValidation validateMultipleEnumerationValues(String path, List<String> values) {
        List<String> valid = new ArrayList<>();
        List<String> invalid = new ArrayList<>();
        for (String value : values) {
            Optional<String> normalized = validateEnumerationValue(path, value);
            if (normalized.isPresent()) {
                valid.add(normalized.get());
            } else {
                invalid.add(value);
            }
        }
        return new EnumValidation(valid, invalid);
    }

    /**
     * @param path  an enumeration field path
     * @param value candidate value
     * @return the value in catalog casing, or {@code null} if it is not accepted
     */
    public String normalizeEnumerationValue(String path, String value) {
        return validateEnumerationValue(path, value).orElse(null);
    }

    /**
     * @param path a field path
     * @return the enum values of an enumeration field, empty otherwise
     */
    public List<String> getValidEnumerationValues(String path) {
        return enumerationField(path).map(CatalogField::enumValues).orElse(List.of());
    }

    /**
     * Suggests enum values for a partially typed value: values starting with it first, in catalog
     * order, then values similar to it (ratio at least {@value #SUGGESTION_THRESHOLD}).
     *
     * @param path    an enumeration field path
     * @param partial the partial input
     * @param limit   maximum number of suggestions
     * @return at most {@code limit} suggestions
     */
    public List<String> suggestEnumerationValues(String path, String partial, int limit) {
        List<String> validValues = getValidEnumerationValues(path);
        if (validValues.isEmpty() || partial == null || partial.isBlank() || limit <= 0) {
            return List.of();
        }
        String wanted = partial.strip().toLowerCase(Locale.ROOT);
        List<String> suggestions = new ArrayList<>();
        for (String value : validValues) {
            if (value.toLowerCase(Locale.ROOT).startsWith(wanted)) {
                suggestions.add(value);
            }
        }
        if (suggestions.size() < limit) {
            for (String value : validValues) {
                if (suggestions.size() >= limit) break;
                if (!suggestions.contains(value)
                        && SequenceSimilarity.ratio(wanted, value.toLowerCase(Locale.ROOT)) >= SUGGESTION_THRESHOLD) {
                    suggestions.add(value);
                }
            }
        }
        return suggestions.size() > limit ? List.copyOf(suggestions.subList(0, limit)) : List.copyOf(suggestions);
    }

    /**
     * Checks a value against the type of a field.
     *
     * @param path  a field path
     * @param value candidate value
     * @return false for unknown paths or incompatible values
     */
    public boolean validateFieldValueType(String path, Object value) {
        return index.getFieldByPath(path).map(field -> isCompatible(field, value)).orElse(false);
    }

    /**
     * @param path candidate path
     * @return true if the path is well-formed GraphQL field syntax; says nothing about catalog membership
     */
    public boolean validateGraphqlPathSyntax(String path) {
        return path != null && GRAPHQL_PATH.matcher(path.strip()).matches();
    }

    /**
     * @param path a field path
     * @return a summary of the field, if it exists
     */
    public Optional<FieldInfo> getFieldInfo(String path) {
        return index.getFieldByPath(path).map(FieldInfo::of);
    }

    /**
     * Validates every condition of a filter tree against the catalog.
     * <p>
     * Leaves under a {@link FilterNode.Nested} node are resolved as {@code path.field}.
     * </p>
     *
     * @param filter the tree, {@code null} meaning "no filter"
     * @return a result listing all violations, in tree order
     */
    public ValidationResult validateFilter(FilterNode filter) {
        if (filter == null) return ValidationResult.success();
        List<String> violations = new ArrayList<>();
        filter.accept(new ViolationCollector(null, violations));
        return ValidationResult.failures(violations);
    }

    /**
     * @param filter the tree to validate
     * @throws FilterValidationException carrying every violation, if any
     */
    public void requireValid(FilterNode filter) {
        ValidationResult result = validateFilter(filter);
        if (!result.isValid()) {
            throw new FilterValidationException(result.getViolations());
        }
    }

    private Optional<CatalogField> enumerationField(String path) {
        if (path == null) return Optional.empty();
        return index.getFieldByPath(path).filter(CatalogField::isEnumeration);
    }

    private boolean isCompatible(CatalogField field, Object value) {
        switch (field.fieldType()) {
            case STRING:
            case DATE:
                return value instanceof String;
            case NUMBER:
                return value instanceof Number;
            case BOOLEAN:
                return value instanceof Boolean
                        || (value instanceof String text && ValueCoercion.isBooleanLiteral(text));
            case ENUMERATION:
                if (value instanceof String text) {
                    return validateEnumerationValue(field.path(), text).isPresent();
                }
                if (value instanceof Collection<?> values) {
                    return !values.isEmpty() && values.stream().allMatch(v ->
                            v instanceof String item && validateEnumerationValue(field.path(), item).isPresent());
                }
                return false;
            default:
                return false;
        }
    }

    private static boolean supportsOperator(FieldType type, Op op) {
        switch (op) {
            case IN:
                return true;
            case CONTAINS:
                return type == FieldType.STRING;
            default:
                return type == FieldType.NUMBER || type == FieldType.DATE;
        }
    }

    /**
     * Collects violations while walking the tree. {@code scope} is the nested entity, or {@code null}
     * at subject level.
     */
    private final class ViolationCollector implements FilterNode.Visitor<Void> {
        private final String scope;
        private final List<String> violations;

        ViolationCollector(String scope, List<String> violations) {
            this.scope = scope;
            this.violations = violations;
        }

        @Override
        public Void visitLogical(FilterNode.Logical node) {
            node.children().forEach(child -> child.accept(this));
            return null;
        }

        @Override
        public Void visitNested(FilterNode.Nested node) {
            ViolationCollector nested = new ViolationCollector(node.path(), violations);
            node.children().forEach(child -> child.accept(nested));
            return null;
        }

        @Override
        public Void visitLeaf(FilterNode.Leaf node) {
            FilterCondition condition = node.condition();
            String path = scope == null ? condition.field() : scope + "." + condition.field();
            if (!validateGraphqlPathSyntax(path)) {
                violations.add("Invalid field path syntax: '" + path + "'");
                return null;
            }
            Optional<CatalogField> field = index.getFieldByPath(path);
            if (field.isEmpty()) {
                violations.add("Unknown field path: '" + path + "'");
                return null;
            }
            FieldType type = field.get().fieldType();
            if (!supportsOperator(type, condition.operator())) {
                violations.add("Operator " + condition.operator().getCode() + " is not supported for field '"
                        + path + "' of type " + type.catalogName());
                return null;
            }
            Object value = condition.value();
            boolean compatible = condition.operator() == Op.IN
                    ? condition.valuesAsList().stream().allMatch(v -> isCompatible(field.get(), v))
                    : isCompatible(field.get(), value);
            if (!compatible) {
                violations.add("Invalid value type for field '" + path + "': " + describe(value));
            }
            return null;
        }

        private String describe(Object value) {
            return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
        }
    }

    /**
     * Outcome of {@link #validateMultipleEnumerationValues(String, List)}.
     *
     * @param valid   accepted values, in catalog casing
     * @param invalid rejected values, as given
     */
    public record EnumValidation(List<String> valid, List<String> invalid) {
        public EnumValidation {
            valid = List.copyOf(valid);
            invalid = List.copyOf(invalid);
        }
    }
}
