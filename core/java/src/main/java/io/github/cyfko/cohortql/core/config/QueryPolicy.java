package io.github.cyfko.cohortql.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the emitted GraphQL query.
 *
 * <h2>Query Shape</h2>
 * <ul>
 *   <li><strong>rootEntity</strong>: root query field (default: {@code subject})</li>
 *   <li><strong>limit</strong>: value of the {@code first} argument (default: 100)</li>
 *   <li><strong>scalarFields</strong>: scalar fields selected on the root entity</li>
 *   <li><strong>nestedSelections</strong>: sub-entity name to selected fields, in emission order</li>
 *   <li><strong>containsWildcard</strong>: wildcard wrapped around CONTAINS values (default: {@code %})</li>
 * </ul>
 *
 * <h2>Advisory Limits</h2>
 * <ul>
 *   <li><strong>maxQueryLength</strong>: query text length above which a warning is raised (default: 10000)</li>
 *   <li><strong>maxContainsFilters</strong>: CONTAINS conditions above which a warning is raised (default: 3)</li>
 *   <li><strong>maxVariablesLength</strong>: serialized variables length above which a warning is raised (default: 5000)</li>
 * </ul>
 *
 * <pre>{@code
 * QueryPolicy policy = QueryPolicy.builder()
 *     .limit(500)
 *     .nestedSelection("follow_ups", List.of("vital_status"))
 *     .build();
 * }</pre>
 *
 * @since 1.0.0
 */
public record QueryPolicy(
        String rootEntity,
        int limit,
        List<String> scalarFields,
        Map<String, List<String>> nestedSelections,
        String containsWildcard,
        int maxQueryLength,
        int maxContainsFilters,
        int maxVariablesLength
) {

    /** Scalar fields selected on {@code subject} by default. */
    public static final List<String> DEFAULT_SCALAR_FIELDS = List.of(
            "consortium", "subject_submitter_id", "sex", "race", "ethnicity", "age_at_censor_status");

    /** Sub-entity selections on {@code subject} by default. */
    public static final Map<String, List<String>> DEFAULT_NESTED_SELECTIONS = defaultNestedSelections();

    /**
     * Canonical constructor with validation. Collections are copied; nested selection order is kept.
     *
     * @throws IllegalArgumentException if any value is invalid
     */
    public QueryPolicy {
        if (rootEntity == null || rootEntity.isBlank()) {
            throw new IllegalArgumentException("rootEntity is required");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        if (scalarFields == null || nestedSelections == null) {
            throw new IllegalArgumentException("scalarFields and nestedSelections are required");
        }
        if (scalarFields.isEmpty() && nestedSelections.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be selected");
        }
        if (containsWildcard == null) {
            throw new IllegalArgumentException("containsWildcard is required");
        }
        if (maxQueryLength <= 0 || maxContainsFilters < 0 || maxVariablesLength <= 0) {
            throw new IllegalArgumentException("Advisory limits must be positive");
        }
        scalarFields = List.copyOf(scalarFields);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        nestedSelections.forEach((entity, fields) -> copy.put(entity, List.copyOf(fields)));
        nestedSelections = Collections.unmodifiableMap(copy);
    }

    /**
     * Default configuration: {@code subject}, first 100, the standard cohort selection set.
     *
     * @return default configuration
     */
    public static QueryPolicy defaults() {
        return builder().build();
    }

    /**
     * Builder initialized with the {@link #defaults()} values.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, List<String>> defaultNestedSelections() {
        Map<String, List<String>> selections = new LinkedHashMap<>();
        selections.put("tumor_assessments", List.of(
                "tumor_site", "tumor_state", "tumor_classification", "age_at_tumor_assessment"));
        selections.put("histologies", List.of("histology", "histology_grade"));
        selections.put("disease_characteristics", List.of("diagnosis", "primary_site"));
        return Collections.unmodifiableMap(selections);
    }

    public static class Builder {
        private String _rootEntity = "subject";
        private int _limit = 100;
        private List<String> _scalarFields = new ArrayList<>(DEFAULT_SCALAR_FIELDS);
        private Map<String, List<String>> _nestedSelections = new LinkedHashMap<>(DEFAULT_NESTED_SELECTIONS);
        private String _containsWildcard = "%";
        private int _maxQueryLength = 10_000;
        private int _maxContainsFilters = 3;
        private int _maxVariablesLength = 5_000;

        private Builder() {}

        public QueryPolicy build() {
            return new QueryPolicy(_rootEntity, _limit, _scalarFields, _nestedSelections, _containsWildcard,
                    _maxQueryLength, _maxContainsFilters, _maxVariablesLength);
        }

        public Builder rootEntity(String rootEntity) { this._rootEntity = rootEntity; return this; }
        public Builder limit(int limit) { this._limit = limit; return this; }
        public Builder scalarFields(List<String> scalarFields) { this._scalarFields = new ArrayList<>(scalarFields); return this; }
        public Builder nestedSelections(Map<String, List<String>> selections) { this._nestedSelections = new LinkedHashMap<>(selections); return this; }
        public Builder nestedSelection(String entity, List<String> fields) { this._nestedSelections.put(entity, fields); return this; }
        public Builder containsWildcard(String containsWildcard) { this._containsWildcard = containsWildcard; return this; }
        public Builder maxQueryLength(int maxQueryLength) { this._maxQueryLength = maxQueryLength; return this; }
        public Builder maxContainsFilters(int maxContainsFilters) { this._maxContainsFilters = maxContainsFilters; return this; }
        public Builder maxVariablesLength(int maxVariablesLength) { this._maxVariablesLength = maxVariablesLength; return this; }
    }
}
