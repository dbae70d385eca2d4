package io.github.cyfko.cohortql.core.query;

import java.util.Map;
import java.util.Objects;

/**
 * An executable GraphQL query.
 *
 * @param query         query text
 * @param variables     query variables, {@code {"filter": <wire filter>}} or empty
 * @param description   human readable summary of the filters
 * @param variablesJson {@code variables} serialized as JSON
 * @since 1.0.0
 */
public record GraphQLQuery(String query, Map<String, Object> variables, String description, String variablesJson) {

    public GraphQLQuery {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(description, "description");
        variables = variables == null ? Map.of() : variables;
        variablesJson = variablesJson == null ? "{}" : variablesJson;
    }

    /**
     * @return {@code true} when the query carries a {@code $filter} variable
     */
    public boolean hasFilter() {
        return variables.containsKey(QueryBuilder.FILTER_VARIABLE);
    }
}
