package io.github.cyfko.cohortql.core.query;

import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.FilterStructure;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.codec.WireFilterMapper;
import io.github.cyfko.cohortql.core.config.QueryPolicy;
import io.github.cyfko.cohortql.core.exception.FilterCodecException;
import io.github.cyfko.cohortql.core.exception.QueryGenerationException;
import io.github.cyfko.cohortql.core.utils.TextNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Assembles the GraphQL query text, variables and a human readable description from a composed
 * filter.
 *
 * <h2>Query Text</h2>
 * <pre>{@code
 * query ($filter: JSON) {
 *   subject(
 *     accessibility: accessible,
 *     offset: 0,
 *     first: 100
 *     filter: $filter
 *   ) {
 *     consortium
 *     ...
 *     tumor_assessments {
 *       tumor_site
 *     }
 *   }
 * }
 * }</pre>
 * <p>
 * The {@code filter: $filter} argument is only emitted when a filter is present; the root entity,
 * limit and selection set come from the {@link QueryPolicy}. {@link Op#CONTAINS} values are wrapped
 * with the configured wildcard unless they already carry it.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>Instances are immutable and can be shared.</p>
 *
 * @since 1.0.0
 */
public class QueryBuilder {

    private static final Logger log = Logger.getLogger(QueryBuilder.class.getName());

    /** Name of the filter variable in {@link GraphQLQuery#variables()}. */
    public static final String FILTER_VARIABLE = "filter";

    static final String NO_FILTER_DESCRIPTION = "Query for all cases (no filters applied)";

    private final QueryPolicy policy;
    private final WireFilterMapper mapper;

    public QueryBuilder() {
        this(QueryPolicy.defaults(), new WireFilterMapper());
    }

    public QueryBuilder(QueryPolicy policy, WireFilterMapper mapper) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Builds the query for a composer output.
     *
     * @param structure the composed filter
     * @return the query
     * @throws QueryGenerationException if the query cannot be generated
     */
    public GraphQLQuery build(FilterStructure structure) {
        if (structure == null) {
            throw new QueryGenerationException("Filter structure is required");
        }
        return build(structure.root(), structure.conditions(), structure.combinator());
    }

    /**
     * Builds the query for a bare filter tree. The description lists the tree's leaves, with
     * nested leaves named by their full path, joined with the root combinator.
     *
     * @param filter the filter tree, {@code null} for no filter
     * @return the query
     * @throws QueryGenerationException if the query cannot be generated
     */
    public GraphQLQuery build(FilterNode filter) {
        Combinator combinator = filter instanceof FilterNode.Logical logical ? logical.combinator() : Combinator.AND;
        List<FilterCondition> conditions = new ArrayList<>();
        if (filter != null) {
            collectConditions(filter, null, conditions);
        }
        return build(filter, conditions, combinator);
    }

    private GraphQLQuery build(FilterNode filter, List<FilterCondition> conditions, Combinator combinator) {
        try {
            FilterNode decorated = filter == null ? null : filter.accept(new WildcardDecorator(policy.containsWildcard()));
            Map<String, Object> variables = new LinkedHashMap<>();
            if (decorated != null) {
                variables.put(FILTER_VARIABLE, mapper.write(decorated));
            }
            String query = buildQueryText(decorated != null);
            String description = describe(conditions, combinator);
            GraphQLQuery result = new GraphQLQuery(query, Collections.unmodifiableMap(variables), description,
                    mapper.toJson(variables));
            log.fine(() -> "Generated GraphQL query with " + conditions.size() + " filters");
            return result;
        } catch (QueryGenerationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warning("GraphQL query generation failed: " + e.getMessage());
            throw new QueryGenerationException("Failed to generate GraphQL query: " + e.getMessage(), e);
        }
    }

    /**
     * Advisory checks on a generated query. Never fails.
     *
     * @param query the query to check
     * @return warnings, empty when the query looks reasonable
     */
    public List<String> validateQuery(GraphQLQuery query) {
        List<String> warnings = new ArrayList<>();
        if (query.query().length() > policy.maxQueryLength()) {
            warnings.add("Query is very long and may impact performance");
        }
        int containsCount = countContains(query, warnings);
        if (containsCount > policy.maxContainsFilters()) {
            warnings.add("Query contains " + containsCount + " text search operations which may be slow");
        }
        if (query.variablesJson().length() > policy.maxVariablesLength()) {
            warnings.add("Query variables are very large");
        }
        return warnings;
    }

    public QueryPolicy getPolicy() {
        return policy;
    }

    String buildQueryText(boolean withFilter) {
        StringBuilder sb = new StringBuilder();
        sb.append("query ($filter: JSON) {\n");
        sb.append("  ").append(policy.rootEntity()).append("(\n");
        sb.append("    accessibility: accessible,\n");
        sb.append("    offset: 0,\n");
        sb.append("    first: ").append(policy.limit()).append('\n');
        if (withFilter) {
            sb.append("    filter: $filter\n");
        }
        sb.append("  ) {\n");
        for (String field : policy.scalarFields()) {
            sb.append("    ").append(field).append('\n');
        }
        policy.nestedSelections().forEach((entity, fields) -> {
            sb.append("    ").append(entity).append(" {\n");
            for (String field : fields) {
                sb.append("      ").append(field).append('\n');
            }
            sb.append("    }\n");
        });
        sb.append("  }\n");
        sb.append('}');
        return sb.toString();
    }

    static String describe(List<FilterCondition> conditions, Combinator combinator) {
        if (conditions.isEmpty()) {
            return NO_FILTER_DESCRIPTION;
        }
        return "Cases where " + conditions.stream()
                .map(QueryBuilder::describe)
                .collect(Collectors.joining(" " + combinator.word() + " "));
    }

    private static String describe(FilterCondition condition) {
        String operator;
        if (condition.operator() == Op.IN) {
            operator = condition.valuesAsList().size() == 1 ? "equals" : Op.IN.getDescription();
        } else {
            operator = condition.operator().getDescription();
        }
        return TextNormalizer.toTitle(condition.field()) + " " + operator + " " + describeValue(condition.value());
    }

    static String describeValue(Object value) {
        if (value instanceof List<?> list) {
            if (list.size() == 1) {
                return "'" + list.get(0) + "'";
            }
            if (list.size() <= 3) {
                return list.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
            }
            return "[" + list.get(0) + ", " + list.get(1) + " and " + (list.size() - 2) + " others]";
        }
        return "'" + value + "'";
    }

    private static void collectConditions(FilterNode node, String scope, List<FilterCondition> out) {
        if (node instanceof FilterNode.Leaf leaf) {
            FilterCondition condition = leaf.condition();
            out.add(scope == null ? condition
                    : new FilterCondition(scope + "." + condition.field(), condition.operator(), condition.value()));
        } else if (node instanceof FilterNode.Logical logical) {
            logical.children().forEach(child -> collectConditions(child, scope, out));
        } else if (node instanceof FilterNode.Nested nested) {
            nested.children().forEach(child -> collectConditions(child, nested.path(), out));
        }
    }

    @SuppressWarnings("unchecked")
    private int countContains(GraphQLQuery query, List<String> warnings) {
        Object wire = query.variables().get(FILTER_VARIABLE);
        if (!(wire instanceof Map<?, ?>)) {
            return 0;
        }
        try {
            FilterNode filter = mapper.read((Map<String, ?>) wire);
            return filter == null ? 0 : filter.accept(new ContainsCounter());
        } catch (FilterCodecException e) {
            warnings.add("Query filter could not be inspected: " + e.getMessage());
            return 0;
        }
    }

    /**
     * Counts {@code CONTAINS} leaves, nested blocks included.
     */
    private static final class ContainsCounter implements FilterNode.Visitor<Integer> {

        @Override
        public Integer visitLogical(FilterNode.Logical node) {
            return sum(node.children());
        }

        @Override
        public Integer visitLeaf(FilterNode.Leaf node) {
            return node.condition().operator() == Op.CONTAINS ? 1 : 0;
        }

        @Override
        public Integer visitNested(FilterNode.Nested node) {
            return sum(node.children());
        }

        private int sum(List<FilterNode> children) {
            int total = 0;
            for (FilterNode child : children) {
                total += child.accept(this);
            }
            return total;
        }
    }

    /**
     * Rebuilds the tree with {@code CONTAINS} values wrapped as {@code %value%}.
     */
    private static final class WildcardDecorator implements FilterNode.Visitor<FilterNode> {

        private final String wildcard;

        private WildcardDecorator(String wildcard) {
            this.wildcard = wildcard;
        }

        @Override
        public FilterNode visitLogical(FilterNode.Logical node) {
            return new FilterNode.Logical(node.combinator(), decorateAll(node.children()));
        }

        @Override
        public FilterNode visitLeaf(FilterNode.Leaf node) {
            FilterCondition condition = node.condition();
            if (condition.operator() != Op.CONTAINS || wildcard.isEmpty()) {
                return node;
            }
            String value = String.valueOf(condition.value());
            if (value.contains(wildcard)) {
                return node;
            }
            return FilterNode.leaf(new FilterCondition(condition.field(), Op.CONTAINS, wildcard + value + wildcard));
        }

        @Override
        public FilterNode visitNested(FilterNode.Nested node) {
            return new FilterNode.Nested(node.path(), node.combinator(), decorateAll(node.children()));
        }

        private List<FilterNode> decorateAll(List<FilterNode> children) {
            List<FilterNode> decorated = new ArrayList<>(children.size());
            children.forEach(child -> decorated.add(child.accept(this)));
            return decorated;
        }
    }
}
