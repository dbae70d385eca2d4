package io.github.cyfko.cohortql.core.codec;

import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.exception.UnsupportedFilterException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Bidirectional transform between the wire filter tree and {@link FilterState}.
 *
 * <h2>Encoding</h2>
 * <ul>
 *   <li>{@code null} or empty state: {@code null}</li>
 *   <li>{@link FilterKind#COMPOSED}: {@code combineMode} over the encoded children, {@code null}
 *       children dropped</li>
 *   <li>{@link FilterValue.Option}: {@code IN(field -> selectedValues)}; an empty selection encodes nothing
 *       and the exclusion flag is dropped</li>
 *   <li>{@link FilterValue.Range}: {@code AND[GTE, LTE]}, {@code GTE} or {@code LTE} depending on the
 *       bounds present; no bound encodes nothing</li>
 *   <li>{@link FilterValue.Anchored}: {@link UnsupportedFilterException}</li>
 * </ul>
 * <p>
 * Subject-level conditions come first, then one {@code nested} node per entity, joined by the
 * state's combine mode. A single resulting condition is returned unwrapped.
 * </p>
 *
 * <h2>Decoding</h2>
 * <p>
 * The root {@code AND}/{@code OR} gives the combine mode; any other root is read as the only child
 * of an {@code AND}. {@code IN} children become options (a later entry for the same key replaces an
 * earlier one), {@code GTE}/{@code LTE} children merge into ranges, and a child {@code AND} group, the
 * encoded form of a two-sided range, is read one level deep. Inside a {@code nested} node only
 * {@code IN} conditions are read, as {@code path.field} options, including those of an {@code AND}
 * group read from a multi-field operator object. {@code GT}, {@code LT},
 * {@code CONTAINS} and nested ranges have no {@link FilterState} form and are skipped with a log line.
 * </p>
 *
 * <h2>Round Trip</h2>
 * <p>
 * For a state holding only options and ranges, nested ranges excepted, {@code decode(encode(s))}
 * restores the same selected values and bounds.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterCodec {

    private static final Logger log = Logger.getLogger(FilterCodec.class.getName());

    /**
     * Encodes a state into a wire filter tree.
     *
     * @param state the state, may be {@code null}
     * @return the tree, or {@code null} when the state selects nothing
     * @throws UnsupportedFilterException if the state holds an anchored value
     */
    public FilterNode encode(FilterState state) {
        if (state == null || state.isEmpty()) {
            return null;
        }
        if (state.kind() == FilterKind.COMPOSED) {
            List<FilterNode> encoded = new ArrayList<>();
            for (FilterState child : state.children()) {
                FilterNode node = encode(child);
                if (node != null) encoded.add(node);
            }
            return encoded.isEmpty() ? null : new FilterNode.Logical(state.combineMode(), encoded);
        }

        List<FilterNode> direct = new ArrayList<>();
        Map<String, List<FilterNode>> nested = new LinkedHashMap<>();
        for (Map.Entry<String, FilterValue> entry : state.values().entrySet()) {
            String key = entry.getKey();
            int separator = key.indexOf('.');
            String field = separator < 0 ? key : key.substring(separator + 1);
            FilterNode node = encodeValue(key, field, entry.getValue());
            if (node == null) {
                continue;
            }
            if (separator < 0) {
                direct.add(node);
            } else {
                nested.computeIfAbsent(key.substring(0, separator), e -> new ArrayList<>()).add(node);
            }
        }

        List<FilterNode> nodes = new ArrayList<>(direct);
        nested.forEach((entity, children) -> nodes.add(new FilterNode.Nested(entity, state.combineMode(), children)));
        return FilterNode.combine(state.combineMode(), nodes);
    }

    private FilterNode encodeValue(String key, String field, FilterValue value) {
        if (value == null) {
            log.fine(() -> "Skipping null filter value for key: " + key);
            return null;
        }
        if (value instanceof FilterValue.Option option) {
            if (option.selectedValues().isEmpty()) {
                return null;
            }
            if (option.exclusion()) {
                log.fine(() -> "Encoding excluded option '" + key + "' as IN: the wire grammar has no negation");
            }
            return FilterNode.leaf(FilterCondition.in(field, option.selectedValues()));
        }
        if (value instanceof FilterValue.Range range) {
            FilterNode lower = range.lowerBound() == null ? null
                    : FilterNode.leaf(new FilterCondition(field, Op.GTE, range.lowerBound()));
            FilterNode upper = range.upperBound() == null ? null
                    : FilterNode.leaf(new FilterCondition(field, Op.LTE, range.upperBound()));
            if (lower != null && upper != null) {
                return new FilterNode.Logical(Combinator.AND, List.of(lower, upper));
            }
            return lower != null ? lower : upper;
        }
        throw new UnsupportedFilterException(key, "Anchored filters are not supported (key '" + key + "')");
    }

    /**
     * Decodes a wire filter tree into a standard state.
     *
     * @param filter the tree, may be {@code null}
     * @return the state, or {@code null} for a {@code null} filter
     */
    public FilterState decode(FilterNode filter) {
        if (filter == null) {
            return null;
        }
        Combinator combinator = Combinator.AND;
        List<FilterNode> children = List.of(filter);
        if (filter instanceof FilterNode.Logical logical) {
            combinator = logical.combinator();
            children = logical.children();
        }

        Map<String, FilterValue> values = new LinkedHashMap<>();
        for (FilterNode child : children) {
            decodeChild(child, values, true);
        }
        return FilterState.standard(combinator, values);
    }

    private void decodeChild(FilterNode child, Map<String, FilterValue> values, boolean topLevel) {
        child.accept(new FilterNode.Visitor<Void>() {
            @Override
            public Void visitLogical(FilterNode.Logical node) {
                if (topLevel && node.combinator() == Combinator.AND) {
                    node.children().forEach(grandChild -> decodeChild(grandChild, values, false));
                } else {
                    log.fine(() -> "Skipping " + node.combinator() + " group: not representable in a filter state");
                }
                return null;
            }

            @Override
            public Void visitLeaf(FilterNode.Leaf node) {
                decodeCondition(node.condition(), node.condition().field(), values);
                return null;
            }

            @Override
            public Void visitNested(FilterNode.Nested node) {
                if (!topLevel) {
                    log.fine(() -> "Skipping nested block '" + node.path() + "' inside a group");
                    return null;
                }
                node.children().forEach(nestedChild -> decodeNestedChild(node.path(), nestedChild, values));
                return null;
            }
        });
    }

    private void decodeNestedChild(String path, FilterNode child, Map<String, FilterValue> values) {
        if (child instanceof FilterNode.Leaf leaf && leaf.condition().operator() == Op.IN) {
            putOption(path + "." + leaf.condition().field(), leaf.condition(), values);
        } else if (child instanceof FilterNode.Logical group && group.combinator() == Combinator.AND) {
            group.children().forEach(grandChild -> decodeNestedChild(path, grandChild, values));
        } else {
            log.fine(() -> "Skipping non-IN condition inside nested block '" + path + "'");
        }
    }

    private void decodeCondition(FilterCondition condition, String key, Map<String, FilterValue> values) {
        switch (condition.operator()) {
            case IN:
                putOption(key, condition, values);
                break;
            case GTE:
            case LTE: {
                FilterValue existing = values.get(key);
                FilterValue.Range range = existing instanceof FilterValue.Range current
                        ? current : new FilterValue.Range(null, null);
                if (existing != null && !(existing instanceof FilterValue.Range)) {
                    log.fine(() -> "Range on '" + key + "' replaces an earlier selection");
                }
                values.put(key, condition.operator() == Op.GTE
                        ? new FilterValue.Range(condition.value(), range.upperBound())
                        : new FilterValue.Range(range.lowerBound(), condition.value()));
                break;
            }
            default:
                log.fine(() -> "Skipping " + condition.operator().getCode() + " on '" + key
                        + "': not representable in a filter state");
        }
    }

    private static void putOption(String key, FilterCondition condition, Map<String, FilterValue> values) {
        values.remove(key);
        values.put(key, new FilterValue.Option(new ArrayList<Object>(condition.valuesAsList()), false));
    }
}
