package io.github.cyfko.cohortql.core.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of the filter composer.
 * <p>
 * {@code conditions} is the flat list of coerced conditions keyed by full catalog path, in input
 * order, and drives human readable descriptions and structure warnings. {@code root} is the
 * composed tree handed to the query as the {@code $filter} variable; it is {@code null} when no
 * usable condition remained, which means "no filter".
 * </p>
 *
 * @param conditions flat conditions keyed by full path
 * @param combinator sibling combinator requested by the caller
 * @param root       composed tree, or {@code null}
 * @since 1.0.0
 */
public record FilterStructure(List<FilterCondition> conditions, Combinator combinator, FilterNode root) {

    public FilterStructure {
        conditions = List.copyOf(conditions);
        Objects.requireNonNull(combinator, "combinator");
    }

    /**
     * @param combinator sibling combinator
     * @return a structure without any condition
     */
    public static FilterStructure empty(Combinator combinator) {
        return new FilterStructure(List.of(), combinator, null);
    }

    /**
     * @return {@code true} when there is no filter to apply
     */
    public boolean isEmpty() {
        return root == null;
    }

    /**
     * @return the composed tree, if any
     */
    public Optional<FilterNode> rootNode() {
        return Optional.ofNullable(root);
    }
}
