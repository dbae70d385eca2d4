package io.github.cyfko.cohortql.core.api;

import java.util.List;
import java.util.Objects;

/**
 * A node of the recursive wire filter grammar.
 * <pre>{@code
 * Filter := AND(Filter[]) | OR(Filter[])
 *         | IN(field -> values[]) | GTE | LTE | GT | LT | CONTAINS (field -> value)
 *         | nested{path, AND|OR: Filter[]}
 * }</pre>
 * <p>
 * The hierarchy is closed: every consumer handles the three shapes through a {@link Visitor},
 * so adding a shape is a compile error everywhere it is not handled.
 * </p>
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>{@link Logical} and {@link Nested} have at least one child.</li>
 *   <li>A {@link Nested} node never contains another {@link Nested} node; its leaves reference
 *       fields local to the entity named by {@code path}.</li>
 * </ul>
 *
 * @since 1.0.0
 */
public sealed interface FilterNode permits FilterNode.Logical, FilterNode.Leaf, FilterNode.Nested {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive visitor over the filter grammar.
     *
     * @param <R> the result type
     */
    interface Visitor<R> {
        R visitLogical(Logical node);

        R visitLeaf(Leaf node);

        R visitNested(Nested node);
    }

    /**
     * {@code AND(children)} or {@code OR(children)}.
     */
    record Logical(Combinator combinator, List<FilterNode> children) implements FilterNode {
        public Logical {
            Objects.requireNonNull(combinator, "combinator");
            children = List.copyOf(children);
            if (children.isEmpty()) {
                throw new IllegalArgumentException(combinator + " node requires at least one child");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLogical(this);
        }
    }

    /**
     * A single condition.
     */
    record Leaf(FilterCondition condition) implements FilterNode {
        public Leaf {
            Objects.requireNonNull(condition, "condition");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLeaf(this);
        }
    }

    /**
     * Conditions scoped to one related sub-entity, e.g. all predicates on {@code tumor_assessments}.
     */
    record Nested(String path, Combinator combinator, List<FilterNode> children) implements FilterNode {
        public Nested {
            if (path == null || path.isBlank()) {
                throw new IllegalArgumentException("Nested path is required");
            }
            Objects.requireNonNull(combinator, "combinator");
            children = List.copyOf(children);
            if (children.isEmpty()) {
                throw new IllegalArgumentException("Nested node '" + path + "' requires at least one child");
            }
            for (FilterNode child : children) {
                if (containsNested(child)) {
                    throw new IllegalArgumentException("Nested node '" + path + "' cannot contain another nested node");
                }
            }
        }

        private static boolean containsNested(FilterNode node) {
            if (node instanceof Nested) return true;
            if (node instanceof Logical logical) {
                return logical.children().stream().anyMatch(Nested::containsNested);
            }
            return false;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNested(this);
        }
    }

    static FilterNode leaf(FilterCondition condition) {
        return new Leaf(condition);
    }

    /**
     * Wraps the nodes the way both the composer and the encoder do: none gives {@code null},
     * one is returned unwrapped, more are joined under {@code combinator}.
     *
     * @param combinator the sibling combinator
     * @param nodes      sibling nodes
     * @return the combined node, or {@code null} when {@code nodes} is empty
     */
    static FilterNode combine(Combinator combinator, List<FilterNode> nodes) {
        if (nodes.isEmpty()) return null;
        if (nodes.size() == 1) return nodes.get(0);
        return new Logical(combinator, nodes);
    }
}
