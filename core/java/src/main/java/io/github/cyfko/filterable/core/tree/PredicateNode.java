package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.spi.QueryBuilder;

/**
 * Node of a compiled predicate tree.
 * <p>
 * A tree is made of {@link GroupNode}s combining their children with AND or OR, leaf clauses
 * ({@link ComparisonNode}, {@link MembershipNode}, {@link RangeNode}, {@link NullCheckNode},
 * {@link PatternNode}) and {@link RelationNode}s scoping a group to a relation.
 * </p>
 * <p>
 * Trees are immutable and backend-agnostic. {@link #applyTo(QueryBuilder)} replays a tree into
 * any {@link QueryBuilder}, so a compiled tree can be kept and executed later. {@code toString()}
 * renders a stable, human-readable form such as
 * {@code AND(status IN ['active', 'pending'], age >= '18')}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface PredicateNode {

    /**
     * Emits this node into a builder, children first to last.
     *
     * @param builder target builder
     */
    void applyTo(QueryBuilder builder);

    /**
     * Renders an operand the way {@code toString()} shows it: strings single-quoted, other values as is.
     *
     * @param value operand
     * @return rendered operand
     */
    static String render(Object value) {
        return value instanceof String ? "'" + value + "'" : String.valueOf(value);
    }
}
