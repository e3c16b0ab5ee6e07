package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

/**
 * {@code field LIKE pattern} or {@code field NOT LIKE pattern}; the pattern carries its wildcards.
 *
 * @param field   field name
 * @param op      {@link Op#MATCHES} or {@link Op#NOT_MATCHES}
 * @param pattern SQL {@code LIKE} pattern
 */
public record PatternNode(String field, Op op, String pattern) implements PredicateNode {

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.pattern(field, op, pattern);
    }

    @Override
    public String toString() {
        return field + " " + op.getSymbol() + " " + PredicateNode.render(pattern);
    }
}
