package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

/**
 * {@code field IS NULL} or {@code field IS NOT NULL}.
 *
 * @param field field name
 * @param op    {@link Op#IS_NULL} or {@link Op#NOT_NULL}
 */
public record NullCheckNode(String field, Op op) implements PredicateNode {

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.nullCheck(field, op);
    }

    @Override
    public String toString() {
        return field + " " + op.getSymbol();
    }
}
