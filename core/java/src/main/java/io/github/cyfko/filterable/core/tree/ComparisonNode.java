package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

/**
 * {@code field <op> value} for EQ, NE, GT, GTE, LT and LTE.
 *
 * @param field field name
 * @param op    comparison operator
 * @param value operand
 */
public record ComparisonNode(String field, Op op, Object value) implements PredicateNode {

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.compare(field, op, value);
    }

    @Override
    public String toString() {
        return field + " " + op.getSymbol() + " " + PredicateNode.render(value);
    }
}
