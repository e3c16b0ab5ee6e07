package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

/**
 * {@code field BETWEEN low AND high}, or its negation.
 *
 * @param field field name
 * @param op    {@link Op#RANGE} or {@link Op#NOT_RANGE}
 * @param low   first bound as given in the request
 * @param high  second bound as given in the request
 */
public record RangeNode(String field, Op op, Object low, Object high) implements PredicateNode {

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.range(field, op, low, high);
    }

    @Override
    public String toString() {
        return field + " " + op.getSymbol() + " " + PredicateNode.render(low) + " AND " + PredicateNode.render(high);
    }
}
