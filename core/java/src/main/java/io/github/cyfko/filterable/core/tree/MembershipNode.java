package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * {@code field IN (values)} or {@code field NOT IN (values)}.
 *
 * @param field  field name
 * @param op     {@link Op#IN} or {@link Op#NOT_IN}
 * @param values candidate values in request order, {@code null} elements allowed
 */
public record MembershipNode(String field, Op op, List<Object> values) implements PredicateNode {

    public MembershipNode {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.membership(field, op, values);
    }

    @Override
    public String toString() {
        return values.stream()
                .map(PredicateNode::render)
                .collect(Collectors.joining(", ", field + " " + op.getSymbol() + " [", "]"));
    }
}
