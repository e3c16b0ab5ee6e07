package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

import java.util.Objects;

/**
 * Existence test over a relation: holds when a related row reached through
 * {@code relationPath} satisfies {@code scope}. An empty scope only requires the relation to exist.
 *
 * @param relationPath dot-separated relation path
 * @param scope        AND group evaluated against the related rows
 */
public record RelationNode(String relationPath, GroupNode scope) implements PredicateNode {

    public RelationNode {
        Objects.requireNonNull(relationPath, "relationPath cannot be null");
        Objects.requireNonNull(scope, "scope cannot be null");
        if (scope.connector() != Connector.AND) {
            throw new IllegalArgumentException("relation scope must be an AND group");
        }
    }

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.relation(relationPath, scoped -> scope.children().forEach(child -> child.applyTo(scoped)));
    }

    @Override
    public String toString() {
        return "EXISTS " + relationPath + " " + scope;
    }
}
