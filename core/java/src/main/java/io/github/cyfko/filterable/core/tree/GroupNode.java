package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Group combining its children with a {@link Connector}.
 *
 * @param connector how children are combined
 * @param children  children in emission order
 */
public record GroupNode(Connector connector, List<PredicateNode> children) implements PredicateNode {

    public GroupNode {
        Objects.requireNonNull(connector, "connector cannot be null");
        children = List.copyOf(children);
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public void applyTo(QueryBuilder builder) {
        builder.group(connector, group -> children.forEach(child -> child.applyTo(group)));
    }

    @Override
    public String toString() {
        return children.stream()
                .map(PredicateNode::toString)
                .collect(Collectors.joining(", ", connector + "(", ")"));
    }
}
