package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link QueryBuilder} recording the calls it receives as a {@link PredicateNode} tree.
 * <p>
 * Each call appends one node, in call order. Groups and relation scopes are recorded through
 * child builders. The recorded tree is returned as is by {@link #build()}: empty groups and
 * single-child groups are kept, {@link TreeSimplifier} removes them.
 * </p>
 *
 * <pre>{@code
 * PredicateTreeBuilder builder = new PredicateTreeBuilder(Connector.AND);
 * builder.compare("age", Op.GTE, "18");
 * builder.relation("author", scoped -> scoped.pattern("country", Op.MATCHES, "%US%"));
 * builder.build(); // AND(age >= '18', EXISTS author AND(country LIKE '%US%'))
 * }</pre>
 *
 * <p>Not thread-safe; use one builder per compilation.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class PredicateTreeBuilder implements QueryBuilder {

    private final Connector connector;
    private final List<PredicateNode> children = new ArrayList<>();

    public PredicateTreeBuilder(Connector connector) {
        this.connector = Objects.requireNonNull(connector, "connector cannot be null");
    }

    @Override
    public void group(Connector connector, Consumer<QueryBuilder> clauses) {
        PredicateTreeBuilder group = new PredicateTreeBuilder(connector);
        clauses.accept(group);
        children.add(group.build());
    }

    @Override
    public void compare(String field, Op op, Object value) {
        children.add(new ComparisonNode(field, op, value));
    }

    @Override
    public void membership(String field, Op op, List<Object> values) {
        children.add(new MembershipNode(field, op, values));
    }

    @Override
    public void range(String field, Op op, Object low, Object high) {
        children.add(new RangeNode(field, op, low, high));
    }

    @Override
    public void nullCheck(String field, Op op) {
        children.add(new NullCheckNode(field, op));
    }

    @Override
    public void pattern(String field, Op op, String pattern) {
        children.add(new PatternNode(field, op, pattern));
    }

    @Override
    public void relation(String relationPath, Consumer<QueryBuilder> clauses) {
        PredicateTreeBuilder scope = new PredicateTreeBuilder(Connector.AND);
        clauses.accept(scope);
        children.add(new RelationNode(relationPath, scope.build()));
    }

    /**
     * Returns the group recorded so far.
     *
     * @return group with this builder's connector and the recorded children
     */
    public GroupNode build() {
        return new GroupNode(connector, children);
    }
}
