package io.github.cyfko.filterable.core.spi;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.api.Op;

import java.util.List;
import java.util.function.Consumer;

/**
 * Sink receiving the clauses compiled from a filter request.
 * <p>
 * {@code QueryBuilder} is the seam between the filter compiler and whatever executes the
 * resulting predicates. Each builder instance represents one predicate group: the clauses
 * added to it are combined with the connector of that group. Nested groups and relation
 * scopes receive their own builder through the supplied callback.
 * </p>
 *
 * <h2>Call Order</h2>
 * <p>
 * The compiler calls a builder in the iteration order of the request mappings. Implementations
 * must keep that order in the predicates they produce.
 * </p>
 *
 * <h2>Failures</h2>
 * <p>
 * The compiler never catches exceptions thrown by a builder. An implementation rejecting a call
 * (for instance because the storage layer has no such attribute) fails the whole compilation.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * // age >= 18 AND (EXISTS author WHERE country LIKE '%US%')
 * builder.compare("age", Op.GTE, "18");
 * builder.relation("author", scoped -> scoped.pattern("country", Op.MATCHES, "%US%"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see io.github.cyfko.filterable.core.FilterCompiler
 * @see io.github.cyfko.filterable.core.tree.PredicateTreeBuilder
 */
public interface QueryBuilder {

    /**
     * Opens a nested group whose members are combined with {@code connector}.
     * The group is added to this builder once {@code clauses} returns.
     * A group left empty by {@code clauses} must contribute nothing.
     *
     * @param connector how the members of the nested group are combined
     * @param clauses   callback populating the nested group
     */
    void group(Connector connector, Consumer<QueryBuilder> clauses);

    /**
     * Adds a single-value comparison.
     *
     * @param field field name, relative to the scope of this builder
     * @param op    one of {@link Op#EQ}, {@link Op#NE}, {@link Op#GT}, {@link Op#GTE}, {@link Op#LT}, {@link Op#LTE}
     * @param value operand, never {@code null}
     */
    void compare(String field, Op op, Object value);

    /**
     * Adds a membership test. An empty {@code values} list makes {@link Op#IN} fail
     * for every row and {@link Op#NOT_IN} hold for every row.
     *
     * @param field  field name
     * @param op     {@link Op#IN} or {@link Op#NOT_IN}
     * @param values candidate values, in request order
     */
    void membership(String field, Op op, List<Object> values);

    /**
     * Adds an inclusive range test.
     *
     * @param field field name
     * @param op    {@link Op#RANGE} or {@link Op#NOT_RANGE}
     * @param low   lower bound, never {@code null}
     * @param high  upper bound, never {@code null}
     */
    void range(String field, Op op, Object low, Object high);

    /**
     * Adds a null check.
     *
     * @param field field name
     * @param op    {@link Op#IS_NULL} or {@link Op#NOT_NULL}
     */
    void nullCheck(String field, Op op);

    /**
     * Adds a wildcard pattern match. {@code pattern} already carries its {@code %} wildcards.
     *
     * @param field   field name
     * @param op      {@link Op#MATCHES} or {@link Op#NOT_MATCHES}
     * @param pattern pattern in SQL {@code LIKE} syntax
     */
    void pattern(String field, Op op, String pattern);

    /**
     * Adds an existence test over a relation: the row matches when at least one related
     * row reached through {@code relationPath} satisfies every clause added by {@code clauses}.
     * A scope left empty by {@code clauses} still requires the relation to exist.
     *
     * @param relationPath dot-separated relation path, such as {@code author.profile}
     * @param clauses      callback populating the scoped group, combined with AND
     */
    void relation(String relationPath, Consumer<QueryBuilder> clauses);
}
