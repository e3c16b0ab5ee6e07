package io.github.cyfko.filterable.jpa;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.exception.FilterValidationException;
import io.github.cyfko.filterable.core.spi.QueryBuilder;
import io.github.cyfko.filterable.core.utils.TypeConversionUtils;
import io.github.cyfko.filterable.jpa.utils.PathResolverUtils;
import jakarta.persistence.criteria.CommonAbstractCriteria;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link QueryBuilder} translating compiled filters into JPA Criteria API predicates.
 *
 * <h2>Translation</h2>
 * <ul>
 *   <li>groups become {@code cb.and(...)} or {@code cb.or(...)}; a group without members
 *       contributes nothing to its parent</li>
 *   <li>comparisons, ranges and null checks map to their Criteria counterparts</li>
 *   <li>{@code IN} over an empty list is false, {@code NOT IN} over an empty list is true</li>
 *   <li>pattern matches on non-string attributes compare the attribute's string form</li>
 *   <li>a relation scope becomes a correlated {@code EXISTS} subquery joining every segment of the
 *       relation path, so to-many relations never duplicate root rows</li>
 * </ul>
 *
 * <h2>Type conversion</h2>
 * <p>
 * Operands are converted to the Java type of their attribute with
 * {@link TypeConversionUtils#convertValue(Class, Object)} before binding. An operand that cannot
 * be converted raises a {@link FilterValidationException}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CriteriaQuery<Book> query = cb.createQuery(Book.class);
 * Root<Book> root = query.from(Book.class);
 *
 * JpaQueryBuilder builder = new JpaQueryBuilder(root, query, cb);
 * compiler.apply(spec, builder);
 * query.where(builder.toPredicate());
 * }</pre>
 *
 * <p>Not thread-safe; one builder per query.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaQueryBuilder implements QueryBuilder {

    private final From<?, ?> from;
    private final CommonAbstractCriteria query;
    private final CriteriaBuilder cb;
    private final Connector connector;
    private final List<Predicate> predicates = new ArrayList<>();

    /**
     * Creates a builder whose members are combined with AND.
     *
     * @param from  entity the filtered fields belong to, usually the query root
     * @param query query or subquery receiving the predicate
     * @param cb    criteria builder
     */
    public JpaQueryBuilder(From<?, ?> from, CommonAbstractCriteria query, CriteriaBuilder cb) {
        this(from, query, cb, Connector.AND);
    }

    private JpaQueryBuilder(From<?, ?> from, CommonAbstractCriteria query, CriteriaBuilder cb, Connector connector) {
        this.from = Objects.requireNonNull(from, "from cannot be null");
        this.query = Objects.requireNonNull(query, "query cannot be null");
        this.cb = Objects.requireNonNull(cb, "cb cannot be null");
        this.connector = connector;
    }

    /**
     * Returns the combination of every member added so far.
     *
     * @return the predicate, {@code cb.conjunction()} when no member was added
     */
    public Predicate toPredicate() {
        return predicates.isEmpty() ? cb.conjunction() : combine();
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    @Override
    public void group(Connector connector, Consumer<QueryBuilder> clauses) {
        JpaQueryBuilder group = new JpaQueryBuilder(from, query, cb, connector);
        clauses.accept(group);
        if (!group.isEmpty()) {
            predicates.add(group.combine());
        }
    }

    @Override
    public void compare(String field, Op op, Object value) {
        Path<?> path = PathResolverUtils.resolveAttribute(from, field);
        Object converted = convert(path, field, value);
        predicates.add(switch (op) {
            case EQ -> cb.equal(path, converted);
            case NE -> cb.notEqual(path, converted);
            case GT, GTE, LT, LTE -> ordered(op, path, converted);
            default -> throw new IllegalArgumentException("Not a comparison operator: " + op);
        });
    }

    @Override
    public void membership(String field, Op op, List<Object> values) {
        if (values.isEmpty()) {
            predicates.add(op.isNegated() ? cb.conjunction() : cb.disjunction());
            return;
        }

        Path<?> path = PathResolverUtils.resolveAttribute(from, field);
        List<Object> converted = new ArrayList<>(values.size());
        for (Object value : values) {
            converted.add(convert(path, field, value));
        }

        Predicate in = path.in(converted);
        predicates.add(op.isNegated() ? cb.not(in) : in);
    }

    @Override
    @SuppressWarnings({"rawtypes", "unchecked"})
    public void range(String field, Op op, Object low, Object high) {
        Path<?> path = PathResolverUtils.resolveAttribute(from, field);
        Comparable lower = castToComparable(convert(path, field, low));
        Comparable upper = castToComparable(convert(path, field, high));

        Predicate between = cb.between((Expression) path, lower, upper);
        predicates.add(op.isNegated() ? cb.not(between) : between);
    }

    @Override
    public void nullCheck(String field, Op op) {
        Path<?> path = PathResolverUtils.resolveAttribute(from, field);
        predicates.add(op.isNegated() ? cb.isNotNull(path) : cb.isNull(path));
    }

    @Override
    public void pattern(String field, Op op, String pattern) {
        Expression<String> target = asString(PathResolverUtils.resolveAttribute(from, field));
        predicates.add(op.isNegated() ? cb.notLike(target, pattern) : cb.like(target, pattern));
    }

    @Override
    public void relation(String relationPath, Consumer<QueryBuilder> clauses) {
        Subquery<Integer> subquery = query.subquery(Integer.class);
        From<?, ?> related = PathResolverUtils.joinPath(correlate(subquery, from), relationPath);

        JpaQueryBuilder scope = new JpaQueryBuilder(related, subquery, cb, Connector.AND);
        clauses.accept(scope);

        subquery.select(cb.literal(1));
        if (!scope.isEmpty()) {
            subquery.where(scope.combine());
        }
        predicates.add(cb.exists(subquery));
    }

    private Predicate combine() {
        Predicate[] members = predicates.toArray(new Predicate[0]);
        return connector == Connector.OR ? cb.or(members) : cb.and(members);
    }

    private static From<?, ?> correlate(Subquery<?> subquery, From<?, ?> from) {
        if (from instanceof Root<?> root) {
            return subquery.correlate(root);
        }
        if (from instanceof Join<?, ?> join) {
            return subquery.correlate(join);
        }
        throw new IllegalArgumentException("Cannot correlate " + from.getClass().getName());
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private Predicate ordered(Op op, Path<?> path, Object value) {
        Expression<Comparable> expression = (Expression) path;
        Comparable comparable = castToComparable(value);
        return switch (op) {
            case GT -> cb.greaterThan(expression, comparable);
            case GTE -> cb.greaterThanOrEqualTo(expression, comparable);
            case LT -> cb.lessThan(expression, comparable);
            case LTE -> cb.lessThanOrEqualTo(expression, comparable);
            default -> throw new IllegalArgumentException("Not an ordered comparison: " + op);
        };
    }

    @SuppressWarnings("unchecked")
    private static Expression<String> asString(Path<?> path) {
        if (String.class.equals(path.getJavaType())) {
            return (Expression<String>) path;
        }
        return path.as(String.class);
    }

    /**
     * Converts an operand to the Java type of the attribute. The operand itself is left out of the
     * error message.
     */
    private static Object convert(Path<?> path, String field, Object value) {
        try {
            return TypeConversionUtils.convertValue(path.getJavaType(), value);
        } catch (IllegalArgumentException e) {
            throw new FilterValidationException(
                    String.format("Value for '%s' cannot be converted to %s", field, path.getJavaType().getSimpleName()), e);
        }
    }

    @SuppressWarnings("rawtypes")
    private static Comparable castToComparable(Object value) {
        if (value instanceof Comparable<?> cmp) {
            return cmp;
        }
        throw new FilterValidationException("Value is not comparable: " + value.getClass().getSimpleName());
    }
}
