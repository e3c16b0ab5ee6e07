package io.github.cyfko.filterable.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Deferred generator of JPA {@link Predicate}s.
 * <p>
 * A resolver captures compiled filters and builds the matching predicate once a query context
 * (root, query, criteria builder) is available. The same resolver can be applied to several
 * queries, for example to a select query and to the count query of the same page.
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Book> resolver = filterable.toResolver(request);
 *
 * CriteriaQuery<Book> query = cb.createQuery(Book.class);
 * Root<Book> root = query.from(Book.class);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> entity type of the query root
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Builds the predicate for a query.
     *
     * @param root  query root
     * @param query query receiving the predicate, used to create subqueries
     * @param cb    criteria builder
     * @return the predicate, never {@code null}; {@code cb.conjunction()} when there is no filter
     * @throws io.github.cyfko.filterable.core.exception.FilterValidationException if an operand cannot be
     *         converted to its attribute type
     * @throws io.github.cyfko.filterable.core.exception.FilterDefinitionException if an allowed name does
     *         not match an attribute of the entity
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);

    /**
     * Combines this resolver with another using AND.
     *
     * @param other resolver for the same root
     * @return resolver producing both predicates joined by AND
     */
    default PredicateResolver<E> and(PredicateResolver<E> other) {
        return (root, query, cb) -> cb.and(resolve(root, query, cb), other.resolve(root, query, cb));
    }
}
