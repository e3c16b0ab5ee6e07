package io.github.cyfko.filterable.jpa;

import io.github.cyfko.filterable.core.FilterCompiler;
import io.github.cyfko.filterable.core.config.AllowList;
import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.model.FilterSpec;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Filter facade for one JPA entity.
 * <p>
 * A {@code JpaFilterable} binds an entity class to the {@link AllowList} of names clients may filter
 * on. It turns request filters into {@link PredicateResolver}s and runs them as select or count
 * queries.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * JpaFilterable<Book> books = new JpaFilterable<>(Book.class,
 *     AllowList.builder()
 *         .fields("title", "status", "price")
 *         .relations("author")
 *         .build());
 *
 * // ?filter[status][in][]=PUBLISHED&filter[author.country]=US
 * List<Book> page = books.find(entityManager, request);
 * long total = books.count(entityManager, request);
 *
 * // or compose with other criteria
 * PredicateResolver<Book> resolver = books.toResolver(request);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.</p>
 *
 * @param <E> entity type
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaFilterable<E> {

    private static final Logger logger = Logger.getLogger(JpaFilterable.class.getName());

    private final Class<E> entityClass;
    private final FilterCompiler compiler;

    public JpaFilterable(Class<E> entityClass, AllowList allowList) {
        this(entityClass, allowList, FilterConfig.defaults());
    }

    public JpaFilterable(Class<E> entityClass, AllowList allowList, FilterConfig config) {
        this.entityClass = Objects.requireNonNull(entityClass, "entityClass cannot be null");
        this.compiler = new FilterCompiler(allowList, config);
    }

    public Class<E> getEntityClass() {
        return entityClass;
    }

    public FilterCompiler getCompiler() {
        return compiler;
    }

    /**
     * Creates a resolver for already extracted filters.
     *
     * @param spec filters of one request
     * @return deferred predicate
     */
    public PredicateResolver<E> toResolver(FilterSpec spec) {
        Objects.requireNonNull(spec, "spec cannot be null");
        return (root, query, cb) -> {
            JpaQueryBuilder builder = new JpaQueryBuilder(root, query, cb);
            compiler.apply(spec, builder);
            return builder.toPredicate();
        };
    }

    /**
     * Creates a resolver for the filters carried by a decoded request.
     *
     * @param request nested request parameters
     * @return deferred predicate
     */
    public PredicateResolver<E> toResolver(Map<String, ?> request) {
        return toResolver(compiler.normalize(request));
    }

    public List<E> find(EntityManager em, Map<String, ?> request) {
        return find(em, compiler.normalize(request));
    }

    /**
     * Loads every entity matching the filters.
     *
     * @param em   entity manager
     * @param spec filters of one request
     * @return matching entities, each at most once
     */
    public List<E> find(EntityManager em, FilterSpec spec) {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<E> query = cb.createQuery(entityClass);
        Root<E> root = query.from(entityClass);
        query.select(root).where(toResolver(spec).resolve(root, query, cb));

        List<E> results = em.createQuery(query).getResultList();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.fine(() -> String.format("%s filter query completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, results.size()));
        return results;
    }

    public long count(EntityManager em, Map<String, ?> request) {
        return count(em, compiler.normalize(request));
    }

    /**
     * Counts the entities matching the filters.
     *
     * @param em   entity manager
     * @param spec filters of one request
     * @return number of matching entities
     */
    public long count(EntityManager em, FilterSpec spec) {
        long startTime = System.nanoTime();

        CriteriaBuilder cb = em.getCriteriaBuilder();
        CriteriaQuery<Long> countQuery = cb.createQuery(Long.class);
        Root<E> root = countQuery.from(entityClass);
        countQuery.select(cb.count(root)).where(toResolver(spec).resolve(root, countQuery, cb));

        Long count = em.createQuery(countQuery).getSingleResult();

        long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        logger.fine(() -> String.format("%s count query completed in %dms: %d matches",
                entityClass.getSimpleName(), durationMs, count));
        return count;
    }
}
