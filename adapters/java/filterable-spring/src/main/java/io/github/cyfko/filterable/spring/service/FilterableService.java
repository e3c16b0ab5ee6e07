package io.github.cyfko.filterable.spring.service;

import io.github.cyfko.filterable.core.model.FilterSpec;
import io.github.cyfko.filterable.spring.support.FilterableRegistry;
import io.github.cyfko.filterable.spring.web.FilterRequest;
import jakarta.persistence.EntityManager;

import java.util.List;
import java.util.Objects;

/**
 * Runs filter requests against the registered entities.
 * <p>
 * The service looks up the {@link io.github.cyfko.filterable.jpa.JpaFilterable} of the requested
 * entity in the {@link FilterableRegistry} and executes it with the shared, transaction-bound
 * {@link EntityManager}.
 * </p>
 * <p>
 * A {@link FilterSpec} was already read under the application-wide request keys. A
 * {@link FilterRequest} is read under the request keys of the entity's own filterable.
 * </p>
 *
 * <pre>{@code
 * @GetMapping("/books")
 * List<Book> books(FilterSpec filters) {
 *     return filterableService.find(Book.class, filters);
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterableService {

    private final FilterableRegistry registry;
    private final EntityManager em;

    public FilterableService(FilterableRegistry registry, EntityManager em) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        this.em = Objects.requireNonNull(em, "em cannot be null");
    }

    /**
     * Loads the entities matching the filters.
     *
     * @param entityClass registered entity class
     * @param spec        filters of one request
     * @param <E>         entity type
     * @return matching entities
     * @throws IllegalArgumentException if no filterable is registered for the entity
     */
    public <E> List<E> find(Class<E> entityClass, FilterSpec spec) {
        return registry.get(entityClass).find(em, spec);
    }

    /**
     * Counts the entities matching the filters.
     *
     * @param entityClass registered entity class
     * @param spec        filters of one request
     * @return number of matches
     * @throws IllegalArgumentException if no filterable is registered for the entity
     */
    public long count(Class<?> entityClass, FilterSpec spec) {
        return registry.get(entityClass).count(em, spec);
    }

    /**
     * Loads the entities matching the filters of a request, read under the request keys of the
     * entity's filterable.
     *
     * @param entityClass registered entity class
     * @param request     expanded request parameters
     * @param <E>         entity type
     * @return matching entities
     * @throws IllegalArgumentException if no filterable is registered for the entity
     */
    public <E> List<E> find(Class<E> entityClass, FilterRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        return registry.get(entityClass).find(em, request.parameters());
    }

    /**
     * Counts the entities matching the filters of a request, read under the request keys of the
     * entity's filterable.
     *
     * @param entityClass registered entity class
     * @param request     expanded request parameters
     * @return number of matches
     * @throws IllegalArgumentException if no filterable is registered for the entity
     */
    public long count(Class<?> entityClass, FilterRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        return registry.get(entityClass).count(em, request.parameters());
    }
}
