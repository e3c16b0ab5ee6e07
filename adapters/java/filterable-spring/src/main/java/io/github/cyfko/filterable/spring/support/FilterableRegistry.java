package io.github.cyfko.filterable.spring.support;

import io.github.cyfko.filterable.jpa.JpaFilterable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry of the {@link JpaFilterable} beans of an application, keyed by entity class.
 * <p>
 * Populated once at startup from every {@code JpaFilterable} bean. Declaring two filterables for
 * the same entity is a configuration error.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <pre>{@code
 * @Bean
 * JpaFilterable<Book> bookFilterable() {
 *     return new JpaFilterable<>(Book.class, AllowList.builder().fields("title").build(), filterConfig);
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * The registry is safe for concurrent reads after initialization. Registration occurs only at construction.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterableRegistry {

    private final Map<Class<?>, JpaFilterable<?>> filterablesByEntity;

    /**
     * Constructs the registry.
     *
     * @param filterables filterables to register
     * @throws IllegalStateException if two filterables target the same entity
     */
    public FilterableRegistry(List<JpaFilterable<?>> filterables) {
        Map<Class<?>, JpaFilterable<?>> byEntity = new LinkedHashMap<>();
        for (JpaFilterable<?> filterable : filterables) {
            JpaFilterable<?> previous = byEntity.put(filterable.getEntityClass(), filterable);
            if (previous != null) {
                throw new IllegalStateException(
                        "More than one JpaFilterable registered for " + filterable.getEntityClass().getName());
            }
        }
        this.filterablesByEntity = Collections.unmodifiableMap(byEntity);
    }

    /**
     * Retrieves the filterable of an entity.
     *
     * @param entityClass entity class to look up
     * @param <E>         entity type
     * @return the registered filterable
     * @throws IllegalArgumentException if no filterable is registered for the entity
     */
    @SuppressWarnings("unchecked")
    public <E> JpaFilterable<E> get(Class<E> entityClass) {
        JpaFilterable<?> filterable = filterablesByEntity.get(entityClass);
        if (filterable == null) {
            throw new IllegalArgumentException(
                    "No JpaFilterable found for entity " + entityClass.getName() + ". "
                            + "Declare a JpaFilterable bean for it.");
        }
        return (JpaFilterable<E>) filterable;
    }

    public boolean contains(Class<?> entityClass) {
        return filterablesByEntity.containsKey(entityClass);
    }

    public Set<Class<?>> getEntityClasses() {
        return filterablesByEntity.keySet();
    }
}
