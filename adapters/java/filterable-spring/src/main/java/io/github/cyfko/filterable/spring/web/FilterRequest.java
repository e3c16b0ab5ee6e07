package io.github.cyfko.filterable.spring.web;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query parameters of one request, expanded from bracket notation but not yet read under any
 * request key.
 * <p>
 * Declare a {@code FilterRequest} controller parameter when the filtered entity is registered with
 * its own request keys: the {@link io.github.cyfko.filterable.jpa.JpaFilterable} of that entity
 * reads the parameters with its own {@link io.github.cyfko.filterable.core.config.FilterConfig}.
 * </p>
 *
 * <pre>{@code
 * @GetMapping("/books")
 * List<Book> books(FilterRequest request) {
 *     return filterableService.find(Book.class, request);
 * }
 * }</pre>
 *
 * @param parameters nested request parameters, never null
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterRequest(Map<String, Object> parameters) {

    public FilterRequest {
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static FilterRequest empty() {
        return new FilterRequest(Map.of());
    }
}
