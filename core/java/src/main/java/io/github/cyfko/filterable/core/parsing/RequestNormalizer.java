package io.github.cyfko.filterable.core.parsing;

import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.model.FilterSpec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Extracts the two filter mappings from a decoded request.
 * <p>
 * The request is the nested parameter structure produced by the transport layer (see
 * {@link BracketParameterParser} for servlet parameters). The AND mapping is read under
 * {@link FilterConfig#getRequestKey()}, the OR mapping under {@link FilterConfig#getAnyRequestKey()}.
 * A missing entry, or an entry that is not a mapping, yields an empty mapping.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class RequestNormalizer {

    private RequestNormalizer() {}

    /**
     * Builds the {@link FilterSpec} of a request.
     *
     * @param request decoded request parameters, {@code null} treated as empty
     * @param config  names of the filter entries
     * @return the filters carried by the request, never {@code null}
     */
    public static FilterSpec normalize(Map<String, ?> request, FilterConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        if (request == null || request.isEmpty()) {
            return FilterSpec.empty();
        }
        return new FilterSpec(
                mappingAt(request, config.getRequestKey()),
                mappingAt(request, config.getAnyRequestKey()));
    }

    private static Map<String, Object> mappingAt(Map<String, ?> request, String key) {
        if (!(request.get(key) instanceof Map<?, ?> raw)) {
            return null;
        }
        Map<String, Object> filters = new LinkedHashMap<>();
        raw.forEach((filterKey, value) -> filters.put(String.valueOf(filterKey), value));
        return filters;
    }
}
