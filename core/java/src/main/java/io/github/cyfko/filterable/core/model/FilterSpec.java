package io.github.cyfko.filterable.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw filters extracted from one request, before any validation.
 *
 * <p>
 * A {@code FilterSpec} holds two ordered mappings from filter key to value:
 * </p>
 * <dl>
 *   <dt><strong>{@code all}</strong></dt>
 *   <dd>filters that must all match (read from {@code filter} by default)</dd>
 *   <dt><strong>{@code any}</strong></dt>
 *   <dd>filters of which at least one must match (read from {@code filter_any} by default)</dd>
 * </dl>
 * <p>
 * Keys follow the {@code field} or {@code relationPath.field} grammar. A value is either a
 * scalar (substring search) or a {@code Map} from operator keyword to operand. Values are kept
 * exactly as received, {@code null} included; the compiler decides what to skip.
 * </p>
 *
 * <pre>{@code
 * FilterSpec spec = FilterSpec.builder()
 *     .all("status", Map.of("in", List.of("active", "pending")))
 *     .all("author.country", "US")
 *     .any("title", "java")
 *     .build();
 * }</pre>
 *
 * <p>Instances are immutable.</p>
 *
 * @param all filters combined with AND, in request order
 * @param any filters combined with OR, in request order
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterSpec(Map<String, Object> all, Map<String, Object> any) {

    private static final FilterSpec EMPTY = new FilterSpec(null, null);

    public FilterSpec {
        all = all == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(all));
        any = any == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(any));
    }

    /**
     * Returns the instance carrying no filter.
     *
     * @return shared empty instance
     */
    public static FilterSpec empty() {
        return EMPTY;
    }

    /**
     * Creates filters from two mappings of any value type.
     *
     * @param all filters combined with AND, {@code null} for none
     * @param any filters combined with OR, {@code null} for none
     * @return new instance
     */
    public static FilterSpec of(Map<String, ?> all, Map<String, ?> any) {
        return new FilterSpec(
                all == null ? null : new LinkedHashMap<String, Object>(all),
                any == null ? null : new LinkedHashMap<String, Object>(any));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns {@code true} when neither mapping holds an entry.
     *
     * @return whether the request carried no filter at all
     */
    public boolean isEmpty() {
        return all.isEmpty() && any.isEmpty();
    }

    /**
     * Fluent builder keeping insertion order.
     */
    public static class Builder {
        private final Map<String, Object> all = new LinkedHashMap<>();
        private final Map<String, Object> any = new LinkedHashMap<>();

        /**
         * Adds a filter that must match.
         *
         * @param key   filter key
         * @param value scalar or operator mapping
         * @return this builder
         */
        public Builder all(String key, Object value) {
            all.put(key, value);
            return this;
        }

        /**
         * Adds a filter of which at least one of the {@code any} group must match.
         *
         * @param key   filter key
         * @param value scalar or operator mapping
         * @return this builder
         */
        public Builder any(String key, Object value) {
            any.put(key, value);
            return this;
        }

        public FilterSpec build() {
            return new FilterSpec(all, any);
        }
    }
}
