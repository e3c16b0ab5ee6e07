package io.github.cyfko.filterable.core.config;

import io.github.cyfko.filterable.core.exception.FilterDefinitionException;

import java.util.Objects;

/**
 * Central configuration object for filter request processing.
 * <p>
 * Holds the names of the two request entries carrying filters: the entry whose filters must all
 * match ({@code filter} by default) and the entry of which at least one filter must match
 * ({@code filter_any} by default). A builder keeps construction fluent and forward compatible.
 * </p>
 * <p>
 * Both keys may name the same entry, whose filters then feed both groups.
 * </p>
 *
 * <pre>{@code
 * FilterConfig config = FilterConfig.builder()
 *     .requestKey("where")
 *     .anyRequestKey("where_any")
 *     .build();
 * }</pre>
 */
public final class FilterConfig {

    /** Default name of the request entry whose filters are combined with AND. */
    public static final String DEFAULT_REQUEST_KEY = "filter";

    /** Default name of the request entry whose filters are combined with OR. */
    public static final String DEFAULT_ANY_REQUEST_KEY = "filter_any";

    private static final FilterConfig DEFAULTS = builder().build();

    private final String requestKey;
    private final String anyRequestKey;

    private FilterConfig(Builder builder) {
        this.requestKey = builder.requestKey;
        this.anyRequestKey = builder.anyRequestKey;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * Returns the configuration using {@code filter} and {@code filter_any}.
     *
     * @return shared default configuration
     */
    public static FilterConfig defaults() { return DEFAULTS; }

    public String getRequestKey() { return requestKey; }
    public String getAnyRequestKey() { return anyRequestKey; }

    @Override
    public String toString() {
        return "FilterConfig{requestKey='" + requestKey + "', anyRequestKey='" + anyRequestKey + "'}";
    }

    /**
     * Builder for {@link FilterConfig}.
     */
    public static final class Builder {
        private String requestKey = DEFAULT_REQUEST_KEY;
        private String anyRequestKey = DEFAULT_ANY_REQUEST_KEY;

        public Builder requestKey(String requestKey) {
            this.requestKey = requireName(requestKey, "requestKey");
            return this;
        }

        public Builder anyRequestKey(String anyRequestKey) {
            this.anyRequestKey = requireName(anyRequestKey, "anyRequestKey");
            return this;
        }

        public FilterConfig build() {
            return new FilterConfig(this);
        }

        private static String requireName(String name, String option) {
            Objects.requireNonNull(name, option);
            if (name.isBlank()) {
                throw new FilterDefinitionException(option + " must not be blank");
            }
            return name;
        }
    }
}
