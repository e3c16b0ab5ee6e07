package io.github.cyfko.filterable.core.exception;

/**
 * Exception thrown when the filtering setup supplied by the developer is invalid.
 * <p>
 * Filter <em>requests</em> never raise this exception: malformed or disallowed request entries
 * are dropped silently. It is reserved for configuration mistakes detected while building
 * {@link io.github.cyfko.filterable.core.config.FilterConfig} or
 * {@link io.github.cyfko.filterable.core.config.AllowList} instances, such as a blank request
 * key name or an allowed field containing a dot.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * FilterConfig.builder().requestKey(" ").build();
 * // → FilterDefinitionException: "requestKey must not be blank"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterDefinitionException extends RuntimeException {

    /**
     * Creates a new FilterDefinitionException with detailed message.
     *
     * @param message explanation of the configuration error
     */
    public FilterDefinitionException(String message) {
        super(message);
    }

    /**
     * Creates a new FilterDefinitionException with detailed message and cause.
     *
     * @param message explanation of the failure
     * @param cause underlying exception causing this failure
     */
    public FilterDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
