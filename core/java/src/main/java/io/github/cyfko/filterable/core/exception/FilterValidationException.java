package io.github.cyfko.filterable.core.exception;

/**
 * Exception thrown by a query backend when a compiled clause cannot be bound to storage.
 * <p>
 * The compiler itself never throws it. Backends such as the JPA adapter raise it when an
 * operand cannot be converted to the Java type of the attribute it is compared with, and the
 * exception travels unchanged through the compiler to the caller.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * // age is an Integer attribute
 * ?filter[age][gte]=abc
 * // → FilterValidationException: "Cannot convert operand 'abc' of field 'age' to java.lang.Integer"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterValidationException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the cause of the exception
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the cause of the exception
     * @param cause   the original cause, typically a parsing failure
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
