package io.github.cyfko.filterable.core.api;

/**
 * Boolean connector joining the members of a predicate group.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Connector {

    /** Every member must hold. An empty AND group holds. */
    AND,

    /** At least one member must hold. */
    OR
}
