package io.github.cyfko.filterable.core.api;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Enumeration of the operators a filter request may name.
 * <p>
 * Each operator carries the request keywords that select it. Keywords are matched
 * case-insensitively and several keywords may select the same operator
 * ({@code equal} and {@code =} both select {@link #EQ}).
 * </p>
 *
 * <p><strong>Example usage:</strong></p>
 * <pre>{@code
 * Op op = Op.fromKeyword("GTE");     // Op.GTE
 * Op alias = Op.fromKeyword("<>");   // Op.NE
 * Op other = Op.fromKeyword("regex"); // Op.UNKNOWN, the clause is dropped
 * }</pre>
 *
 * <p><strong>Keyword table:</strong></p>
 * <ul>
 *     <li>EQ / {@code equal}, {@code =}</li>
 *     <li>NE / {@code notequal}, {@code !=}, {@code <>}</li>
 *     <li>GT / {@code gt}, {@code >}</li>
 *     <li>GTE / {@code gte}, {@code >=}</li>
 *     <li>LT / {@code lt}, {@code <}</li>
 *     <li>LTE / {@code lte}, {@code <=}</li>
 *     <li>MATCHES / {@code like}</li>
 *     <li>NOT_MATCHES / {@code notlike}</li>
 *     <li>STARTS_WITH / {@code startswith}</li>
 *     <li>ENDS_WITH / {@code endswith}</li>
 *     <li>IN / {@code in}</li>
 *     <li>NOT_IN / {@code notin}</li>
 *     <li>RANGE / {@code between}</li>
 *     <li>NOT_RANGE / {@code notbetween}</li>
 *     <li>IS_NULL / {@code null}</li>
 *     <li>NOT_NULL / {@code notnull}</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum Op {

    /** Equality: {@code =} */
    EQ("=", "equal", "="),

    /** Inequality: {@code !=} */
    NE("!=", "notequal", "!=", "<>"),

    /** Greater than: {@code >} */
    GT(">", "gt", ">"),

    /** Greater than or equal: {@code >=} */
    GTE(">=", "gte", ">="),

    /** Less than: {@code <} */
    LT("<", "lt", "<"),

    /** Less than or equal: {@code <=} */
    LTE("<=", "lte", "<="),

    /** Substring match: {@code LIKE '%v%'} */
    MATCHES("LIKE", "like"),

    /** Negated substring match: {@code NOT LIKE '%v%'} */
    NOT_MATCHES("NOT LIKE", "notlike"),

    /** Prefix match: {@code LIKE 'v%'} */
    STARTS_WITH("LIKE", "startswith"),

    /** Suffix match: {@code LIKE '%v'} */
    ENDS_WITH("LIKE", "endswith"),

    /** Membership: {@code IN} */
    IN("IN", "in"),

    /** Negated membership: {@code NOT IN} */
    NOT_IN("NOT IN", "notin"),

    /** Inclusive range: {@code BETWEEN} */
    RANGE("BETWEEN", "between"),

    /** Negated range: {@code NOT BETWEEN} */
    NOT_RANGE("NOT BETWEEN", "notbetween"),

    /** Null check: {@code IS NULL} */
    IS_NULL("IS NULL", "null"),

    /** Negated null check: {@code IS NOT NULL} */
    NOT_NULL("IS NOT NULL", "notnull"),

    /**
     * Marker for keywords that select no operator.
     * Clauses resolved to it contribute nothing.
     */
    UNKNOWN(null);

    private static final Map<String, Op> BY_KEYWORD;

    static {
        Map<String, Op> byKeyword = new HashMap<>();
        for (Op op : values()) {
            for (String keyword : op.keywords) {
                byKeyword.put(keyword, op);
            }
        }
        BY_KEYWORD = Collections.unmodifiableMap(byKeyword);
    }

    private final String symbol;
    private final List<String> keywords;

    Op(String symbol, String... keywords) {
        this.symbol = symbol;
        this.keywords = List.of(keywords);
    }

    /**
     * Returns the display symbol of the operator, such as {@code >=} or {@code NOT IN}.
     *
     * @return the symbol representing the operator
     * @throws UnsupportedOperationException for {@link #UNKNOWN}
     */
    public String getSymbol() {
        if (this == UNKNOWN)
            throw new UnsupportedOperationException("UNKNOWN operator has no symbol.");
        return symbol;
    }

    /**
     * Finds the operator selected by a request keyword, ignoring case.
     * <p>
     * The keyword is not trimmed: {@code " gt"} is not a keyword.
     * </p>
     *
     * @param keyword keyword read from the request, may be {@code null}
     * @return matching operator, {@link #UNKNOWN} when nothing matches; never {@code null}
     */
    public static Op fromKeyword(String keyword) {
        if (keyword == null) return UNKNOWN;
        return BY_KEYWORD.getOrDefault(keyword.toLowerCase(Locale.ROOT), UNKNOWN);
    }

    /**
     * Indicates whether the operator compares the field against a single value.
     *
     * @return {@code true} for EQ, NE, GT, GTE, LT and LTE
     */
    public boolean isComparison() {
        return this == EQ || this == NE || this == GT || this == GTE || this == LT || this == LTE;
    }

    /**
     * Indicates whether the operator is a wildcard pattern match.
     *
     * @return {@code true} for MATCHES, NOT_MATCHES, STARTS_WITH and ENDS_WITH
     */
    public boolean isPattern() {
        return this == MATCHES || this == NOT_MATCHES || this == STARTS_WITH || this == ENDS_WITH;
    }

    /**
     * Indicates whether the operator negates its positive counterpart.
     *
     * @return {@code true} for NE, NOT_MATCHES, NOT_IN, NOT_RANGE and NOT_NULL
     */
    public boolean isNegated() {
        return this == NE || this == NOT_MATCHES || this == NOT_IN || this == NOT_RANGE || this == NOT_NULL;
    }
}
