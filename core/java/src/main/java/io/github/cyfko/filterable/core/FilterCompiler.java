package io.github.cyfko.filterable.core;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.config.AllowList;
import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.model.FilterKey;
import io.github.cyfko.filterable.core.model.FilterSpec;
import io.github.cyfko.filterable.core.model.Operand;
import io.github.cyfko.filterable.core.parsing.KeyResolver;
import io.github.cyfko.filterable.core.parsing.OperandDecoder;
import io.github.cyfko.filterable.core.parsing.RequestNormalizer;
import io.github.cyfko.filterable.core.spi.QueryBuilder;
import io.github.cyfko.filterable.core.tree.GroupNode;
import io.github.cyfko.filterable.core.tree.PredicateTreeBuilder;
import io.github.cyfko.filterable.core.tree.TreeSimplifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Compiles filter requests into predicates.
 *
 * <p>
 * A compiler is bound to the {@link AllowList} of one entity and to a {@link FilterConfig}.
 * For each request it reads the AND mapping ({@code filter}) and the OR mapping
 * ({@code filter_any}), drops every key the allow-list does not cover, percent-decodes the
 * operands and emits the clauses into a {@link QueryBuilder}.
 * </p>
 *
 * <h2>Composition</h2>
 * <ul>
 *   <li>the AND group and the OR group are combined with AND</li>
 *   <li>keys of the AND mapping are combined with AND, keys of the OR mapping with OR</li>
 *   <li>the operator clauses of one key are always combined with AND</li>
 *   <li>a relation key {@code a.b.c} becomes an existence test over {@code a.b} scoped to field {@code c}</li>
 *   <li>a scalar value {@code v} becomes {@code field LIKE '%v%'}</li>
 * </ul>
 *
 * <h2>Untrusted Input</h2>
 * <p>
 * Nothing in a request makes compilation fail. Disallowed keys, unknown operators, operands of
 * the wrong shape and empty values are dropped and logged at {@code FINE}. Exceptions thrown by
 * the {@link QueryBuilder} are not caught.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * FilterCompiler compiler = new FilterCompiler(
 *     AllowList.builder().fields("status", "age").relations("author").build());
 *
 * // ?filter[status][in][]=active&filter[status][in][]=pending&filter[age][gte]=18
 * GroupNode tree = compiler.compile(request);
 * // AND(status IN ['active', 'pending'], age >= '18')
 *
 * // or straight into a backend
 * compiler.apply(compiler.normalize(request), jpaQueryBuilder);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Instances are immutable and can be shared between threads. Builders are not: each compilation
 * must receive its own.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see QueryBuilder
 * @see AllowList
 */
public class FilterCompiler {

    private static final Logger logger = Logger.getLogger(FilterCompiler.class.getName());

    private final AllowList allowList;
    private final FilterConfig config;
    private final KeyResolver keyResolver;

    public FilterCompiler(AllowList allowList) {
        this(allowList, FilterConfig.defaults());
    }

    public FilterCompiler(AllowList allowList, FilterConfig config) {
        this.allowList = Objects.requireNonNull(allowList, "allowList cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.keyResolver = new KeyResolver(allowList);
    }

    public AllowList getAllowList() {
        return allowList;
    }

    public FilterConfig getConfig() {
        return config;
    }

    /**
     * Extracts the filters of a decoded request using this compiler's request key names.
     *
     * @param request nested request parameters
     * @return the filters, never {@code null}
     */
    public FilterSpec normalize(Map<String, ?> request) {
        return RequestNormalizer.normalize(request, config);
    }

    /**
     * Compiles a decoded request into a simplified predicate tree.
     *
     * @param request nested request parameters
     * @return root AND group
     */
    public GroupNode compile(Map<String, ?> request) {
        return compile(normalize(request));
    }

    /**
     * Compiles filters into a simplified predicate tree.
     *
     * @param spec filters of one request
     * @return root AND group, empty when nothing passed
     */
    public GroupNode compile(FilterSpec spec) {
        PredicateTreeBuilder builder = new PredicateTreeBuilder(Connector.AND);
        apply(spec, builder);
        return TreeSimplifier.simplify(builder.build());
    }

    /**
     * Emits the clauses of {@code spec} into {@code builder}.
     * <p>
     * The AND mapping is emitted as one AND group, then the OR mapping as one OR group. A mapping
     * without entries emits nothing.
     * </p>
     *
     * @param spec    filters of one request
     * @param builder target builder, its own members combined with AND
     */
    public void apply(FilterSpec spec, QueryBuilder builder) {
        Objects.requireNonNull(spec, "spec cannot be null");
        Objects.requireNonNull(builder, "builder cannot be null");

        if (!spec.all().isEmpty()) {
            builder.group(Connector.AND, group -> applyGroup(group, spec.all()));
        }
        if (!spec.any().isEmpty()) {
            builder.group(Connector.OR, group -> applyGroup(group, spec.any()));
        }
    }

    private void applyGroup(QueryBuilder group, Map<String, Object> filters) {
        filters.forEach((key, value) -> {
            if (isEmptyValue(value)) {
                logger.fine(() -> "Skipping filter '" + key + "': empty value");
                return;
            }

            FilterKey filterKey = keyResolver.resolve(key);
            switch (filterKey.kind()) {
                case DIRECT -> applyField(group, filterKey.field(), value);
                case RELATION -> group.relation(filterKey.relationPath(),
                        scoped -> applyField(scoped, filterKey.field(), value));
                default -> logger.fine(() -> "Skipping filter '" + key + "': not allowed");
            }
        });
    }

    /**
     * Only {@code null} and the empty string are empty; {@code 0} and {@code "0"} are values.
     */
    private static boolean isEmptyValue(Object value) {
        return value == null || "".equals(value);
    }

    private void applyField(QueryBuilder builder, String field, Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            Map<String, Object> clauses = asOperatorMap(value);
            builder.group(Connector.AND, group -> clauses.forEach((keyword, operand) ->
                    applyClause(group, field, keyword, OperandDecoder.decode(Operand.of(operand)))));
            return;
        }

        Object decoded = OperandDecoder.decode(Operand.of(value)).unwrap();
        builder.pattern(field, Op.MATCHES, "%" + patternText(decoded) + "%");
    }

    private void applyClause(QueryBuilder builder, String field, String keyword, Operand operand) {
        Op op = Op.fromKeyword(keyword);
        if (op.isComparison()) {
            applyComparison(builder, field, op, operand);
        } else if (op.isPattern()) {
            applyPattern(builder, field, op, operand);
        } else {
            switch (op) {
                case IN, NOT_IN -> builder.membership(field, op, flatten(operand));
                case RANGE, NOT_RANGE -> applyRange(builder, field, op, operand);
                case IS_NULL, NOT_NULL -> builder.nullCheck(field, op);
                default -> logger.fine(() -> "Dropping clause on '" + field + "': unknown operator");
            }
        }
    }

    private void applyComparison(QueryBuilder builder, String field, Op op, Operand operand) {
        if (!(operand instanceof Operand.Scalar scalar)) {
            logger.fine(() -> "Dropping " + op + " clause on '" + field + "': operand is a sequence");
            return;
        }

        if (scalar.value() != null) {
            builder.compare(field, op, scalar.value());
        } else if (op == Op.EQ) {
            builder.nullCheck(field, Op.IS_NULL);
        } else if (op == Op.NE) {
            builder.nullCheck(field, Op.NOT_NULL);
        } else {
            logger.fine(() -> "Dropping " + op + " clause on '" + field + "': operand is null");
        }
    }

    private void applyPattern(QueryBuilder builder, String field, Op op, Operand operand) {
        if (!(operand instanceof Operand.Scalar scalar)) {
            logger.fine(() -> "Dropping " + op + " clause on '" + field + "': operand is a sequence");
            return;
        }

        String text = patternText(scalar.value());
        switch (op) {
            case STARTS_WITH -> builder.pattern(field, Op.MATCHES, text + "%");
            case ENDS_WITH -> builder.pattern(field, Op.MATCHES, "%" + text);
            default -> builder.pattern(field, op, "%" + text + "%");
        }
    }

    private void applyRange(QueryBuilder builder, String field, Op op, Operand operand) {
        if (operand instanceof Operand.Sequence sequence && sequence.size() == 2
                && sequence.items().get(0) instanceof Operand.Scalar low && low.value() != null
                && sequence.items().get(1) instanceof Operand.Scalar high && high.value() != null) {
            builder.range(field, op, low.value(), high.value());
        } else {
            logger.fine(() -> "Dropping " + op + " clause on '" + field + "': expected two bounds");
        }
    }

    private static String patternText(Object value) {
        return value == null ? "" : value.toString();
    }

    /**
     * Coerces an operand to the list of its scalar values; nested sequences are flattened
     * and a lone null scalar yields an empty list.
     */
    private static List<Object> flatten(Operand operand) {
        List<Object> values = new ArrayList<>();
        if (operand.unwrap() == null) {
            return values;
        }
        collect(operand, values);
        return values;
    }

    private static void collect(Operand operand, List<Object> values) {
        if (operand instanceof Operand.Sequence sequence) {
            sequence.items().forEach(item -> collect(item, values));
        } else {
            values.add(operand.unwrap());
        }
    }

    /**
     * Reads a mapping value as operator keyword to operand. A list reads as a mapping keyed by index.
     */
    private static Map<String, Object> asOperatorMap(Object value) {
        Map<String, Object> clauses = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((keyword, operand) -> clauses.put(Objects.toString(keyword, null), operand));
        } else {
            List<?> list = (List<?>) value;
            for (int i = 0; i < list.size(); i++) {
                clauses.put(String.valueOf(i), list.get(i));
            }
        }
        return clauses;
    }
}
