package io.github.cyfko.filterable.core.parsing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Expands flat request parameters written in bracket notation into nested mappings.
 * <p>
 * Servlet containers expose query parameters as a flat {@code Map<String, String[]>}.
 * This parser rebuilds the structure the names describe:
 * </p>
 * <pre>{@code
 * filter[age][gte]=18                 → {filter={age={gte=18}}}
 * filter[status][in][]=a&...[in][]=b  → {filter={status={in=[a, b]}}}
 * filter[author.country]=US           → {filter={author.country=US}}
 * page=2                              → {page=2}
 * }</pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>An empty bracket pair {@code []} appends to the node at the next free index.</li>
 *   <li>A repeated name without {@code []} keeps its last value.</li>
 *   <li>A later scalar replaces an earlier mapping at the same place and vice versa.</li>
 *   <li>A name whose brackets do not close, or that starts with {@code [}, is kept as a literal key.</li>
 *   <li>Mappings whose keys are exactly {@code 0..n-1} in order are returned as {@code List}s.</li>
 *   <li>Keys keep the order of their first appearance.</li>
 * </ul>
 *
 * <p>This class is designed to be used statically and cannot be instantiated.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class BracketParameterParser {

    private BracketParameterParser() {}

    /**
     * Parses a servlet-style parameter map.
     *
     * @param parameters parameter names to their values, in request order
     * @return nested parameters
     * @throws NullPointerException if {@code parameters} is {@code null}
     */
    public static Map<String, Object> parse(Map<String, String[]> parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Map<String, Object> root = new LinkedHashMap<>();
        Map<Map<String, Object>, Integer> nextIndexes = new IdentityHashMap<>();
        parameters.forEach((name, values) -> {
            if (values == null || values.length == 0) {
                insert(root, name, "", nextIndexes);
            } else {
                for (String value : values) {
                    insert(root, name, value, nextIndexes);
                }
            }
        });
        return listify(root);
    }

    /**
     * Parses parameters given as name to value lists.
     *
     * @param parameters parameter names to their values, in request order
     * @return nested parameters
     */
    public static Map<String, Object> parseMulti(Map<String, ? extends Collection<String>> parameters) {
        Objects.requireNonNull(parameters, "parameters cannot be null");
        Map<String, String[]> flat = new LinkedHashMap<>();
        parameters.forEach((name, values) ->
                flat.put(name, values == null ? new String[0] : values.toArray(new String[0])));
        return parse(flat);
    }

    /**
     * Splits a parameter name into its path segments.
     * An empty segment stands for {@code []}.
     *
     * @param name parameter name
     * @return segments, or a single segment holding the whole name when the brackets are malformed
     */
    static List<String> segments(String name) {
        int open = name.indexOf('[');
        if (open <= 0) {
            return List.of(name);
        }

        List<String> segments = new ArrayList<>();
        segments.add(name.substring(0, open));
        int cursor = open;
        while (cursor < name.length() && name.charAt(cursor) == '[') {
            int close = name.indexOf(']', cursor + 1);
            if (close < 0) {
                return List.of(name);
            }
            segments.add(name.substring(cursor + 1, close));
            cursor = close + 1;
        }
        return cursor == name.length() ? segments : List.of(name);
    }

    /**
     * Inserts one value. {@code nextIndexes} holds, per node, the index the next {@code []} takes:
     * one past the highest index key written so far.
     */
    @SuppressWarnings("unchecked")
    private static void insert(Map<String, Object> root, String name, String value,
                               Map<Map<String, Object>, Integer> nextIndexes) {
        List<String> path = segments(name);
        Map<String, Object> node = root;
        for (int i = 0; i < path.size() - 1; i++) {
            String key = keyFor(node, path.get(i), nextIndexes);
            Object child = node.get(key);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                put(node, key, child, nextIndexes);
            }
            node = (Map<String, Object>) child;
        }
        put(node, keyFor(node, path.get(path.size() - 1), nextIndexes), value, nextIndexes);
    }

    private static String keyFor(Map<String, Object> node, String segment,
                                 Map<Map<String, Object>, Integer> nextIndexes) {
        return segment.isEmpty() ? String.valueOf(nextIndexes.getOrDefault(node, 0)) : segment;
    }

    private static void put(Map<String, Object> node, String key, Object value,
                            Map<Map<String, Object>, Integer> nextIndexes) {
        node.put(key, value);
        if (isIndex(key)) {
            nextIndexes.merge(node, Integer.parseInt(key) + 1, Math::max);
        }
    }

    private static boolean isIndex(String key) {
        if (key.isEmpty() || key.length() > 9 || (key.length() > 1 && key.charAt(0) == '0')) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            if (key.charAt(i) < '0' || key.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> listify(Map<String, Object> node) {
        node.replaceAll((key, value) -> value instanceof Map ? toListIfSequential(listify((Map<String, Object>) value)) : value);
        return node;
    }

    private static Object toListIfSequential(Map<String, Object> node) {
        int expected = 0;
        for (String key : node.keySet()) {
            if (!key.equals(String.valueOf(expected++))) {
                return node;
            }
        }
        return new ArrayList<>(node.values());
    }
}
