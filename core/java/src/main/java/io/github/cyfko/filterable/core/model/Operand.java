package io.github.cyfko.filterable.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Operand of a filter clause: either a single {@link Scalar} or an ordered {@link Sequence}
 * of operands.
 * <p>
 * Request values arrive as loosely typed Java objects ({@code String}, {@code Number},
 * {@code List}, {@code Map}, arrays). {@link #of(Object)} folds them into this two-case shape:
 * collections and arrays become sequences, a {@code Map} becomes the sequence of its values in
 * iteration order, anything else becomes a scalar.
 * </p>
 *
 * <pre>{@code
 * Operand.of("18");                       // Scalar[value=18]
 * Operand.of(List.of("a", List.of("b"))); // Sequence[Scalar[a], Sequence[Scalar[b]]]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Operand {

    /**
     * Returns the plain Java form: the scalar value, or a {@code List} for a sequence.
     *
     * @return unwrapped value, possibly {@code null} for a null scalar
     */
    Object unwrap();

    /**
     * Wraps a raw request value.
     *
     * @param raw value read from the request, may be {@code null}
     * @return operand of the same shape
     */
    static Operand of(Object raw) {
        if (raw instanceof Operand operand) {
            return operand;
        }
        if (raw instanceof Map<?, ?> map) {
            return Sequence.of(map.values());
        }
        if (raw instanceof Collection<?> collection) {
            return Sequence.of(collection);
        }
        if (raw instanceof Object[] array) {
            List<Object> items = new ArrayList<>(array.length);
            Collections.addAll(items, array);
            return Sequence.of(items);
        }
        return new Scalar(raw);
    }

    /**
     * Single value.
     *
     * @param value the value, {@code null} allowed
     */
    record Scalar(Object value) implements Operand {
        @Override
        public Object unwrap() {
            return value;
        }
    }

    /**
     * Ordered list of operands.
     *
     * @param items operands in request order
     */
    record Sequence(List<Operand> items) implements Operand {

        public Sequence {
            items = List.copyOf(items);
        }

        static Sequence of(Collection<?> raw) {
            List<Operand> items = new ArrayList<>(raw.size());
            for (Object item : raw) {
                items.add(Operand.of(item));
            }
            return new Sequence(items);
        }

        public int size() {
            return items.size();
        }

        @Override
        public Object unwrap() {
            List<Object> values = new ArrayList<>(items.size());
            for (Operand item : items) {
                values.add(item.unwrap());
            }
            return values;
        }
    }
}
