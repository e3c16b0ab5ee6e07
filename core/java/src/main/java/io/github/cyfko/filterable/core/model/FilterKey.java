package io.github.cyfko.filterable.core.model;

import java.util.Objects;

/**
 * Classification of a filter key against an allow-list.
 *
 * <ul>
 *   <li>{@link Kind#DIRECT}: {@code field} is the key itself, {@code relationPath} is {@code null}</li>
 *   <li>{@link Kind#RELATION}: {@code relationPath} holds every segment but the last,
 *       {@code field} the last segment ({@code a.b.c} → {@code a.b} / {@code c})</li>
 *   <li>{@link Kind#REJECTED}: the key contributes nothing, both parts are {@code null}</li>
 * </ul>
 *
 * @param raw          key as read from the request
 * @param kind         classification
 * @param relationPath dot-joined relation path, only for {@link Kind#RELATION}
 * @param field        field to compare, relative to the relation when there is one
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterKey(String raw, Kind kind, String relationPath, String field) {

    public enum Kind { DIRECT, RELATION, REJECTED }

    public FilterKey {
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    public static FilterKey direct(String raw) {
        return new FilterKey(raw, Kind.DIRECT, null, raw);
    }

    public static FilterKey relation(String raw, String relationPath, String field) {
        return new FilterKey(raw, Kind.RELATION, relationPath, field);
    }

    public static FilterKey rejected(String raw) {
        return new FilterKey(raw, Kind.REJECTED, null, null);
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }
}
