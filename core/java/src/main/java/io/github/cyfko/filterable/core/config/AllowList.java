package io.github.cyfko.filterable.core.config;

import io.github.cyfko.filterable.core.exception.FilterDefinitionException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Fields and relations a filter request is allowed to reference.
 * <p>
 * {@code fields} lists the direct attributes that may be filtered. {@code relations} lists
 * relation <em>base</em> names: a relation key such as {@code author.profile.country} is allowed
 * when {@code author} is listed, whatever follows it. Both sets are empty by default, in which
 * case no filter passes.
 * </p>
 *
 * <pre>{@code
 * AllowList allowList = AllowList.builder()
 *     .fields("status", "age")
 *     .relations("author")
 *     .build();
 * }</pre>
 *
 * @param fields    allowed direct field names, compared case-sensitively
 * @param relations allowed relation base names, compared case-sensitively
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record AllowList(Set<String> fields, Set<String> relations) {

    private static final AllowList EMPTY = new AllowList(Set.of(), Set.of());

    /**
     * Canonical constructor with defensive copies.
     *
     * @throws NullPointerException      if a set or one of its elements is {@code null}
     * @throws FilterDefinitionException if a name is blank or contains a dot
     */
    public AllowList {
        fields = copyOf(fields, "fields");
        relations = copyOf(relations, "relations");
    }

    /**
     * Returns the allow-list accepting nothing.
     *
     * @return shared empty allow-list
     */
    public static AllowList empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean allowsField(String field) {
        return fields.contains(field);
    }

    public boolean allowsRelation(String relationBase) {
        return relations.contains(relationBase);
    }

    private static Set<String> copyOf(Set<String> names, String label) {
        Objects.requireNonNull(names, label + " cannot be null");
        Set<String> copy = new LinkedHashSet<>();
        for (String name : names) {
            Objects.requireNonNull(name, label + " cannot contain null");
            if (name.isBlank() || name.contains(".")) {
                throw new FilterDefinitionException(
                        "Invalid name '" + name + "' in " + label + ": names must be non-blank and contain no dot");
            }
            copy.add(name);
        }
        return Collections.unmodifiableSet(copy);
    }

    /**
     * Builder for {@link AllowList}.
     */
    public static final class Builder {
        private final Set<String> fields = new LinkedHashSet<>();
        private final Set<String> relations = new LinkedHashSet<>();

        public Builder fields(String... names) {
            Collections.addAll(fields, names);
            return this;
        }

        public Builder fields(Set<String> names) {
            fields.addAll(names);
            return this;
        }

        public Builder relations(String... names) {
            Collections.addAll(relations, names);
            return this;
        }

        public Builder relations(Set<String> names) {
            relations.addAll(names);
            return this;
        }

        public AllowList build() {
            return new AllowList(fields, relations);
        }
    }
}
