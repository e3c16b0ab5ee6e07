package io.github.cyfko.filterable.jpa.utils;

import io.github.cyfko.filterable.core.exception.FilterDefinitionException;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;

/**
 * Resolves attribute names and dot-separated relation paths against a Criteria {@link From}.
 * <p>
 * Relation paths such as {@code "author.profile"} are navigated segment by segment, each segment
 * becoming an inner join from the previous one. Joins are reused when the same attribute was
 * already joined from the same {@code From}.
 * </p>
 *
 * <h2>Usage example:</h2>
 * <pre>{@code
 * From<?, ?> profile = PathResolverUtils.joinPath(root, "author.profile");
 * Path<?> country = PathResolverUtils.resolveAttribute(profile, "country");
 * }</pre>
 *
 * <p>
 * A name unknown to the entity model is a configuration mistake (the allow-list names something
 * the entity does not have) and is reported as a {@link FilterDefinitionException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class PathResolverUtils {

    private PathResolverUtils() {
        throw new UnsupportedOperationException("PathResolverUtils is a utility class and cannot be instantiated");
    }

    /**
     * Resolves a single attribute of {@code from}.
     *
     * @param from      entity or join the attribute belongs to
     * @param attribute attribute name, without dots
     * @return the attribute path
     * @throws FilterDefinitionException if the attribute does not exist
     */
    public static Path<?> resolveAttribute(From<?, ?> from, String attribute) {
        try {
            return from.get(attribute);
        } catch (IllegalArgumentException e) {
            throw new FilterDefinitionException(
                    String.format("Attribute '%s' not found in %s", attribute, from.getJavaType().getSimpleName()), e);
        }
    }

    /**
     * Joins every segment of a dot-separated relation path.
     *
     * @param from         starting entity or join
     * @param relationPath relation path, e.g. {@code "author.profile"}
     * @return the join reached by the last segment
     * @throws FilterDefinitionException if a segment is not a relation of the entity reached so far
     */
    public static From<?, ?> joinPath(From<?, ?> from, String relationPath) {
        if (relationPath == null || relationPath.isBlank()) {
            throw new IllegalArgumentException("Relation path cannot be null or blank");
        }

        From<?, ?> current = from;
        for (String segment : relationPath.split("\\.")) {
            current = joinOnce(current, segment);
        }
        return current;
    }

    /**
     * Join the attribute only once per From, avoids duplicate joins.
     */
    private static From<?, ?> joinOnce(From<?, ?> from, String attribute) {
        return from.getJoins().stream()
                .filter(j -> j.getAttribute().getName().equals(attribute))
                .findFirst()
                .<From<?, ?>>map(j -> j)
                .orElseGet(() -> join(from, attribute));
    }

    private static From<?, ?> join(From<?, ?> from, String attribute) {
        try {
            return from.join(attribute, JoinType.INNER);
        } catch (IllegalArgumentException e) {
            throw new FilterDefinitionException(
                    String.format("Relation '%s' not found in %s", attribute, from.getJavaType().getSimpleName()), e);
        }
    }
}
