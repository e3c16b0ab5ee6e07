package io.github.cyfko.filterable.core.parsing;

import io.github.cyfko.filterable.core.config.AllowList;
import io.github.cyfko.filterable.core.model.FilterKey;

import java.util.Objects;

/**
 * Classifies filter keys as direct fields, relation fields or rejected keys.
 *
 * <ul>
 *   <li>A key without a dot is a direct field and must be listed in {@link AllowList#fields()}.</li>
 *   <li>A key with a dot is a relation field. The part before the first dot must be listed in
 *       {@link AllowList#relations()}; the path after it is not checked. The key is split on its
 *       last dot into relation path and field.</li>
 *   <li>Every other key is rejected, including relation keys with an empty segment such as
 *       {@code author.} or {@code author..name}.</li>
 * </ul>
 *
 * <pre>{@code
 * KeyResolver resolver = new KeyResolver(AllowList.builder().fields("age").relations("author").build());
 * resolver.resolve("age");                    // DIRECT age
 * resolver.resolve("author.profile.country"); // RELATION author.profile / country
 * resolver.resolve("secret");                 // REJECTED
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class KeyResolver {

    private final AllowList allowList;

    public KeyResolver(AllowList allowList) {
        this.allowList = Objects.requireNonNull(allowList, "allowList cannot be null");
    }

    /**
     * Classifies a key.
     *
     * @param key key read from the request, may be {@code null}
     * @return the classification, never {@code null}
     */
    public FilterKey resolve(String key) {
        if (key == null || key.isEmpty()) {
            return FilterKey.rejected(key);
        }

        int firstDot = key.indexOf('.');
        if (firstDot < 0) {
            return allowList.allowsField(key) ? FilterKey.direct(key) : FilterKey.rejected(key);
        }

        String base = key.substring(0, firstDot);
        if (!allowList.allowsRelation(base) || hasEmptySegment(key)) {
            return FilterKey.rejected(key);
        }

        int lastDot = key.lastIndexOf('.');
        return FilterKey.relation(key, key.substring(0, lastDot), key.substring(lastDot + 1));
    }

    private static boolean hasEmptySegment(String key) {
        return key.startsWith(".") || key.endsWith(".") || key.contains("..");
    }
}
