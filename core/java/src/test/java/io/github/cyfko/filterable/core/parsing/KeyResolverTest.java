package io.github.cyfko.filterable.core.parsing;

import io.github.cyfko.filterable.core.config.AllowList;
import io.github.cyfko.filterable.core.model.FilterKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyResolver Tests")
class KeyResolverTest {

    private final KeyResolver resolver = new KeyResolver(
            AllowList.builder().fields("status").relations("author").build());

    @Test
    @DisplayName("Should resolve an allowed direct key")
    void shouldResolveDirectKey() {
        FilterKey key = resolver.resolve("status");

        assertEquals(FilterKey.Kind.DIRECT, key.kind());
        assertEquals("status", key.field());
    }

    @Test
    @DisplayName("Should split a relation key at its last dot")
    void shouldSplitRelationKey() {
        FilterKey key = resolver.resolve("author.profile.country");

        assertEquals(FilterKey.Kind.RELATION, key.kind());
        assertEquals("author.profile", key.relationPath());
        assertEquals("country", key.field());
        assertEquals("author.profile.country", key.raw());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "password", "Status", "author", "editor.name", "status.x", "author.", "author..name", ".author"})
    @DisplayName("Should reject keys not covered by the allow-list or malformed")
    void shouldRejectKeys(String raw) {
        assertTrue(resolver.resolve(raw).isRejected());
    }

    @Test
    @DisplayName("Should reject a null key")
    void shouldRejectNullKey() {
        assertTrue(resolver.resolve(null).isRejected());
    }
}
