package io.github.cyfko.filterable.core.parsing;

import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.model.FilterSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RequestNormalizer Tests")
class RequestNormalizerTest {

    @Test
    @DisplayName("Should read both mappings and ignore other parameters")
    void shouldReadBothMappings() {
        Map<String, Object> request = Map.of(
                "filter", Map.of("age", "18"),
                "filter_any", Map.of("name", "jo"),
                "sort", "age");

        FilterSpec spec = RequestNormalizer.normalize(request, FilterConfig.defaults());

        assertEquals(Map.of("age", "18"), spec.all());
        assertEquals(Map.of("name", "jo"), spec.any());
    }

    @Test
    @DisplayName("Should yield empty mappings for missing or scalar entries")
    void shouldYieldEmptyMappings() {
        FilterSpec spec = RequestNormalizer.normalize(Map.of("filter", "status"), FilterConfig.defaults());

        assertTrue(spec.isEmpty());
        assertTrue(RequestNormalizer.normalize(null, FilterConfig.defaults()).isEmpty());
        assertTrue(RequestNormalizer.normalize(Map.of(), FilterConfig.defaults()).isEmpty());
    }

    @Test
    @DisplayName("Should stringify non-string filter keys")
    void shouldStringifyKeys() {
        Map<Object, Object> filters = new HashMap<>();
        filters.put(0, "x");

        FilterSpec spec = RequestNormalizer.normalize(Map.of("filter", filters), FilterConfig.defaults());

        assertEquals(Map.of("0", "x"), spec.all());
    }

    @Test
    @DisplayName("Should honour configured request keys")
    void shouldHonourConfiguredKeys() {
        FilterConfig config = FilterConfig.builder().requestKey("where").build();

        FilterSpec spec = RequestNormalizer.normalize(
                Map.of("filter", Map.of("a", "1"), "where", Map.of("b", "2")), config);

        assertEquals(Map.of("b", "2"), spec.all());
    }
}
