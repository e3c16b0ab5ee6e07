package io.github.cyfko.filterable.spring.autoconfigure;

import io.github.cyfko.filterable.core.config.FilterConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalized settings of the filter layer.
 *
 * <pre>
 * filterable.request-key=filter
 * filterable.any-request-key=filter_any
 * </pre>
 */
@ConfigurationProperties(prefix = "filterable")
public class FilterableProperties {

    /**
     * Request parameter holding the filters combined with AND.
     */
    private String requestKey = FilterConfig.DEFAULT_REQUEST_KEY;

    /**
     * Request parameter holding the filters combined with OR.
     */
    private String anyRequestKey = FilterConfig.DEFAULT_ANY_REQUEST_KEY;

    public String getRequestKey() {
        return requestKey;
    }

    public void setRequestKey(String requestKey) {
        this.requestKey = requestKey;
    }

    public String getAnyRequestKey() {
        return anyRequestKey;
    }

    public void setAnyRequestKey(String anyRequestKey) {
        this.anyRequestKey = anyRequestKey;
    }

    /**
     * @return the validated configuration
     * @throws io.github.cyfko.filterable.core.exception.FilterDefinitionException if a key is blank or both keys are equal
     */
    public FilterConfig toFilterConfig() {
        return FilterConfig.builder()
                .requestKey(requestKey)
                .anyRequestKey(anyRequestKey)
                .build();
    }
}
