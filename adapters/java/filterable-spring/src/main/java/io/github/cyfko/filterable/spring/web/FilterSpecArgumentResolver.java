package io.github.cyfko.filterable.spring.web;

import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.core.model.FilterSpec;
import io.github.cyfko.filterable.core.parsing.BracketParameterParser;
import io.github.cyfko.filterable.core.parsing.RequestNormalizer;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves controller parameters of type {@link FilterSpec} or {@link FilterRequest} from the
 * query string.
 * <p>
 * Parameters written in bracket notation ({@code filter[age][gte]=18},
 * {@code filter[status][in][]=active}) are expanded with {@link BracketParameterParser}. A
 * {@link FilterSpec} then reads the two filter mappings under the application-wide request keys,
 * while a {@link FilterRequest} keeps every expanded parameter so that an entity registered with
 * its own request keys can read them later.
 * </p>
 *
 * <pre>{@code
 * @GetMapping("/books")
 * List<Book> books(FilterSpec filters) {
 *     return filterableService.find(Book.class, filters);
 * }
 * }</pre>
 *
 * <p>
 * Resolution never fails on client input: a request without filters resolves to
 * {@link FilterSpec#empty()}, or to a {@link FilterRequest} holding no filter key.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterSpecArgumentResolver implements HandlerMethodArgumentResolver {

    private final FilterConfig config;

    public FilterSpecArgumentResolver(FilterConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        Class<?> type = parameter.getParameterType();
        return FilterSpec.class.equals(type) || FilterRequest.class.equals(type);
    }

    @Override
    public Object resolveArgument(MethodParameter parameter,
                                      ModelAndViewContainer mavContainer,
                                      NativeWebRequest webRequest,
                                      WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        Map<String, String[]> parameters = request != null ? request.getParameterMap() : webRequest.getParameterMap();
        Map<String, Object> expanded = BracketParameterParser.parse(parameters);

        if (FilterRequest.class.equals(parameter.getParameterType())) {
            return new FilterRequest(expanded);
        }
        return RequestNormalizer.normalize(expanded, config);
    }
}
