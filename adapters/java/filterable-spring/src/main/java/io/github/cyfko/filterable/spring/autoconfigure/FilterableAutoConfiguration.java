package io.github.cyfko.filterable.spring.autoconfigure;

import io.github.cyfko.filterable.core.config.FilterConfig;
import io.github.cyfko.filterable.jpa.JpaFilterable;
import io.github.cyfko.filterable.spring.service.FilterableService;
import io.github.cyfko.filterable.spring.support.FilterableRegistry;
import io.github.cyfko.filterable.spring.web.FilterSpecArgumentResolver;
import jakarta.persistence.EntityManagerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.orm.jpa.SharedEntityManagerCreator;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration of the filter layer.
 * <p>
 * Registers the {@link FilterConfig} bound from {@link FilterableProperties}, the
 * {@link FilterableRegistry} of all {@link JpaFilterable} beans, the {@link FilterableService}
 * when JPA is configured, and the {@link FilterSpecArgumentResolver} in servlet web applications.
 * Every bean backs off when the application declares its own.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration")
@ConditionalOnClass(JpaFilterable.class)
@EnableConfigurationProperties(FilterableProperties.class)
public class FilterableAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FilterConfig filterConfig(FilterableProperties properties) {
        return properties.toFilterConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterableRegistry filterableRegistry(ObjectProvider<JpaFilterable<?>> filterables) {
        return new FilterableRegistry(filterables.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EntityManagerFactory.class)
    public FilterableService filterableService(FilterableRegistry registry, EntityManagerFactory entityManagerFactory) {
        return new FilterableService(registry, SharedEntityManagerCreator.createSharedEntityManager(entityManagerFactory));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(WebMvcConfigurer.class)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public FilterSpecArgumentResolver filterSpecArgumentResolver(FilterConfig filterConfig) {
            return new FilterSpecArgumentResolver(filterConfig);
        }

        @Bean
        public WebMvcConfigurer filterSpecWebMvcConfigurer(FilterSpecArgumentResolver resolver) {
            return new WebMvcConfigurer() {
                @Override
                public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
                    resolvers.add(resolver);
                }
            };
        }
    }
}
