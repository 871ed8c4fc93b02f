package com.libris.catalog.config;

import com.libris.catalog.infrastructure.web.AuthenticatedUserArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for {@code /api/**} and the {@code @CurrentUser} resolver.
 *
 * <p>Allowed origins come from {@code libris.service.cors-allowed-origins}; none means CORS is off.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CatalogProperties properties;
    private final AuthenticatedUserArgumentResolver currentUserResolver;

    public WebConfig(CatalogProperties properties, AuthenticatedUserArgumentResolver currentUserResolver) {
        this.properties = properties;
        this.currentUserResolver = currentUserResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (properties.corsAllowedOrigins().isEmpty()) {
            return;
        }
        registry.addMapping("/api/**")
                .allowedOrigins(properties.corsAllowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID", "WWW-Authenticate")
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(currentUserResolver);
    }
}
