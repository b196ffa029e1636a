package com.aegis.adminapi.config;

import com.aegis.adminapi.infrastructure.web.AuthorizationInterceptor;
import com.aegis.adminapi.infrastructure.web.GuardedRequestArgumentResolver;
import com.aegis.adminapi.infrastructure.web.PrincipalInterceptor;
import com.aegis.adminapi.infrastructure.web.TenantContextInterceptor;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS and the request pipeline of {@code /api/**}.
 *
 * <p>Interceptors run in registration order: principal, then tenant, then the route guard.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private static final String API = "/api/**";

    private final AdminApiProperties properties;
    private final PrincipalInterceptor principalInterceptor;
    private final TenantContextInterceptor tenantContextInterceptor;
    private final AuthorizationInterceptor authorizationInterceptor;

    public WebConfig(
            AdminApiProperties properties,
            PrincipalInterceptor principalInterceptor,
            TenantContextInterceptor tenantContextInterceptor,
            AuthorizationInterceptor authorizationInterceptor) {
        this.properties = properties;
        this.principalInterceptor = principalInterceptor;
        this.tenantContextInterceptor = tenantContextInterceptor;
        this.authorizationInterceptor = authorizationInterceptor;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API)
                .allowedOrigins(properties.allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .exposedHeaders("X-Correlation-ID", "X-Request-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(principalInterceptor).addPathPatterns(API);
        registry.addInterceptor(tenantContextInterceptor).addPathPatterns(API);
        registry.addInterceptor(authorizationInterceptor).addPathPatterns(API);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(new GuardedRequestArgumentResolver());
    }
}
