package com.aegis.adminapi;

import com.aegis.adminapi.config.AdminApiProperties;
import com.aegis.adminapi.config.AuthzProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Aegis admin API: tenant and user administration on top of the authorization core.
 *
 * <p>Request pipeline:
 *
 * <ol>
 *   <li>{@code CorrelationIdFilter} sets correlation and request ids in the MDC
 *   <li>{@code PrincipalInterceptor} decodes the gateway's {@code X-Principal} header
 *   <li>{@code TenantContextInterceptor} stashes the tenant id
 *   <li>{@code AuthorizationInterceptor} runs the route guard for the matched operation
 * </ol>
 */
@SpringBootApplication
@EnableConfigurationProperties({AdminApiProperties.class, AuthzProperties.class})
public class AdminApiApplication {

    private static final Logger log = LoggerFactory.getLogger(AdminApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AdminApiApplication.class, args);
        log.info("Aegis admin API started");
    }
}
