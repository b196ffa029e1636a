package com.aegis.adminapi.config;

import com.aegis.security.AuthorizationDecisionEngine;
import com.aegis.security.OperationRegistry;
import com.aegis.security.ResourceResolver;
import com.aegis.security.RoleGrantTable;
import com.aegis.security.RouteGuard;
import com.aegis.security.TenantDirectory;
import com.aegis.security.TenantResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the authorization core. The grant table and the operation registry are built once here;
 * a malformed grant or descriptor fails application startup.
 */
@Configuration
public class AuthorizationConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationConfig.class);

    @Bean
    public RoleGrantTable roleGrantTable(AuthzProperties properties) {
        RoleGrantTable table = RoleGrantTable.parse(properties.grants());
        properties.grants().forEach((role, grants) ->
                log.info("Grants for {}: {}", role.value(), grants));
        return table;
    }

    @Bean
    public OperationRegistry operationRegistry() {
        return AdminApiOperations.registry();
    }

    @Bean
    public RouteGuard routeGuard(
            RoleGrantTable grants, OperationRegistry registry, TenantDirectory tenantDirectory) {
        return new RouteGuard(
                registry,
                new TenantResolver(),
                tenantDirectory,
                new ResourceResolver(),
                new AuthorizationDecisionEngine(grants));
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
