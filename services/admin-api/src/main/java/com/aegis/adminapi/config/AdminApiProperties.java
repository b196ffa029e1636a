package com.aegis.adminapi.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service settings bound from {@code aegis.service.*}.
 *
 * <pre>
 * aegis:
 *   service:
 *     name: admin-api
 *     environment: production
 *     allowed-origins: [https://admin.example.com]
 * </pre>
 *
 * @param name           service name used in logs and metric tags, required
 * @param environment    deployment environment, defaults to {@code development}
 * @param allowedOrigins CORS origins for {@code /api/**}, defaults to the local dev servers
 */
@ConfigurationProperties(prefix = "aegis.service")
@Validated
public record AdminApiProperties(
        @NotBlank String name, String environment, List<String> allowedOrigins) {

    public AdminApiProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (allowedOrigins == null || allowedOrigins.isEmpty()) {
            allowedOrigins = List.of("http://localhost:3000", "http://localhost:5173");
        }
    }
}
