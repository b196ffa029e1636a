package com.aegis.adminapi.config;

import com.aegis.security.Role;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Role grant table bound from {@code aegis.authz.grants}, one {@code resource:action:scope}
 * expression per entry.
 *
 * <pre>
 * aegis:
 *   authz:
 *     grants:
 *       USER: [user:read:own, user:update:own]
 *       ADMIN: [user:*:any, tenant:read:any]
 * </pre>
 */
@ConfigurationProperties(prefix = "aegis.authz")
@Validated
public record AuthzProperties(@NotEmpty Map<Role, List<String>> grants) {}
