package com.aegis.security;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Execution context of a single inbound request, as seen by the authorization core.
 *
 * <p>Built by the embedding framework (HTTP interceptor, gRPC interceptor, test) and threaded
 * explicitly through {@link RouteGuard}, {@link ResourceExtractor} and {@link OwnershipPredicate}.
 * Exposes:
 *
 * <ul>
 *   <li>the authenticated principal, if any
 *   <li>attributes stashed by upstream middleware, e.g. the tenant id under {@link
 *       TenantResolver#TENANT_CONTEXT_KEY}
 *   <li>request parameters (path variables, query parameters) that extraction and ownership
 *       functions need
 * </ul>
 *
 * @param principal  authenticated principal, or {@code null} for anonymous requests
 * @param attributes middleware attributes (immutable copy)
 * @param parameters request parameters (immutable copy)
 */
public record RequestContext(
        Principal principal, Map<String, Object> attributes, Map<String, String> parameters) {

    public RequestContext {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    /** Returns the principal, or empty for anonymous requests. */
    public Optional<Principal> findPrincipal() {
        return Optional.ofNullable(principal);
    }

    /** Returns a middleware attribute by key. */
    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    /** Returns a request parameter by name. */
    public Optional<String> parameter(String name) {
        return Optional.ofNullable(parameters.get(name));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Mutable builder; the built context is immutable. */
    public static final class Builder {

        private Principal principal;
        private final Map<String, Object> attributes = new HashMap<>();
        private final Map<String, String> parameters = new HashMap<>();

        private Builder() {}

        public Builder principal(Principal principal) {
            this.principal = principal;
            return this;
        }

        public Builder attribute(String key, Object value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public Builder tenantId(String tenantId) {
            return attribute(TenantResolver.TENANT_CONTEXT_KEY, tenantId);
        }

        public Builder parameter(String name, String value) {
            if (value != null) {
                parameters.put(name, value);
            }
            return this;
        }

        public Builder parameters(Map<String, String> values) {
            values.forEach(this::parameter);
            return this;
        }

        public RequestContext build() {
            return new RequestContext(principal, attributes, parameters);
        }
    }
}
