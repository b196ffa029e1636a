package com.aegis.security;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable role → (resource, action, scope) grant table.
 *
 * <p>Built once at startup and shared by all requests without synchronization. Lookups honour
 * the {@link Role} hierarchy and treat an ANY grant as also granting OWN. {@value #WILDCARD} may
 * stand for any resource type or any action.
 *
 * <p>Grants can be declared programmatically or parsed from {@code resource:action:scope}
 * strings, e.g. {@code user:read:own} or {@code *:*:any}.
 */
public final class RoleGrantTable implements GrantPolicy {

    public static final String WILDCARD = "*";

    /**
     * One row of the table.
     *
     * @param resourceType resource type or {@code *}
     * @param action       action or {@code *}
     * @param scope        {@link AuthPossession#ANY} or {@link AuthPossession#OWN}
     */
    public record Grant(String resourceType, String action, AuthPossession scope) {

        public Grant {
            if (resourceType == null || resourceType.isBlank()) {
                throw new IllegalArgumentException("grant resourceType must not be blank");
            }
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("grant action must not be blank");
            }
            if (scope == null || scope == AuthPossession.OWN_ANY) {
                throw new IllegalArgumentException("grant scope must be ANY or OWN");
            }
        }

        /**
         * Parses {@code resource:action:scope}.
         *
         * @throws IllegalArgumentException if the expression is malformed
         */
        public static Grant parse(String expression) {
            if (expression == null) {
                throw new IllegalArgumentException("grant expression must not be null");
            }
            String[] parts = expression.strip().split(":");
            if (parts.length != 3) {
                throw new IllegalArgumentException(
                        "grant must have the form resource:action:scope, got '%s'"
                                .formatted(expression));
            }
            AuthPossession scope = AuthPossession.fromString(parts[2])
                    .orElseThrow(() -> new IllegalArgumentException(
                            "unknown grant scope '%s' in '%s'".formatted(parts[2], expression)));
            return new Grant(parts[0], parts[1], scope);
        }

        boolean covers(String resourceType, String action, AuthPossession requested) {
            boolean resourceMatches =
                    WILDCARD.equals(this.resourceType) || this.resourceType.equals(resourceType);
            boolean actionMatches = WILDCARD.equals(this.action) || this.action.equals(action);
            boolean scopeMatches = scope == requested || scope == AuthPossession.ANY;
            return resourceMatches && actionMatches && scopeMatches;
        }
    }

    private final Map<Role, Set<Grant>> grants;

    private RoleGrantTable(Map<Role, Set<Grant>> grants) {
        this.grants = grants;
    }

    @Override
    public boolean grants(Role role, String resourceType, String action, AuthPossession scope) {
        if (role == null || scope == null || scope == AuthPossession.OWN_ANY) {
            return false;
        }
        for (Map.Entry<Role, Set<Grant>> entry : grants.entrySet()) {
            if (!role.implies(entry.getKey())) {
                continue;
            }
            for (Grant grant : entry.getValue()) {
                if (grant.covers(resourceType, action, scope)) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Grants declared directly on the role, without inherited ones. */
    public Set<Grant> grantsOf(Role role) {
        return grants.getOrDefault(role, Set.of());
    }

    /** Parses a table from {@code role -> [resource:action:scope, ...]}. */
    public static RoleGrantTable parse(Map<Role, ? extends Collection<String>> expressions) {
        Builder builder = builder();
        expressions.forEach((role, list) -> list.forEach(e -> builder.grant(role, Grant.parse(e))));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<Role, Set<Grant>> grants = new EnumMap<>(Role.class);

        private Builder() {}

        public Builder grant(Role role, Grant grant) {
            grants.computeIfAbsent(role, r -> new HashSet<>()).add(grant);
            return this;
        }

        public Builder grant(Role role, String resourceType, String action, AuthPossession scope) {
            return grant(role, new Grant(resourceType, action, scope));
        }

        public Builder grant(
                Role role, String resourceType, AuthActionVerb verb, AuthPossession scope) {
            return grant(role, resourceType, verb.value(), scope);
        }

        /** Grants every standard verb on the resource type. */
        public Builder grantCrud(Role role, String resourceType, AuthPossession scope) {
            for (AuthActionVerb verb : List.of(AuthActionVerb.values())) {
                grant(role, resourceType, verb, scope);
            }
            return this;
        }

        public RoleGrantTable build() {
            Map<Role, Set<Grant>> copy = new EnumMap<>(Role.class);
            grants.forEach((role, set) -> copy.put(role, Set.copyOf(set)));
            return new RoleGrantTable(Collections.unmodifiableMap(copy));
        }
    }
}
