package com.aegis.security;

/**
 * The static role-action policy the decision engine consults.
 *
 * <p>Implementations must be pure and safe for concurrent reads. {@code scope} is always
 * {@link AuthPossession#ANY} or {@link AuthPossession#OWN}.
 */
@FunctionalInterface
public interface GrantPolicy {

    boolean grants(Role role, String resourceType, String action, AuthPossession scope);
}
