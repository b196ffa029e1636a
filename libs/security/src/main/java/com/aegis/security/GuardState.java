package com.aegis.security;

/**
 * Stages a request passes through in {@link RouteGuard}.
 *
 * <pre>
 * START -&gt; TENANT_RESOLVED -&gt; RESOURCE_RESOLVED -&gt; DECIDED -&gt; {ALLOWED, DENIED}
 * </pre>
 *
 * Operations without descriptors go straight from TENANT_RESOLVED to ALLOWED.
 */
public enum GuardState {
    START,
    TENANT_RESOLVED,
    RESOURCE_RESOLVED,
    DECIDED,
    ALLOWED,
    DENIED;

    public boolean isTerminal() {
        return this == ALLOWED || this == DENIED;
    }
}
