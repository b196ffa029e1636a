package com.aegis.adminapi.infrastructure.web;

/**
 * Servlet request attribute names shared by the interceptors and the argument resolver.
 */
public final class RequestAttributes {

    /** Decoded {@link com.aegis.security.Principal}. */
    public static final String PRINCIPAL = "aegis.principal";

    /** Raw tenant id stashed for the route guard. */
    public static final String TENANT_ID = "aegis.tenantId";

    /** {@link com.aegis.security.GuardResult} of the current request. */
    public static final String GUARD_RESULT = "aegis.guardResult";

    private RequestAttributes() {
        // utility class
    }
}
