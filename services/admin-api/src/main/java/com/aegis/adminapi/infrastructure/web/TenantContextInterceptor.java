package com.aegis.adminapi.infrastructure.web;

import com.aegis.security.Principal;
import com.aegis.security.TenantMismatchException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Stashes the request's tenant id for the route guard.
 *
 * <p>The principal's tenant is taken first, the {@code X-Tenant-Id} header second. A header that
 * names another tenant than the principal's is rejected outright. Nothing is stashed when neither
 * is present; no default tenant is ever substituted.
 *
 * <p>The stashed id is lower case, as stored in the {@code tenant_id} columns. A principal whose
 * tenant id arrived in another case is replaced by one carrying the normalized id.
 */
@Component
public class TenantContextInterceptor implements HandlerInterceptor {

    public static final String TENANT_HEADER = "X-Tenant-Id";

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
            Pattern.CASE_INSENSITIVE);

    /**
     * @throws InvalidTenantIdException if the tenant id is not a UUID
     * @throws TenantMismatchException  if the header contradicts the principal's tenant
     */
    @Override
    public boolean preHandle(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        Principal principal = (Principal) request.getAttribute(RequestAttributes.PRINCIPAL);
        String principalTenant = principal != null ? blankToNull(principal.tenantId()) : null;
        String headerTenant = blankToNull(request.getHeader(TENANT_HEADER));

        if (principalTenant != null && headerTenant != null
                && !principalTenant.equalsIgnoreCase(headerTenant)) {
            throw new TenantMismatchException(principalTenant, headerTenant);
        }
        String tenantId = principalTenant != null ? principalTenant : headerTenant;
        if (tenantId == null) {
            return true;
        }
        if (!UUID_PATTERN.matcher(tenantId).matches()) {
            throw new InvalidTenantIdException(tenantId);
        }
        String normalized = tenantId.toLowerCase(Locale.ROOT);
        if (principalTenant != null && !principalTenant.equals(normalized)) {
            request.setAttribute(RequestAttributes.PRINCIPAL,
                    new Principal(principal.id(), principal.role(), normalized));
        }
        request.setAttribute(RequestAttributes.TENANT_ID, normalized);
        return true;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
