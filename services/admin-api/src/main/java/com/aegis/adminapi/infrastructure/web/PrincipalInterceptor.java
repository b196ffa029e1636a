package com.aegis.adminapi.infrastructure.web;

import com.aegis.observability.CorrelationContextHolder;
import com.aegis.security.Principal;
import com.aegis.security.PrincipalCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Decodes the {@code X-Principal} header set by the gateway after token validation.
 *
 * <p>A missing header leaves the request anonymous; the route guard decides whether that is
 * acceptable. A malformed header fails the request with
 * {@link PrincipalCodec.PrincipalCodecException}.
 */
@Component
public class PrincipalInterceptor implements HandlerInterceptor {

    public static final String PRINCIPAL_HEADER = "X-Principal";

    @Override
    public boolean preHandle(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(PRINCIPAL_HEADER);
        if (header != null && !header.isBlank()) {
            Principal principal = PrincipalCodec.decode(header);
            request.setAttribute(RequestAttributes.PRINCIPAL, principal);
            CorrelationContextHolder.bindUser(principal.id());
        }
        return true;
    }
}
