package com.aegis.adminapi.infrastructure.web;

import com.aegis.security.AuthorizationEvaluationException;
import com.aegis.security.GuardResult;
import com.aegis.security.InvalidPermissionConfigurationException;
import com.aegis.security.Principal;
import com.aegis.security.RequestContext;
import com.aegis.security.RouteGuard;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Runs the {@link RouteGuard} for every matched controller method.
 *
 * <p>The operation id is the HTTP method plus the matched path pattern, e.g. {@code
 * GET /api/v1/users/{id}}. The guard sees the principal and tenant stashed by the earlier
 * interceptors plus the path variables and query parameters; path variables win over query
 * parameters of the same name.
 */
@Component
public class AuthorizationInterceptor implements HandlerInterceptor {

    private final RouteGuard routeGuard;
    private final AuthorizationMetrics metrics;

    public AuthorizationInterceptor(RouteGuard routeGuard, AuthorizationMetrics metrics) {
        this.routeGuard = routeGuard;
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(
            HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        String operationId = operationId(request);
        RequestContext context = requestContext(request);
        GuardResult result;
        try {
            result = metrics.duration().record(() -> routeGuard.authorize(operationId, context));
        } catch (InvalidPermissionConfigurationException | AuthorizationEvaluationException e) {
            metrics.error();
            throw e;
        } catch (RuntimeException e) {
            metrics.denied();
            throw e;
        }
        metrics.allowed();
        request.setAttribute(RequestAttributes.GUARD_RESULT, result);
        return true;
    }

    static String operationId(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        String path = pattern != null ? pattern.toString() : request.getRequestURI();
        return request.getMethod() + " " + path;
    }

    @SuppressWarnings("unchecked")
    static RequestContext requestContext(HttpServletRequest request) {
        RequestContext.Builder builder = RequestContext.builder()
                .principal((Principal) request.getAttribute(RequestAttributes.PRINCIPAL))
                .tenantId((String) request.getAttribute(RequestAttributes.TENANT_ID));
        request.getParameterMap().forEach((name, values) ->
                builder.parameter(name, String.join(",", values)));
        Object pathVariables =
                request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (pathVariables instanceof Map<?, ?> variables) {
            builder.parameters((Map<String, String>) variables);
        }
        return builder.build();
    }
}
