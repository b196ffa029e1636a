package com.aegis.adminapi.infrastructure.web;

import com.aegis.security.GuardResult;
import com.aegis.security.Principal;
import com.aegis.security.TenantContext;
import com.aegis.security.TenantContextMissingException;
import com.aegis.security.UnauthenticatedException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the guarded request's {@link TenantContext} and {@link Principal} into controller
 * methods, so handlers receive the tenant as an explicit argument.
 */
public class GuardedRequestArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        Class<?> type = parameter.getParameterType();
        return type == TenantContext.class || type == Principal.class;
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String operationId = AuthorizationInterceptor.operationId(request);
        if (parameter.getParameterType() == Principal.class) {
            Object principal = request.getAttribute(RequestAttributes.PRINCIPAL);
            if (principal == null) {
                throw new UnauthenticatedException(operationId);
            }
            return principal;
        }
        GuardResult result = (GuardResult) request.getAttribute(RequestAttributes.GUARD_RESULT);
        if (result == null || result.tenant() == null) {
            throw new TenantContextMissingException(operationId);
        }
        return result.tenant();
    }
}
