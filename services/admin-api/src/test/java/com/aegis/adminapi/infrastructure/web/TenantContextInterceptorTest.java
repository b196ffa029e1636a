package com.aegis.adminapi.infrastructure.web;

import static com.aegis.security.testing.TestRequestContextFactory.TENANT_A;
import static com.aegis.security.testing.TestRequestContextFactory.TENANT_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.security.Principal;
import com.aegis.security.Role;
import com.aegis.security.TenantMismatchException;
import java.util.Locale;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@DisplayName("TenantContextInterceptor")
class TenantContextInterceptorTest {

    private final TenantContextInterceptor interceptor = new TenantContextInterceptor();
    private final MockHttpServletRequest request = new MockHttpServletRequest();

    private Object stashedTenant() {
        interceptor.preHandle(request, new MockHttpServletResponse(), new Object());
        return request.getAttribute(RequestAttributes.TENANT_ID);
    }

    @Test
    @DisplayName("takes the principal's tenant")
    void principalTenant() {
        request.setAttribute(RequestAttributes.PRINCIPAL, new Principal("u", Role.USER, TENANT_A));

        assertThat(stashedTenant()).isEqualTo(TENANT_A);
    }

    @Test
    @DisplayName("falls back to the X-Tenant-Id header")
    void headerTenant() {
        String tenantId = UUID.randomUUID().toString();
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, " " + tenantId + " ");

        assertThat(stashedTenant()).isEqualTo(tenantId);
    }

    @Test
    @DisplayName("a principal without a tenant uses the header")
    void tenantlessPrincipal() {
        request.setAttribute(RequestAttributes.PRINCIPAL, new Principal("u", Role.ROOT, null));
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, TENANT_B);

        assertThat(stashedTenant()).isEqualTo(TENANT_B);
    }

    @Test
    @DisplayName("stashes nothing when no tenant is present")
    void noTenant() {
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, "   ");

        assertThat(stashedTenant()).isNull();
    }

    @Test
    @DisplayName("rejects a header contradicting the principal's tenant")
    void rejectsConflict() {
        request.setAttribute(RequestAttributes.PRINCIPAL, new Principal("u", Role.USER, TENANT_A));
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, TENANT_B);

        assertThatThrownBy(this::stashedTenant).isInstanceOf(TenantMismatchException.class);
    }

    @Test
    @DisplayName("accepts a header repeating the principal's tenant in another case")
    void acceptsSameTenantOtherCase() {
        String tenantId = UUID.randomUUID().toString();
        request.setAttribute(RequestAttributes.PRINCIPAL, new Principal("u", Role.USER, tenantId));
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, tenantId.toUpperCase());

        assertThat(stashedTenant()).isEqualTo(tenantId);
    }

    @Test
    @DisplayName("lower-cases a header tenant id")
    void normalizesHeaderCase() {
        String tenantId = UUID.randomUUID().toString();
        request.addHeader(TenantContextInterceptor.TENANT_HEADER,
                tenantId.toUpperCase(Locale.ROOT));

        assertThat(stashedTenant()).isEqualTo(tenantId);
    }

    @Test
    @DisplayName("lower-cases the principal's tenant id and the principal with it")
    void normalizesPrincipalCase() {
        String tenantId = UUID.randomUUID().toString();
        request.setAttribute(RequestAttributes.PRINCIPAL,
                new Principal("u", Role.ADMIN, tenantId.toUpperCase(Locale.ROOT)));

        assertThat(stashedTenant()).isEqualTo(tenantId);
        assertThat(request.getAttribute(RequestAttributes.PRINCIPAL))
                .isEqualTo(new Principal("u", Role.ADMIN, tenantId));
    }

    @Test
    @DisplayName("rejects a tenant id that is not a UUID")
    void rejectsMalformed() {
        request.addHeader(TenantContextInterceptor.TENANT_HEADER, "tenant-a");

        assertThatThrownBy(this::stashedTenant)
                .isInstanceOf(InvalidTenantIdException.class)
                .hasMessageContaining("tenant-a");
    }
}
