package com.aegis.adminapi.config;

import static com.aegis.security.testing.TestRequestContextFactory.TENANT_A;
import static org.assertj.core.api.Assertions.assertThat;

import com.aegis.security.AuthPossession;
import com.aegis.security.AuthResource;
import com.aegis.security.BatchApproval;
import com.aegis.security.OperationPolicy;
import com.aegis.security.OperationRegistry;
import com.aegis.security.PermissionDescriptor;
import com.aegis.security.Principal;
import com.aegis.security.RequestContext;
import com.aegis.security.ResourceRef;
import com.aegis.security.Role;
import com.aegis.security.testing.TestRequestContextFactory;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AdminApiOperations")
class AdminApiOperationsTest {

    private final OperationRegistry registry = AdminApiOperations.registry();

    private PermissionDescriptor onlyDescriptor(String operationId) {
        OperationPolicy policy = registry.find(operationId).orElseThrow();
        assertThat(policy.permissions()).hasSize(1);
        return policy.permissions().get(0);
    }

    @Nested
    @DisplayName("registry")
    class Registry {

        @Test
        @DisplayName("tenant operations are tenant-exempt, user operations are not")
        void tenantExemption() {
            assertThat(registry.lookup(AdminApiOperations.LIST_TENANTS).tenantExempt()).isTrue();
            assertThat(registry.lookup(AdminApiOperations.DELETE_TENANT).tenantExempt()).isTrue();
            assertThat(registry.lookup(AdminApiOperations.LIST_USERS).tenantExempt()).isFalse();
            assertThat(registry.lookup(AdminApiOperations.DEACTIVATE_USERS).tenantExempt())
                    .isFalse();
        }

        @Test
        @DisplayName("role and permission reads are tenant-exempt")
        void introspectionExemption() {
            assertThat(registry.lookup(AdminApiOperations.LIST_ROLES).tenantExempt()).isTrue();
            assertThat(registry.lookup(AdminApiOperations.GET_ROLE_PERMISSIONS).tenantExempt())
                    .isTrue();
            assertThat(registry.lookup(AdminApiOperations.LIST_PERMISSIONS).tenantExempt())
                    .isTrue();
            assertThat(onlyDescriptor(AdminApiOperations.LIST_PERMISSIONS).resource().elements())
                    .containsExactly(AuthResource.of("permission"));
        }

        @Test
        @DisplayName("listing, deleting and batch deactivation are reserved to administrators")
        void requiredRoles() {
            assertThat(registry.lookup(AdminApiOperations.LIST_USERS).requiredRoles())
                    .containsExactly(Role.ADMIN);
            assertThat(registry.lookup(AdminApiOperations.DELETE_USER).requiredRoles())
                    .containsExactly(Role.ADMIN);
            assertThat(registry.lookup(AdminApiOperations.DEACTIVATE_USERS).requiredRoles())
                    .containsExactly(Role.ADMIN);
            assertThat(registry.lookup(AdminApiOperations.GET_USER).requiredRoles()).isEmpty();
            assertThat(registry.lookup(AdminApiOperations.GET_PROFILE).requiredRoles()).isEmpty();
        }

        @Test
        @DisplayName("every registered operation requires a principal")
        void allProtected() {
            assertThat(registry.operationIds())
                    .allSatisfy(id -> assertThat(registry.lookup(id).requiresPrincipal()).isTrue());
        }

        @Test
        @DisplayName("user reads and updates accept own or any")
        void ownOrAny() {
            assertThat(onlyDescriptor(AdminApiOperations.GET_USER).possession())
                    .isEqualTo(AuthPossession.OWN_ANY);
            assertThat(onlyDescriptor(AdminApiOperations.UPDATE_USER).possession())
                    .isEqualTo(AuthPossession.OWN_ANY);
            assertThat(onlyDescriptor(AdminApiOperations.GET_PROFILE).possession())
                    .isEqualTo(AuthPossession.OWN);
            assertThat(onlyDescriptor(AdminApiOperations.UPDATE_PROFILE).possession())
                    .isEqualTo(AuthPossession.OWN);
        }

        @Test
        @DisplayName("batch deactivate requires every element")
        void batchApproval() {
            assertThat(onlyDescriptor(AdminApiOperations.DEACTIVATE_USERS).batchApproval())
                    .isEqualTo(BatchApproval.ALL);
        }
    }

    @Nested
    @DisplayName("extractors and predicates")
    class Callbacks {

        @Test
        @DisplayName("the path user is owned by the principal with the same id")
        void pathOwnership() {
            Principal principal = TestRequestContextFactory.principal("u-1", Role.USER, TENANT_A);

            assertThat(AdminApiOperations.principalIsPathUser().isOwn(
                    TestRequestContextFactory.contextFor(principal, Map.of("id", "u-1"))))
                    .isTrue();
            assertThat(AdminApiOperations.principalIsPathUser().isOwn(
                    TestRequestContextFactory.contextFor(principal, Map.of("id", "u-2"))))
                    .isFalse();
            assertThat(AdminApiOperations.principalIsPathUser().isOwn(
                    TestRequestContextFactory.anonymous(TENANT_A)))
                    .isFalse();
        }

        @Test
        @DisplayName("extracts the path user")
        void pathUser() {
            RequestContext ctx = RequestContext.builder().parameter("id", "u-9").build();

            ResourceRef ref = AdminApiOperations.userFromPath().extract(ctx, null);

            assertThat(ref.isBatch()).isFalse();
            assertThat(ref.elements()).containsExactly(AuthResource.of("user", "u-9"));
        }

        @Test
        @DisplayName("extracts one user per listed id")
        void batchUsers() {
            RequestContext ctx = RequestContext.builder().parameter("ids", "a, b,,a").build();

            ResourceRef ref = AdminApiOperations.usersFromIds().extract(ctx, null);

            assertThat(ref.isBatch()).isTrue();
            assertThat(ref.elements())
                    .containsExactly(AuthResource.of("user", "a"), AuthResource.of("user", "b"));
        }

        @Test
        @DisplayName("falls back to the user type without ids")
        void batchWithoutIds() {
            ResourceRef ref = AdminApiOperations.usersFromIds()
                    .extract(RequestContext.builder().build(), null);

            assertThat(ref.isBatch()).isFalse();
            assertThat(ref.elements()).containsExactly(AuthResource.of("user"));
        }
    }

    @Test
    @DisplayName("parseIds strips blanks and duplicates and keeps order")
    void parseIds() {
        assertThat(AdminApiOperations.parseIds(" b ,a,, b")).containsExactly("b", "a");
        assertThat(AdminApiOperations.parseIds("")).isEmpty();
    }
}
