package com.aegis.adminapi.domain;

import static com.aegis.security.testing.TestRequestContextFactory.TENANT_A;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.aegis.adminapi.infrastructure.persistence.JdbcTenantRepository;
import com.aegis.adminapi.infrastructure.persistence.JdbcUserRepository;
import com.aegis.security.PermissionDeniedException;
import com.aegis.security.Principal;
import com.aegis.security.ResourceNotFoundException;
import com.aegis.security.Role;
import com.aegis.security.TenantContext;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
@DisplayName("UserService")
class UserServiceTest {

    private static final TenantContext TENANT = TenantContext.of(TENANT_A);
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Mock private JdbcUserRepository users;
    @Mock private JdbcTenantRepository tenants;
    @Mock private PasswordEncoder passwordEncoder;

    private UserService service;
    private final Principal admin = new Principal("admin-1", Role.ADMIN, TENANT_A);

    @BeforeEach
    void setUp() {
        lenient().when(users.resourceType()).thenReturn("user");
        service = new UserService(users, tenants, passwordEncoder);
    }

    private static User stored(String id) {
        return stored(id, Role.USER);
    }

    private static User stored(String id, Role role) {
        return new User(id, TENANT_A, id + "@example.com", "hash", "Stored", role, true,
                NOW, NOW);
    }

    private void updatesEcho() {
        when(users.update(eq(TENANT_A), any(User.class)))
                .thenAnswer(inv -> Optional.of(inv.getArgument(1)));
    }

    private void tenantIs(boolean active) {
        when(tenants.findById(TENANT_A))
                .thenReturn(Optional.of(new Tenant(TENANT_A, "Acme", null, active, NOW, NOW)));
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("hashes the password, lowercases the email and stamps the tenant")
        void createsUser() {
            tenantIs(true);
            when(users.findByEmail(TENANT_A, "jane@example.com")).thenReturn(Optional.empty());
            when(passwordEncoder.encode("secret-pass")).thenReturn("bcrypt-hash");
            when(users.insert(any(User.class))).thenAnswer(inv -> inv.getArgument(0));

            User created = service.create(
                    TENANT, admin, " Jane@Example.com ", "secret-pass", "Jane", null);

            ArgumentCaptor<User> inserted = ArgumentCaptor.forClass(User.class);
            verify(users).insert(inserted.capture());
            assertThat(inserted.getValue().tenantId()).isEqualTo(TENANT_A);
            assertThat(inserted.getValue().passwordHash()).isEqualTo("bcrypt-hash");
            assertThat(created.email()).isEqualTo("jane@example.com");
            assertThat(created.role()).isEqualTo(Role.USER);
            assertThat(created.active()).isTrue();
        }

        @Test
        @DisplayName("fails with 404 semantics for an unknown tenant")
        void unknownTenant() {
            when(tenants.findById(TENANT_A)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.create(TENANT, admin, "a@b.c", "pw", "A", Role.USER))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("refuses an inactive tenant")
        void inactiveTenant() {
            tenantIs(false);

            assertThatThrownBy(() -> service.create(TENANT, admin, "a@b.c", "pw", "A", Role.USER))
                    .isInstanceOf(InactiveTenantException.class);
            verify(users, never()).insert(any());
        }

        @Test
        @DisplayName("refuses a taken email")
        void duplicateEmail() {
            tenantIs(true);
            when(users.findByEmail(TENANT_A, "a@b.c")).thenReturn(Optional.of(stored("a")));

            assertThatThrownBy(() -> service.create(TENANT, admin, "A@B.C", "pw", "A", Role.USER))
                    .isInstanceOf(DuplicateResourceException.class)
                    .hasMessageContaining("email");
        }

        @Test
        @DisplayName("refuses a role above the creator's")
        void roleEscalation() {
            tenantIs(true);

            assertThatThrownBy(() -> service.create(TENANT, admin, "a@b.c", "pw", "A", Role.ROOT))
                    .isInstanceOf(PermissionDeniedException.class);
            verify(users, never()).findByEmail(anyString(), anyString());
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        @DisplayName("a USER may rename itself")
        void userRenamesSelf() {
            Principal self = new Principal("u-1", Role.USER, TENANT_A);
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            when(users.update(eq(TENANT_A), any(User.class)))
                    .thenAnswer(inv -> Optional.of(inv.getArgument(1)));

            User updated = service.update(TENANT, self, "u-1", " New Name ", null, null);

            assertThat(updated.fullName()).isEqualTo("New Name");
            assertThat(updated.role()).isEqualTo(Role.USER);
        }

        @Test
        @DisplayName("a USER may not change role or status")
        void userCannotChangeRole() {
            Principal self = new Principal("u-1", Role.USER, TENANT_A);

            assertThatThrownBy(() -> service.update(TENANT, self, "u-1", null, Role.ADMIN, null))
                    .isInstanceOf(PermissionDeniedException.class);
            assertThatThrownBy(() -> service.update(TENANT, self, "u-1", null, null, false))
                    .isInstanceOf(PermissionDeniedException.class);
            verify(users, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("an ADMIN changes role and status")
        void adminChangesRole() {
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            when(users.update(eq(TENANT_A), any(User.class)))
                    .thenAnswer(inv -> Optional.of(inv.getArgument(1)));

            User updated = service.update(TENANT, admin, "u-1", null, Role.ADMIN, false);

            assertThat(updated.role()).isEqualTo(Role.ADMIN);
            assertThat(updated.active()).isFalse();
        }

        @Test
        @DisplayName("an ADMIN may not demote or deactivate a ROOT user")
        void adminCannotManageRoot() {
            when(users.findById(TENANT_A, "root-1"))
                    .thenReturn(Optional.of(stored("root-1", Role.ROOT)));

            assertThatThrownBy(() ->
                    service.update(TENANT, admin, "root-1", null, Role.USER, false))
                    .isInstanceOf(PermissionDeniedException.class)
                    .hasMessageContaining("cannot manage a ROOT user");
            verify(users, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("an ADMIN may still rename a ROOT user")
        void adminRenamesRoot() {
            when(users.findById(TENANT_A, "root-1"))
                    .thenReturn(Optional.of(stored("root-1", Role.ROOT)));
            updatesEcho();

            User updated = service.update(TENANT, admin, "root-1", "Renamed", null, null);

            assertThat(updated.fullName()).isEqualTo("Renamed");
            assertThat(updated.role()).isEqualTo(Role.ROOT);
        }

        @Test
        @DisplayName("a ROOT principal manages another ROOT user")
        void rootManagesRoot() {
            Principal root = new Principal("root-0", Role.ROOT, TENANT_A);
            when(users.findById(TENANT_A, "root-1"))
                    .thenReturn(Optional.of(stored("root-1", Role.ROOT)));
            updatesEcho();

            User updated = service.update(TENANT, root, "root-1", null, Role.ADMIN, null);

            assertThat(updated.role()).isEqualTo(Role.ADMIN);
        }
    }

    @Nested
    @DisplayName("updateProfile")
    class UpdateProfile {

        @Test
        @DisplayName("renames the principal's own record and keeps role and status")
        void renamesSelf() {
            Principal self = new Principal("u-1", Role.USER, TENANT_A);
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            updatesEcho();

            User updated = service.updateProfile(TENANT, self, "  Jane Doe ");

            assertThat(updated.id()).isEqualTo("u-1");
            assertThat(updated.fullName()).isEqualTo("Jane Doe");
            assertThat(updated.role()).isEqualTo(Role.USER);
            assertThat(updated.active()).isTrue();
        }

        @Test
        @DisplayName("fails when the principal's record is not in the tenant")
        void unknownSelf() {
            Principal stranger = new Principal("ghost", Role.USER, TENANT_A);
            when(users.findById(TENANT_A, "ghost")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.updateProfile(TENANT, stranger, "Name"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("list")
    class ListUsers {

        @Test
        @DisplayName("passes the filter and the page window to the repository")
        void filtered() {
            UserFilter filter = UserFilter.of(false, "jane");
            when(users.findMatching(TENANT_A, filter, 20, 10)).thenReturn(List.of(stored("u-1")));
            when(users.countMatching(TENANT_A, filter)).thenReturn(21L);

            Page<User> page = service.list(TENANT, filter, PageRequest.of(3, 10));

            assertThat(page.data()).extracting(User::id).containsExactly("u-1");
            assertThat(page.meta().total()).isEqualTo(21L);
        }
    }

    @Nested
    @DisplayName("deactivation")
    class Deactivation {

        @Test
        @DisplayName("delete clears the active flag instead of removing the row")
        void softDelete() {
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            when(users.update(eq(TENANT_A), any(User.class)))
                    .thenAnswer(inv -> Optional.of(inv.getArgument(1)));

            service.delete(TENANT, admin, "u-1");

            ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
            verify(users).update(eq(TENANT_A), saved.capture());
            assertThat(saved.getValue().active()).isFalse();
            verify(users, never()).delete(anyString(), anyString());
        }

        @Test
        @DisplayName("batch stops at the first unknown id")
        void batchStopsOnUnknown() {
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            when(users.findById(TENANT_A, "ghost")).thenReturn(Optional.empty());
            when(users.update(eq(TENANT_A), any(User.class)))
                    .thenAnswer(inv -> Optional.of(inv.getArgument(1)));

            assertThatThrownBy(() ->
                    service.deactivateAll(TENANT, admin, List.of("u-1", "ghost", "u-3")))
                    .isInstanceOf(ResourceNotFoundException.class);
            verify(users, never()).findById(TENANT_A, "u-3");
        }

        @Test
        @DisplayName("an ADMIN may not delete a ROOT user")
        void adminCannotDeleteRoot() {
            when(users.findById(TENANT_A, "root-1"))
                    .thenReturn(Optional.of(stored("root-1", Role.ROOT)));

            assertThatThrownBy(() -> service.delete(TENANT, admin, "root-1"))
                    .isInstanceOf(PermissionDeniedException.class);
            verify(users, never()).update(anyString(), any());
        }

        @Test
        @DisplayName("batch refuses a ROOT user among the ids")
        void batchRefusesRoot() {
            when(users.findById(TENANT_A, "u-1")).thenReturn(Optional.of(stored("u-1")));
            when(users.findById(TENANT_A, "root-1"))
                    .thenReturn(Optional.of(stored("root-1", Role.ROOT)));
            updatesEcho();

            assertThatThrownBy(() ->
                    service.deactivateAll(TENANT, admin, List.of("u-1", "root-1")))
                    .isInstanceOf(PermissionDeniedException.class);
            verify(users).update(eq(TENANT_A), any(User.class));
        }
    }

    @Test
    @DisplayName("a user of another tenant is not found")
    void foreignRowIsHidden() {
        User foreign = new User("u-9", "other-tenant", "x@example.com", "hash", "X", Role.USER,
                true, NOW, NOW);
        when(users.findById(TENANT_A, "u-9")).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> service.get(TENANT, "u-9"))
                .isInstanceOf(ResourceNotFoundException.class);
    }
}
