package com.aegis.adminapi.api;

import static com.aegis.adminapi.api.ApiRequests.as;
import static com.aegis.adminapi.api.ApiRequests.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.aegis.security.Principal;
import com.aegis.security.Role;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Tenant endpoints against the full MVC pipeline and an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Tenant API")
class TenantControllerIntegrationTest {

    private static final Principal ROOT = new Principal("root-1", Role.ROOT, null);

    @Autowired private MockMvc mockMvc;
    @Autowired private ObjectMapper objectMapper;

    private JsonNode createTenant(String name, String domain) throws Exception {
        String body = domain == null
                ? "{\"name\":\"%s\"}".formatted(name)
                : "{\"name\":\"%s\",\"domain\":\"%s\"}".formatted(name, domain);
        String response = mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), body)))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    private static String unique(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("ROOT creates an active tenant by default")
        void rootCreatesTenant() throws Exception {
            String name = unique("Acme");
            JsonNode tenant = createTenant(name, unique("acme"));

            assertThat(tenant.get("id").asText()).isNotBlank();
            assertThat(tenant.get("name").asText()).isEqualTo(name);
            assertThat(tenant.get("isActive").asBoolean()).isTrue();
        }

        @Test
        @DisplayName("honours isActive=false")
        void createsInactiveTenant() throws Exception {
            String body = "{\"name\":\"%s\",\"isActive\":false}".formatted(unique("Dormant"));

            mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), body)))
                    .andExpect(status().isCreated())
                    .andExpect(jsonPath("$.isActive").value(false));
        }

        @Test
        @DisplayName("rejects a duplicate name ignoring case with 409")
        void rejectsDuplicateName() throws Exception {
            String name = unique("Globex");
            createTenant(name, null);

            String body = "{\"name\":\"%s\"}".formatted(name.toUpperCase());
            mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), body)))
                    .andExpect(status().isConflict())
                    .andExpect(jsonPath("$.title").value("Conflict"));
        }

        @Test
        @DisplayName("rejects a duplicate domain with 409")
        void rejectsDuplicateDomain() throws Exception {
            String domain = unique("initech");
            createTenant(unique("Initech"), domain);

            String body = "{\"name\":\"%s\",\"domain\":\"%s\"}".formatted(unique("Other"), domain);
            mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), body)))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("rejects a malformed domain with 400")
        void rejectsMalformedDomain() throws Exception {
            String body = "{\"name\":\"%s\",\"domain\":\"-bad-\"}".formatted(unique("Bad"));

            mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), body)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.title").value("Validation Error"));
        }

        @Test
        @DisplayName("rejects a blank name with 400")
        void rejectsBlankName() throws Exception {
            mockMvc.perform(as(ROOT, json(post("/api/v1/tenants"), "{\"name\":\"  \"}")))
                    .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("ADMIN may not create tenants")
        void adminIsDenied() throws Exception {
            Principal admin = new Principal("admin-1", Role.ADMIN, null);
            String body = "{\"name\":\"%s\"}".formatted(unique("Nope"));

            mockMvc.perform(as(admin, json(post("/api/v1/tenants"), body)))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.action").value("create"));
        }

        @Test
        @DisplayName("anonymous callers get 401")
        void anonymousIsUnauthenticated() throws Exception {
            mockMvc.perform(json(post("/api/v1/tenants"), "{\"name\":\"Anon\"}"))
                    .andExpect(status().isUnauthorized());
        }
    }

    @Nested
    @DisplayName("read")
    class Read {

        @Test
        @DisplayName("ADMIN reads a tenant by id without a tenant header")
        void adminReadsTenant() throws Exception {
            JsonNode tenant = createTenant(unique("Umbrella"), null);
            String id = tenant.get("id").asText();
            Principal admin = new Principal("admin-1", Role.ADMIN, id);

            mockMvc.perform(as(admin, get("/api/v1/tenants/{id}", id)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(id));
        }

        @Test
        @DisplayName("USER may not read tenants")
        void userIsDenied() throws Exception {
            Principal user = new Principal("user-1", Role.USER, null);

            mockMvc.perform(as(user, get("/api/v1/tenants")))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.type").value("https://aegis.dev/errors/forbidden"));
        }

        @Test
        @DisplayName("finds a tenant by domain ignoring case")
        void findsByDomain() throws Exception {
            String domain = unique("stark");
            JsonNode tenant = createTenant(unique("Stark"), domain);

            mockMvc.perform(as(ROOT, get("/api/v1/tenants/by-domain")
                            .param("domain", domain.toUpperCase())))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.id").value(tenant.get("id").asText()));
        }

        @Test
        @DisplayName("unknown id yields 404")
        void unknownIdIsNotFound() throws Exception {
            mockMvc.perform(as(ROOT, get("/api/v1/tenants/{id}", UUID.randomUUID())))
                    .andExpect(status().isNotFound());
        }

        @Test
        @DisplayName("lists with pagination metadata")
        void listsWithMeta() throws Exception {
            createTenant(unique("Page"), null);
            createTenant(unique("Page"), null);

            mockMvc.perform(as(ROOT, get("/api/v1/tenants").param("page", "1").param("limit", "1")))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.data.length()").value(1))
                    .andExpect(jsonPath("$.meta.page").value(1))
                    .andExpect(jsonPath("$.meta.limit").value(1))
                    .andExpect(jsonPath("$.meta.hasNext").value(true))
                    .andExpect(jsonPath("$.meta.hasPrevious").value(false));
        }

        @Test
        @DisplayName("rejects page 0 with 400")
        void rejectsInvalidPage() throws Exception {
            mockMvc.perform(as(ROOT, get("/api/v1/tenants").param("page", "0")))
                    .andExpect(status().isBadRequest());
        }
    }

    @Nested
    @DisplayName("update and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("renames a tenant and keeps the domain when absent")
        void renames() throws Exception {
            String domain = unique("wayne");
            String id = createTenant(unique("Wayne"), domain).get("id").asText();
            String newName = unique("Wayne Enterprises");

            mockMvc.perform(as(ROOT, json(put("/api/v1/tenants/{id}", id),
                            "{\"name\":\"%s\"}".formatted(newName))))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.name").value(newName))
                    .andExpect(jsonPath("$.domain").value(domain));
        }

        @Test
        @DisplayName("rename onto another tenant's name yields 409")
        void renameConflict() throws Exception {
            String taken = unique("Taken");
            createTenant(taken, null);
            String id = createTenant(unique("Free"), null).get("id").asText();

            mockMvc.perform(as(ROOT, json(put("/api/v1/tenants/{id}", id),
                            "{\"name\":\"%s\"}".formatted(taken))))
                    .andExpect(status().isConflict());
        }

        @Test
        @DisplayName("delete deactivates and activate restores")
        void deleteThenActivate() throws Exception {
            String id = createTenant(unique("Cyberdyne"), null).get("id").asText();

            mockMvc.perform(as(ROOT, delete("/api/v1/tenants/{id}", id)))
                    .andExpect(status().isNoContent());
            mockMvc.perform(as(ROOT, get("/api/v1/tenants/{id}", id)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.isActive").value(false));

            mockMvc.perform(as(ROOT, post("/api/v1/tenants/{id}/activate", id)))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.isActive").value(true));
        }
    }
}
