package com.aegis.adminapi.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AdminApiProperties")
class AdminApiPropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new AdminApiProperties(
                "admin-api", "production", List.of("https://admin.example.com"));

        assertThat(props.name()).isEqualTo("admin-api");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.allowedOrigins()).containsExactly("https://admin.example.com");
    }

    @Test
    @DisplayName("defaults environment to 'development' when null or blank")
    void defaultsEnvironment() {
        assertThat(new AdminApiProperties("admin-api", null, null).environment())
                .isEqualTo("development");
        assertThat(new AdminApiProperties("admin-api", " ", null).environment())
                .isEqualTo("development");
    }

    @Test
    @DisplayName("defaults CORS origins to the local dev servers")
    void defaultsOrigins() {
        var props = new AdminApiProperties("admin-api", null, List.of());

        assertThat(props.allowedOrigins())
                .containsExactly("http://localhost:3000", "http://localhost:5173");
    }
}
