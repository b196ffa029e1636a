package com.aegis.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.security.testing.TestRequestContextFactory;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("PrincipalCodec")
class PrincipalCodecTest {

    @Test
    @DisplayName("decodes what it encodes")
    void roundTrips() {
        var original = TestRequestContextFactory.principal(Role.ADMIN);
        assertThat(PrincipalCodec.decode(PrincipalCodec.encode(original))).isEqualTo(original);
    }

    @Test
    @DisplayName("decodes gateway JSON")
    void decodesGatewayJson() {
        String json = "{\"id\":\"u-1\",\"role\":\"ROOT\",\"tenantId\":\"t-1\"}";
        String header = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
        assertThat(PrincipalCodec.decode(header)).isEqualTo(new Principal("u-1", Role.ROOT, "t-1"));
    }

    @Nested
    @DisplayName("rejects")
    class Rejects {

        @Test
        @DisplayName("empty header")
        void empty() {
            assertThatThrownBy(() -> PrincipalCodec.decode(" "))
                    .isInstanceOf(PrincipalCodec.PrincipalCodecException.class);
        }

        @Test
        @DisplayName("non-Base64 input")
        void notBase64() {
            assertThatThrownBy(() -> PrincipalCodec.decode("%%%"))
                    .isInstanceOf(PrincipalCodec.PrincipalCodecException.class);
        }

        @Test
        @DisplayName("principal without id")
        void missingId() {
            String json = "{\"role\":\"USER\",\"tenantId\":\"t-1\"}";
            String header = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
            assertThatThrownBy(() -> PrincipalCodec.decode(header))
                    .isInstanceOf(PrincipalCodec.PrincipalCodecException.class);
        }

        @Test
        @DisplayName("unknown role")
        void unknownRole() {
            String json = "{\"id\":\"u-1\",\"role\":\"SUPERUSER\",\"tenantId\":\"t-1\"}";
            String header = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
            assertThatThrownBy(() -> PrincipalCodec.decode(header))
                    .isInstanceOf(PrincipalCodec.PrincipalCodecException.class);
        }
    }
}
