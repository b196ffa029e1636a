package com.aegis.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Base64;

/**
 * Encodes a {@link Principal} for propagation in a single header value, e.g. {@code
 * X-Principal} set by the gateway after token validation.
 * <p>
 * Format: Base64 of the principal's JSON ({@code {"id":..,"role":"ADMIN","tenantId":..}}).
 */
public final class PrincipalCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private PrincipalCodec() {
        // utility class
    }

    /**
     * @throws PrincipalCodecException if serialization fails
     */
    public static String encode(Principal principal) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(principal);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new PrincipalCodecException("Failed to encode principal", e);
        }
    }

    /**
     * @throws PrincipalCodecException if the value is not Base64, not JSON, or not a valid
     *                                 principal
     */
    public static Principal decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new PrincipalCodecException("Encoded principal is empty", null);
        }
        try {
            byte[] json = Base64.getDecoder().decode(encoded.strip());
            return MAPPER.readValue(json, Principal.class);
        } catch (Exception e) {
            throw new PrincipalCodecException("Failed to decode principal", e);
        }
    }

    /**
     * Thrown when a principal cannot be encoded or decoded.
     */
    public static class PrincipalCodecException extends RuntimeException {
        public PrincipalCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
