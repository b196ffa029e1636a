package com.aegis.adminapi.api.dto;

import com.aegis.adminapi.domain.User;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** A user as returned by the API. The password hash is never exposed. */
public record UserResponse(
        String id,
        String tenantId,
        String email,
        String fullName,
        String role,
        @JsonProperty("isActive") boolean isActive,
        Instant createdAt,
        Instant updatedAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.tenantId(), user.email(), user.fullName(),
                user.role().value(), user.active(), user.createdAt(), user.updatedAt());
    }
}
