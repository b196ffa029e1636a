package com.aegis.adminapi.api.dto;

import com.aegis.security.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code PATCH /api/v1/users/{id}}. Absent fields are left unchanged. {@code role} and
 * {@code isActive} are reserved to administrators.
 */
public record UpdateUserRequest(
        @Size(min = 1, max = 100) String fullName,
        Role role,
        @JsonProperty("isActive") Boolean isActive) {}
