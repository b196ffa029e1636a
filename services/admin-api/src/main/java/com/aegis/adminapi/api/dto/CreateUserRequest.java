package com.aegis.adminapi.api.dto;

import com.aegis.security.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/users}. The user is created in the request's tenant; a tenant id
 * in the body is not accepted.
 *
 * @param role defaults to {@link Role#USER}
 */
public record CreateUserRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 8, max = 128) String password,
        @NotBlank @Size(max = 100) String fullName,
        Role role) {}
