package com.aegis.adminapi.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code PATCH /api/v1/users/profile}. */
public record UpdateProfileRequest(@NotBlank @Size(max = 100) String fullName) {}
