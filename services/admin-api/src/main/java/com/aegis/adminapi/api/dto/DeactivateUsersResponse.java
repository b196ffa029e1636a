package com.aegis.adminapi.api.dto;

import java.util.List;

public record DeactivateUsersResponse(int deactivated, List<String> ids) {}
