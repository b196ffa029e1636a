package com.aegis.adminapi.api.dto;

final class TenantDomain {

    /** A single DNS label: alphanumerics and inner hyphens. */
    static final String PATTERN = "^[a-zA-Z0-9]([a-zA-Z0-9-]*[a-zA-Z0-9])?$";

    static final String MESSAGE =
            "must contain only letters, digits and hyphens, and not start or end with a hyphen";

    private TenantDomain() {}
}
