package com.aegis.security;

/**
 * The static part of a {@link PermissionDescriptor}, without its ownership predicate or resource
 * source. Handed to {@link ResourceExtractor}s.
 *
 * @param resource      statically declared resource
 * @param action        action verb or custom action
 * @param possession    possession mode
 * @param batchApproval batch approval policy
 */
public record PermissionData(
        ResourceRef resource, String action, AuthPossession possession, BatchApproval batchApproval) {}
