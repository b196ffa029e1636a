package com.aegis.security;

/**
 * Dynamically resolves the resource(s) an operation targets from the request.
 *
 * <p>Receives the descriptor stripped of its functions ({@link PermissionData}), mirroring how
 * the static fields are available to the extraction logic. Implementations may perform lookups;
 * any exception they throw becomes an {@link AuthorizationEvaluationException}.
 */
@FunctionalInterface
public interface ResourceExtractor {

    ResourceRef extract(RequestContext context, PermissionData permission);
}
