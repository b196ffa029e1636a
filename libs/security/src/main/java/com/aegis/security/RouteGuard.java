package com.aegis.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-operation authorization entry point.
 *
 * <p>For each call the guard:
 *
 * <ol>
 *   <li>looks up the operation's {@link OperationPolicy}
 *   <li>resolves the tenant, before anything else touches the request
 *   <li>requires a principal when the operation is protected, and checks that it belongs to the
 *       resolved tenant
 *   <li>for tenant-aware operations, checks that the tenant is active
 *   <li>checks required roles
 *   <li>resolves and decides every descriptor; the first deny wins
 * </ol>
 *
 * <p>Decisions are never cached. The guard holds only immutable collaborators and is safe to
 * share across threads.
 */
public final class RouteGuard {

    private static final Logger log = LoggerFactory.getLogger(RouteGuard.class);

    private final OperationRegistry registry;
    private final TenantResolver tenantResolver;
    private final TenantDirectory tenantDirectory;
    private final ResourceResolver resourceResolver;
    private final AuthorizationDecisionEngine decisionEngine;

    public RouteGuard(
            OperationRegistry registry,
            TenantResolver tenantResolver,
            TenantDirectory tenantDirectory,
            ResourceResolver resourceResolver,
            AuthorizationDecisionEngine decisionEngine) {
        this.registry = registry;
        this.tenantResolver = tenantResolver;
        this.tenantDirectory = tenantDirectory;
        this.resourceResolver = resourceResolver;
        this.decisionEngine = decisionEngine;
    }

    /**
     * Authorizes the operation or throws.
     *
     * @return the allowed result, carrying the resolved tenant
     * @throws TenantContextMissingException           tenant-aware operation without tenant
     * @throws UnauthenticatedException                protected operation without principal
     * @throws TenantMismatchException                 principal of another tenant
     * @throws TenantInactiveException                 tenant-aware operation on an inactive tenant
     * @throws PermissionDeniedException               a role requirement or descriptor denied
     * @throws InvalidPermissionConfigurationException malformed descriptor
     * @throws AuthorizationEvaluationException        a callback failed
     */
    public GuardResult authorize(String operationId, RequestContext context) {
        GuardResult result = evaluate(operationId, context);
        if (!result.allowed()) {
            String resource = result.deniedResource() != null
                    ? result.deniedResource().toString()
                    : "-";
            String action = result.deniedBy() != null ? result.deniedBy().action() : "-";
            throw new PermissionDeniedException(
                    operationId, resource, action, result.decision().reason());
        }
        return result;
    }

    /**
     * Runs the guard and reports a deny as a {@link GuardState#DENIED} result instead of
     * throwing. Authentication, tenant and configuration failures still throw.
     */
    public GuardResult evaluate(String operationId, RequestContext context) {
        OperationPolicy policy = registry.lookup(operationId);
        GuardState state = GuardState.START;

        TenantContext tenant =
                tenantResolver.resolve(context, operationId, policy.tenantExempt()).orElse(null);
        state = advance(operationId, state, GuardState.TENANT_RESOLVED);

        Principal principal = context.principal();
        if (principal == null && policy.requiresPrincipal()) {
            log.warn("Rejected unauthenticated call to {}", operationId);
            throw new UnauthenticatedException(operationId);
        }
        if (principal != null && tenant != null) {
            enforceTenant(operationId, principal, tenant);
        }
        if (tenant != null && !policy.tenantExempt()) {
            requireActive(operationId, tenant);
        }

        if (!RoleChecker.hasAnyRole(principal, policy.requiredRoles())) {
            AuthorizationDecision decision = AuthorizationDecision.deny(
                    "role %s is not one of %s".formatted(principal.role(), policy.requiredRoles()));
            logDenied(operationId, principal, tenant, "-", "-", decision);
            return GuardResult.denied(operationId, decision, tenant, null, null);
        }

        AuthorizationDecision last = AuthorizationDecision.allow();
        for (PermissionDescriptor descriptor : policy.permissions()) {
            ResourceRef resource;
            AuthorizationDecision decision;
            try {
                resource = resourceResolver.resolve(descriptor, context);
                state = advance(operationId, state, GuardState.RESOURCE_RESOLVED);
                decision = decisionEngine.decide(principal, descriptor, resource, context);
                state = advance(operationId, state, GuardState.DECIDED);
            } catch (InvalidPermissionConfigurationException e) {
                log.error("Invalid permission configuration on {}: {}",
                        operationId, e.getMessage(), e);
                throw e;
            } catch (AuthorizationEvaluationException e) {
                log.error("Authorization evaluation failed on {}: {}",
                        operationId, e.getMessage(), e);
                throw e;
            }
            if (decision.denied()) {
                logDenied(operationId, principal, tenant, resource.toString(),
                        descriptor.action(), decision);
                return GuardResult.denied(operationId, decision, tenant, descriptor, resource);
            }
            last = decision;
        }
        advance(operationId, state, GuardState.ALLOWED);
        return GuardResult.allowed(operationId, last, tenant);
    }

    private static void enforceTenant(String operationId, Principal principal, TenantContext tenant) {
        try {
            TenantIsolationEnforcer.enforce(principal, tenant);
        } catch (TenantMismatchException e) {
            log.warn("Rejected cross-tenant call to {}: principal={} principalTenant={} tenant={}",
                    operationId, principal.id(), principal.tenantId(), tenant.tenantId());
            throw e;
        }
    }

    private void requireActive(String operationId, TenantContext tenant) {
        boolean active;
        try {
            active = tenantDirectory.isActive(tenant.tenantId());
        } catch (RuntimeException e) {
            log.error("Tenant status lookup failed on {} for tenant {}",
                    operationId, tenant.tenantId(), e);
            throw new AuthorizationEvaluationException(
                    "Tenant status lookup failed for " + tenant.tenantId(), e);
        }
        if (!active) {
            log.warn("Rejected call to {} in inactive tenant {}", operationId, tenant.tenantId());
            throw new TenantInactiveException(operationId, tenant.tenantId());
        }
    }

    private static void logDenied(
            String operationId,
            Principal principal,
            TenantContext tenant,
            String resource,
            String action,
            AuthorizationDecision decision) {
        log.warn("Denied {}: principal={} role={} tenant={} resource={} action={} reason={}",
                operationId,
                principal.id(),
                principal.role().value(),
                tenant != null ? tenant.tenantId() : "-",
                resource,
                action,
                decision.reason());
    }

    private static GuardState advance(String operationId, GuardState from, GuardState to) {
        log.trace("{}: {} -> {}", operationId, from, to);
        return to;
    }
}
