package com.aegis.security;

import java.util.List;

/**
 * Combines a principal, a descriptor and the resolved resource(s) into an allow/deny decision.
 *
 * <p>Per resource:
 *
 * <ul>
 *   <li>{@code ANY}: allowed iff the role holds the ANY grant
 *   <li>{@code OWN}: allowed iff the role holds the OWN grant and the ownership predicate holds
 *   <li>{@code OWN_ANY}: allowed iff the ANY grant holds, or the OWN grant holds and the ownership
 *       predicate holds
 * </ul>
 *
 * <p>A batch is evaluated element by element and combined with the descriptor's {@link
 * BatchApproval}. Every element is checked for well-formedness before any is evaluated, so a
 * malformed element is reported even when an earlier one would already deny.
 *
 * <p>The engine is stateless and pure apart from the callbacks it is handed; one instance serves
 * all requests. The ownership predicate runs at most once per decision.
 */
public final class AuthorizationDecisionEngine {

    private final GrantPolicy grantPolicy;
    private final OwnershipEvaluator ownershipEvaluator;

    public AuthorizationDecisionEngine(GrantPolicy grantPolicy) {
        this(grantPolicy, new OwnershipEvaluator());
    }

    public AuthorizationDecisionEngine(
            GrantPolicy grantPolicy, OwnershipEvaluator ownershipEvaluator) {
        if (grantPolicy == null) {
            throw new IllegalArgumentException("grantPolicy must not be null");
        }
        if (ownershipEvaluator == null) {
            throw new IllegalArgumentException("ownershipEvaluator must not be null");
        }
        this.grantPolicy = grantPolicy;
        this.ownershipEvaluator = ownershipEvaluator;
    }

    /**
     * Decides one descriptor for one request.
     *
     * @param principal        the acting principal, required
     * @param descriptor       the descriptor being evaluated
     * @param resolvedResource output of {@link ResourceResolver#resolve}
     * @param context          the request, handed to the ownership predicate
     * @throws InvalidPermissionConfigurationException if the descriptor or a resource is malformed
     * @throws AuthorizationEvaluationException        if a callback fails
     */
    public AuthorizationDecision decide(
            Principal principal,
            PermissionDescriptor descriptor,
            ResourceRef resolvedResource,
            RequestContext context) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
        if (descriptor.possession().requiresOwnership() && descriptor.isOwn() == null) {
            throw new OwnershipPredicateMissingException(descriptor);
        }
        if (descriptor.action() == null || descriptor.action().isBlank()) {
            throw new InvalidPermissionConfigurationException(
                    "Descriptor has no action: " + descriptor);
        }
        List<AuthResource> elements = requireWellFormed(descriptor, resolvedResource);
        Ownership ownership = new Ownership(descriptor, context);

        if (!resolvedResource.isBatch()) {
            return decideSingle(principal, descriptor, elements.get(0), ownership);
        }
        return descriptor.batchApproval() == BatchApproval.ANY
                ? decideAnyOf(principal, descriptor, elements, ownership)
                : decideAllOf(principal, descriptor, elements, ownership);
    }

    private AuthorizationDecision decideAllOf(
            Principal principal,
            PermissionDescriptor descriptor,
            List<AuthResource> elements,
            Ownership ownership) {
        for (int i = 0; i < elements.size(); i++) {
            AuthorizationDecision element =
                    decideSingle(principal, descriptor, elements.get(i), ownership);
            if (element.denied()) {
                return AuthorizationDecision.deny(
                        "batch element %d (%s) denied: %s"
                                .formatted(i, elements.get(i), element.reason()));
            }
        }
        return AuthorizationDecision.allow();
    }

    private AuthorizationDecision decideAnyOf(
            Principal principal,
            PermissionDescriptor descriptor,
            List<AuthResource> elements,
            Ownership ownership) {
        for (AuthResource element : elements) {
            if (decideSingle(principal, descriptor, element, ownership).allowed()) {
                return AuthorizationDecision.allow();
            }
        }
        return AuthorizationDecision.deny(
                "none of %d batch elements allowed".formatted(elements.size()));
    }

    private AuthorizationDecision decideSingle(
            Principal principal,
            PermissionDescriptor descriptor,
            AuthResource resource,
            Ownership ownership) {
        Role role = principal.role();
        String action = descriptor.action();

        return switch (descriptor.possession()) {
            case ANY -> grants(role, resource, action, AuthPossession.ANY)
                    ? AuthorizationDecision.allow()
                    : missingGrant(role, resource, action, AuthPossession.ANY);
            case OWN -> {
                if (!grants(role, resource, action, AuthPossession.OWN)) {
                    yield missingGrant(role, resource, action, AuthPossession.OWN);
                }
                yield ownership.holds()
                        ? AuthorizationDecision.allow()
                        : AuthorizationDecision.deny("ownership check failed on " + resource);
            }
            case OWN_ANY -> {
                if (grants(role, resource, action, AuthPossession.ANY)) {
                    yield AuthorizationDecision.allow();
                }
                if (!grants(role, resource, action, AuthPossession.OWN)) {
                    yield missingGrant(role, resource, action, AuthPossession.OWN_ANY);
                }
                yield ownership.holds()
                        ? AuthorizationDecision.allow()
                        : AuthorizationDecision.deny(
                                "no '%s:any' grant and ownership check failed on %s"
                                        .formatted(action, resource));
            }
        };
    }

    private boolean grants(Role role, AuthResource resource, String action, AuthPossession scope) {
        try {
            return grantPolicy.grants(role, resource.type(), action, scope);
        } catch (RuntimeException e) {
            throw new AuthorizationEvaluationException(
                    "Grant lookup failed for %s %s:%s".formatted(role, action, resource), e);
        }
    }

    private static AuthorizationDecision missingGrant(
            Role role, AuthResource resource, String action, AuthPossession scope) {
        return AuthorizationDecision.deny(
                "role %s has no '%s:%s' grant on %s"
                        .formatted(role.value(), action, scope.value(), resource.type()));
    }

    private static List<AuthResource> requireWellFormed(
            PermissionDescriptor descriptor, ResourceRef resolved) {
        if (resolved == null) {
            throw new InvalidPermissionConfigurationException(
                    "No resource resolved for " + descriptor);
        }
        List<AuthResource> elements = resolved.elements();
        if (elements.isEmpty()) {
            throw new InvalidPermissionConfigurationException(
                    "Empty resource batch for " + descriptor);
        }
        for (int i = 0; i < elements.size(); i++) {
            AuthResource element = elements.get(i);
            if (element == null || !element.isWellFormed()) {
                throw new InvalidPermissionConfigurationException(
                        "Malformed resource at index %d for %s".formatted(i, descriptor));
            }
        }
        return elements;
    }

    /** Lazily evaluated, memoized ownership for one decision. */
    private final class Ownership {

        private final PermissionDescriptor descriptor;
        private final RequestContext context;
        private Boolean value;

        Ownership(PermissionDescriptor descriptor, RequestContext context) {
            this.descriptor = descriptor;
            this.context = context;
        }

        boolean holds() {
            if (value == null) {
                value = ownershipEvaluator.isOwn(descriptor, context);
            }
            return value;
        }
    }
}
