package com.aegis.security;

/**
 * Runs a descriptor's ownership predicate against the request.
 */
public final class OwnershipEvaluator {

    /**
     * @throws OwnershipPredicateMissingException if the descriptor declares no predicate
     * @throws AuthorizationEvaluationException   if the predicate fails
     */
    public boolean isOwn(PermissionDescriptor descriptor, RequestContext context) {
        OwnershipPredicate predicate = descriptor.isOwn();
        if (predicate == null) {
            throw new OwnershipPredicateMissingException(descriptor);
        }
        try {
            return predicate.isOwn(context);
        } catch (RuntimeException e) {
            throw new AuthorizationEvaluationException(
                    "Ownership check failed for " + descriptor, e);
        }
    }
}
