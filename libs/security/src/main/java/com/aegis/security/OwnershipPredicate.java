package com.aegis.security;

/**
 * Decides whether the resource targeted by a request is owned by the request's principal.
 *
 * <p>Must be a pure function of the context.
 */
@FunctionalInterface
public interface OwnershipPredicate {

    boolean isOwn(RequestContext context);
}
