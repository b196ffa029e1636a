package com.aegis.security;

/**
 * A callback used while evaluating a decision (resource extractor, ownership predicate, grant
 * lookup) failed.
 * <p>
 * Neither an allow nor a deny: the caller decides whether to retry or surface a server error.
 */
public class AuthorizationEvaluationException extends RuntimeException {

    public AuthorizationEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
