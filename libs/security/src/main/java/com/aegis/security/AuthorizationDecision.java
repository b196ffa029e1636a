package com.aegis.security;

/**
 * Outcome of evaluating one permission descriptor. Computed per request, never persisted.
 *
 * @param allowed whether the descriptor allows the operation
 * @param reason  human-readable reason, set for denials
 */
public record AuthorizationDecision(boolean allowed, String reason) {

    private static final AuthorizationDecision ALLOW = new AuthorizationDecision(true, null);

    public static AuthorizationDecision allow() {
        return ALLOW;
    }

    public static AuthorizationDecision deny(String reason) {
        return new AuthorizationDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
