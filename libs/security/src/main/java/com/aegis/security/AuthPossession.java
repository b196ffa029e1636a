package com.aegis.security;

import java.util.Optional;

/**
 * Scope of a permission grant.
 *
 * <ul>
 *   <li>{@link #ANY} - any instance of the resource
 *   <li>{@link #OWN} - only instances the principal owns
 *   <li>{@link #OWN_ANY} - the ANY grant, or failing that the OWN grant plus ownership
 * </ul>
 *
 * <p>Grant tables only ever contain {@link #ANY} and {@link #OWN}; {@link #OWN_ANY} is a
 * descriptor-side combination.
 */
public enum AuthPossession {
    ANY("any"),
    OWN("own"),
    OWN_ANY("own|any");

    private final String value;

    AuthPossession(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }

    /** Whether evaluating this possession requires an ownership predicate. */
    public boolean requiresOwnership() {
        return this != ANY;
    }

    public static Optional<AuthPossession> fromString(String value) {
        for (AuthPossession possession : values()) {
            if (possession.value.equalsIgnoreCase(value) || possession.name().equalsIgnoreCase(value)) {
                return Optional.of(possession);
            }
        }
        return Optional.empty();
    }
}
