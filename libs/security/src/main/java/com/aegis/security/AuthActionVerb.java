package com.aegis.security;

import java.util.Optional;

/**
 * Standard CRUD action verbs. Descriptors may also carry custom action strings; these are the
 * ones the admin platform declares.
 */
public enum AuthActionVerb {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete");

    private final String value;

    AuthActionVerb(String value) {
        this.value = value;
    }

    /** The canonical string representation used in descriptors and grant tables. */
    public String value() {
        return value;
    }

    public static Optional<AuthActionVerb> fromString(String value) {
        for (AuthActionVerb verb : values()) {
            if (verb.value.equals(value)) {
                return Optional.of(verb);
            }
        }
        return Optional.empty();
    }
}
