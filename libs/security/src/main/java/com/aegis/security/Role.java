package com.aegis.security;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles carried by every {@link Principal}.
 * <p>
 * The hierarchy is encoded once here: ROOT implies ADMIN and USER, ADMIN implies USER.
 * Grant lookups in {@link RoleGrantTable} walk this hierarchy, so a grant given to USER is
 * available to ADMIN and ROOT without being repeated.
 */
public enum Role {

    USER("USER"),
    ADMIN("ADMIN"),
    ROOT("ROOT");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string representation (e.g., "ADMIN"). */
    public String value() {
        return value;
    }

    /**
     * Returns the set of roles that this role implies (inherits).
     * <ul>
     *   <li>ROOT implies ADMIN, USER</li>
     *   <li>ADMIN implies USER</li>
     *   <li>USER implies nothing</li>
     * </ul>
     */
    public Set<Role> impliedRoles() {
        return switch (this) {
            case ROOT -> EnumSet.of(ADMIN, USER);
            case ADMIN -> EnumSet.of(USER);
            default -> EnumSet.noneOf(Role.class);
        };
    }

    /**
     * Checks whether this role implies the given role
     * (either directly or through the hierarchy).
     */
    public boolean implies(Role other) {
        return this == other || impliedRoles().contains(other);
    }

    /**
     * Looks up a Role by its canonical string value, ignoring case.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
