package com.aegis.adminapi.domain;

/**
 * Criteria of the user listing.
 *
 * @param active status of the listed users
 * @param search case-insensitive fragment of the email or full name, or {@code null}
 */
public record UserFilter(boolean active, String search) {

    public static final int MAX_SEARCH_LENGTH = 100;

    /** Active users, no search. */
    public static final UserFilter ACTIVE = new UserFilter(true, null);

    public UserFilter {
        search = search == null || search.isBlank() ? null : search.strip();
        if (search != null && search.length() > MAX_SEARCH_LENGTH) {
            throw new IllegalArgumentException(
                    "search must be at most " + MAX_SEARCH_LENGTH + " characters");
        }
    }

    /** A missing status lists active users. */
    public static UserFilter of(Boolean active, String search) {
        return new UserFilter(active == null || active, search);
    }
}
