package com.aegis.security;

import java.util.List;

/**
 * Result of validating permission declarations: either valid (no errors) or a list of all
 * problems found.
 *
 * @param valid  whether the declarations passed all checks
 * @param errors validation error messages (empty if valid)
 */
public record ValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static ValidationResult ok() {
        return new ValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static ValidationResult fail(List<String> errors) {
        return new ValidationResult(false, List.copyOf(errors));
    }
}
