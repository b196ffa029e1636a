package com.aegis.security;

/**
 * A permission descriptor or operation policy is malformed.
 * <p>
 * Indicates a bug in the declarations, not a legitimate access refusal. Raised when the
 * {@link OperationRegistry} is built where possible, otherwise at first evaluation.
 */
public class InvalidPermissionConfigurationException extends RuntimeException {

    public InvalidPermissionConfigurationException(String message) {
        super(message);
    }
}
