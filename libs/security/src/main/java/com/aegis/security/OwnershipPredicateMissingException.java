package com.aegis.security;

/**
 * A descriptor with possession OWN or OWN_ANY declares no ownership predicate.
 */
public class OwnershipPredicateMissingException extends InvalidPermissionConfigurationException {

    public OwnershipPredicateMissingException(PermissionDescriptor descriptor) {
        super("Possession %s requires an ownership predicate: %s"
                .formatted(descriptor.possession(), descriptor));
    }
}
