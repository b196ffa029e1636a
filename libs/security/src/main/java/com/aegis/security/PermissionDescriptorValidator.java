package com.aegis.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks permission descriptors for configuration errors before they are used.
 * <p>
 * Returns every error at once so that a broken declaration table can be fixed in one pass.
 * Problems that only show up at runtime (an extractor returning a malformed batch) are caught
 * by {@link AuthorizationDecisionEngine}.
 */
public final class PermissionDescriptorValidator {

    private PermissionDescriptorValidator() {
        // utility class
    }

    public static ValidationResult validate(PermissionDescriptor descriptor) {
        List<String> errors = new ArrayList<>();
        collect(descriptor, "descriptor", errors);
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    /** Validates all descriptors of an operation, prefixing errors with the operation id. */
    public static ValidationResult validate(OperationPolicy policy) {
        List<String> errors = new ArrayList<>();
        if (isBlank(policy.operationId())) {
            errors.add("operationId must not be null or blank");
        }
        List<PermissionDescriptor> descriptors = policy.permissions();
        for (int i = 0; i < descriptors.size(); i++) {
            collect(descriptors.get(i), "%s permissions[%d]".formatted(policy.operationId(), i),
                    errors);
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static void collect(PermissionDescriptor d, String path, List<String> errors) {
        if (d == null) {
            errors.add(path + " must not be null");
            return;
        }
        if (isBlank(d.action())) {
            errors.add(path + ".action must not be null or blank");
        }
        if (d.possession().requiresOwnership() && d.isOwn() == null) {
            errors.add(path + ".isOwn is required for possession " + d.possession());
        }
        // a dynamic source may legitimately leave the static resource unset
        boolean staticResourceUsed = !(d.resourceSource() instanceof ResourceSource.Dynamic);
        if (d.resource() == null) {
            if (staticResourceUsed) {
                errors.add(path + ".resource must not be null");
            }
            return;
        }
        List<AuthResource> elements = d.resource().elements();
        if (elements.isEmpty()) {
            errors.add(path + ".resource batch must not be empty");
        }
        for (int i = 0; i < elements.size(); i++) {
            AuthResource element = elements.get(i);
            if (element == null || !element.isWellFormed()) {
                errors.add("%s.resource[%d] must have a resource type".formatted(path, i));
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
