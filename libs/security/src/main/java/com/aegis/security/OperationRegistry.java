package com.aegis.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Table of {@link OperationPolicy} entries keyed by operation id.
 *
 * <p>Filled once at startup through the {@link Builder}; {@link Builder#build()} validates every
 * descriptor and fails fast on configuration errors. The built registry is immutable and read
 * concurrently by all requests.
 *
 * <p>Operations that were never registered are treated as tenant-aware with no permission
 * requirements.
 */
public final class OperationRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationRegistry.class);

    private final Map<String, OperationPolicy> policies;

    private OperationRegistry(Map<String, OperationPolicy> policies) {
        this.policies = policies;
    }

    /** The policy for an operation, falling back to a tenant-aware policy without permissions. */
    public OperationPolicy lookup(String operationId) {
        OperationPolicy policy = policies.get(operationId);
        return policy != null ? policy : OperationPolicy.tenantScoped(operationId);
    }

    public Optional<OperationPolicy> find(String operationId) {
        return Optional.ofNullable(policies.get(operationId));
    }

    public Set<String> operationIds() {
        return policies.keySet();
    }

    public int size() {
        return policies.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final Map<String, OperationPolicy> policies = new LinkedHashMap<>();
        private final List<String> errors = new ArrayList<>();

        private Builder() {}

        public Builder register(OperationPolicy policy) {
            if (policies.putIfAbsent(policy.operationId(), policy) != null) {
                errors.add("duplicate operation '%s'".formatted(policy.operationId()));
            }
            return this;
        }

        /** Registers a tenant-aware operation guarded by the given descriptors. */
        public Builder protect(String operationId, PermissionDescriptor... permissions) {
            return register(new OperationPolicy(operationId, List.of(permissions), false, Set.of()));
        }

        /**
         * Registers a tenant-aware operation open only to principals implying one of the roles,
         * and guarded by the given descriptors.
         */
        public Builder protect(
                String operationId, Set<Role> requiredRoles, PermissionDescriptor... permissions) {
            return register(
                    new OperationPolicy(operationId, List.of(permissions), false, requiredRoles));
        }

        /** Registers a tenant-exempt operation guarded by the given descriptors. */
        public Builder tenantExempt(String operationId, PermissionDescriptor... permissions) {
            return register(new OperationPolicy(operationId, List.of(permissions), true, Set.of()));
        }

        /**
         * @throws InvalidPermissionConfigurationException listing every problem found
         */
        public OperationRegistry build() {
            List<String> all = new ArrayList<>(errors);
            for (OperationPolicy policy : policies.values()) {
                all.addAll(PermissionDescriptorValidator.validate(policy).errors());
            }
            if (!all.isEmpty()) {
                throw new InvalidPermissionConfigurationException(
                        "Invalid operation policies: " + String.join("; ", all));
            }
            log.info("Registered {} operation policies", policies.size());
            return new OperationRegistry(Collections.unmodifiableMap(new LinkedHashMap<>(policies)));
        }
    }
}
