package com.aegis.security;

/**
 * Declarative statement of a permission an operation requires.
 *
 * <p>Declared once at startup in an {@link OperationRegistry} and immutable afterwards. Several
 * descriptors on one operation are conjunctive: all must allow.
 *
 * <p>Defaults applied at construction: possession {@link AuthPossession#ANY}, resource source
 * {@link ResourceSource#STATIC}, batch approval {@link BatchApproval#ALL}. Structural problems
 * (missing ownership predicate, blank action, empty batch) are not rejected here; {@link
 * PermissionDescriptorValidator} reports them when the registry is built.
 *
 * @param resource       statically declared resource
 * @param action         action verb ({@link AuthActionVerb#value()}) or a custom action
 * @param possession     possession mode
 * @param isOwn          ownership predicate, required for OWN and OWN_ANY
 * @param resourceSource where the resource is taken from at decision time
 * @param batchApproval  how per-element decisions are combined for batch resources
 */
public record PermissionDescriptor(
        ResourceRef resource,
        String action,
        AuthPossession possession,
        OwnershipPredicate isOwn,
        ResourceSource resourceSource,
        BatchApproval batchApproval) {

    public PermissionDescriptor {
        if (possession == null) {
            possession = AuthPossession.ANY;
        }
        if (resourceSource == null) {
            resourceSource = ResourceSource.STATIC;
        }
        if (batchApproval == null) {
            batchApproval = BatchApproval.ALL;
        }
    }

    /** The descriptor without its functions, as handed to resource extractors. */
    public PermissionData data() {
        return new PermissionData(resource, action, possession, batchApproval);
    }

    @Override
    public String toString() {
        return "PermissionDescriptor[" + action + " " + resource + " (" + possession.value() + ")]";
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Shortcut for {@code builder().resource(type).action(verb)}. */
    public static Builder on(String resourceType, AuthActionVerb verb) {
        return builder().resource(resourceType).action(verb);
    }

    public static final class Builder {

        private ResourceRef resource;
        private String action;
        private AuthPossession possession;
        private OwnershipPredicate isOwn;
        private ResourceSource resourceSource;
        private BatchApproval batchApproval;

        private Builder() {}

        public Builder resource(ResourceRef resource) {
            this.resource = resource;
            return this;
        }

        public Builder resource(String type) {
            this.resource = ResourceRef.single(type);
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder action(AuthActionVerb verb) {
            this.action = verb.value();
            return this;
        }

        public Builder possession(AuthPossession possession) {
            this.possession = possession;
            return this;
        }

        public Builder isOwn(OwnershipPredicate isOwn) {
            this.isOwn = isOwn;
            return this;
        }

        public Builder resourceFromContext(ResourceExtractor extractor) {
            this.resourceSource = ResourceSource.dynamic(extractor);
            return this;
        }

        /** Use the resolver's default extractor. */
        public Builder resourceFromContext() {
            this.resourceSource = ResourceSource.contextDefault();
            return this;
        }

        public Builder batchApproval(BatchApproval batchApproval) {
            this.batchApproval = batchApproval;
            return this;
        }

        public PermissionDescriptor build() {
            return new PermissionDescriptor(
                    resource, action, possession, isOwn, resourceSource, batchApproval);
        }
    }
}
