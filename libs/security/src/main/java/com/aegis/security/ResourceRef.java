package com.aegis.security;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Either a single {@link AuthResource} or an ordered sequence of them (the batch case).
 *
 * <p>A batch is evaluated element by element and combined with the descriptor's {@link
 * BatchApproval}. Elements are kept as given, including {@code null} or malformed ones, so that
 * the decision engine can report them as configuration errors instead of skipping them.
 */
public final class ResourceRef {

    private final List<AuthResource> resources;
    private final boolean batch;

    private ResourceRef(List<AuthResource> resources, boolean batch) {
        this.resources = resources;
        this.batch = batch;
    }

    public static ResourceRef single(AuthResource resource) {
        return new ResourceRef(Collections.singletonList(resource), false);
    }

    public static ResourceRef single(String type) {
        return single(AuthResource.of(type));
    }

    public static ResourceRef batch(List<AuthResource> resources) {
        if (resources == null) {
            throw new IllegalArgumentException("batch resources must not be null");
        }
        return new ResourceRef(Collections.unmodifiableList(new ArrayList<>(resources)), true);
    }

    public static ResourceRef batch(AuthResource... resources) {
        return batch(List.of(resources));
    }

    public boolean isBatch() {
        return batch;
    }

    /** Returns the single resource. Only valid when {@link #isBatch()} is false. */
    public AuthResource single() {
        if (batch) {
            throw new IllegalStateException("resource reference is a batch");
        }
        return resources.get(0);
    }

    /** All elements in declaration order; a single reference yields a one-element list. */
    public List<AuthResource> elements() {
        return resources;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceRef other)) {
            return false;
        }
        return batch == other.batch && resources.equals(other.resources);
    }

    @Override
    public int hashCode() {
        return 31 * resources.hashCode() + (batch ? 1 : 0);
    }

    @Override
    public String toString() {
        return batch ? resources.toString() : String.valueOf(resources.get(0));
    }
}
