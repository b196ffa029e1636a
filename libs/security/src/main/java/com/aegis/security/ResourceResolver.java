package com.aegis.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the concrete resource(s) a descriptor targets for one request.
 *
 * <p>Precedence is fixed:
 *
 * <ol>
 *   <li>{@link ResourceSource.Dynamic}: the descriptor's extractor, result used verbatim
 *   <li>{@link ResourceSource.ContextDefault}: the default extractor configured here; when none
 *       is configured the static resource is used
 *   <li>{@link ResourceSource.Static}: the descriptor's declared resource
 * </ol>
 *
 * <p>Extractor failures are propagated as {@link AuthorizationEvaluationException}, never as an
 * implicit allow or deny.
 */
public final class ResourceResolver {

    private static final Logger log = LoggerFactory.getLogger(ResourceResolver.class);

    private final ResourceExtractor defaultExtractor;

    /** A resolver without a module-level default extractor. */
    public ResourceResolver() {
        this(null);
    }

    /**
     * @param defaultExtractor extractor used for {@link ResourceSource.ContextDefault}, may be null
     */
    public ResourceResolver(ResourceExtractor defaultExtractor) {
        this.defaultExtractor = defaultExtractor;
    }

    public ResourceRef resolve(PermissionDescriptor descriptor, RequestContext context) {
        ResourceSource source = descriptor.resourceSource();
        if (source instanceof ResourceSource.Dynamic dynamic) {
            return invoke(dynamic.extractor(), descriptor, context);
        }
        if (source instanceof ResourceSource.ContextDefault) {
            if (defaultExtractor != null) {
                return invoke(defaultExtractor, descriptor, context);
            }
            log.debug("No default resource extractor configured, using static resource for {}",
                    descriptor);
        }
        return descriptor.resource();
    }

    private ResourceRef invoke(
            ResourceExtractor extractor, PermissionDescriptor descriptor, RequestContext context) {
        ResourceRef resolved;
        try {
            resolved = extractor.extract(context, descriptor.data());
        } catch (RuntimeException e) {
            throw new AuthorizationEvaluationException(
                    "Resource extraction failed for " + descriptor, e);
        }
        if (resolved == null) {
            throw new InvalidPermissionConfigurationException(
                    "Resource extractor returned no resource for " + descriptor);
        }
        return resolved;
    }
}
