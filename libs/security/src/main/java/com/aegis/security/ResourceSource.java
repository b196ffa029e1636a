package com.aegis.security;

/**
 * Where a descriptor's resource comes from at decision time.
 *
 * <ul>
 *   <li>{@link Static} - the descriptor's declared resource, unchanged
 *   <li>{@link Dynamic} - a descriptor-specific {@link ResourceExtractor}
 *   <li>{@link ContextDefault} - the default extractor configured on the {@link ResourceResolver}
 * </ul>
 *
 * <p>{@link ResourceResolver} applies them with a fixed precedence: Dynamic, then ContextDefault,
 * then Static.
 */
public interface ResourceSource {

    ResourceSource STATIC = new Static();

    ResourceSource CONTEXT_DEFAULT = new ContextDefault();

    static ResourceSource fromDescriptor() {
        return STATIC;
    }

    static ResourceSource contextDefault() {
        return CONTEXT_DEFAULT;
    }

    static ResourceSource dynamic(ResourceExtractor extractor) {
        return new Dynamic(extractor);
    }

    /** Use the descriptor's static resource. */
    record Static() implements ResourceSource {}

    /** Use the resolver-wide default extractor. */
    record ContextDefault() implements ResourceSource {}

    /** Use the given extractor; its result is taken verbatim. */
    record Dynamic(ResourceExtractor extractor) implements ResourceSource {

        public Dynamic {
            if (extractor == null) {
                throw new IllegalArgumentException("extractor must not be null");
            }
        }
    }
}
