package io.liparakis.chunkwire.registry;

/**
 * What to do with a palette name the registry does not know.
 */
public enum RegistryLookupPolicy {
    /** Resolve to id 0 (air, or the first biome) and log a warning. */
    FALLBACK_TO_ZERO,
    /** Fail the build with {@code UNKNOWN_REGISTRY_ENTRY}. */
    STRICT
}
