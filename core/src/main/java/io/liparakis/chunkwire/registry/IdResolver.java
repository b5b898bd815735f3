package io.liparakis.chunkwire.registry;

import io.liparakis.chunkwire.ChunkWire;
import io.liparakis.chunkwire.spi.Registry;
import io.liparakis.chunkwire.wire.WireException;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves palette names against a {@link Registry} under a {@link RegistryLookupPolicy}.
 * <p>
 * Thread-safe: the registry is read-only and the set of already-reported names is concurrent.
 */
public final class IdResolver {
    static final int FALLBACK_ID = 0;

    private final String kind;
    private final Registry registry;
    private final RegistryLookupPolicy policy;
    private final Set<String> reportedMisses = ConcurrentHashMap.newKeySet();

    public IdResolver(String kind, Registry registry, RegistryLookupPolicy policy) {
        this.kind = kind;
        this.registry = registry;
        this.policy = policy;
    }

    /**
     * Returns the id for {@code name}.
     *
     * @throws WireException {@code UNKNOWN_REGISTRY_ENTRY} under {@link RegistryLookupPolicy#STRICT}
     */
    public int resolve(String name) throws WireException {
        int id = registry.getId(name);
        if (id != Registry.MISSING_ID) {
            return id;
        }
        if (policy == RegistryLookupPolicy.STRICT) {
            throw new WireException(WireException.Kind.UNKNOWN_REGISTRY_ENTRY,
                    "Unknown " + kind + " '" + name + "'");
        }
        if (reportedMisses.add(name)) {
            ChunkWire.LOGGER.warn("Unknown {} '{}', sending id {}", kind, name, FALLBACK_ID);
        }
        return FALLBACK_ID;
    }

    public RegistryLookupPolicy policy() {
        return policy;
    }
}
