package io.liparakis.chunkwire.core;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * A block-state palette entry: a namespaced block name plus optional property values.
 *
 * @param name       block name, e.g. {@code minecraft:oak_log}
 * @param properties property values, e.g. {@code axis=y}; empty for blocks without any
 */
public record BlockState(String name, Map<String, String> properties) {

    public static final BlockState AIR = of("minecraft:air");

    public BlockState {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Block state name must not be empty");
        }
        properties = Map.copyOf(properties);
    }

    public static BlockState of(String name) {
        return new BlockState(name, Map.of());
    }

    public static BlockState of(String name, Map<String, String> properties) {
        return new BlockState(name, properties);
    }

    @Override
    public String toString() {
        if (properties.isEmpty()) {
            return name;
        }
        return properties.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(",", name + "[", "]"));
    }
}
