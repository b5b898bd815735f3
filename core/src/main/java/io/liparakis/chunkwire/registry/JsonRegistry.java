package io.liparakis.chunkwire.registry;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.liparakis.chunkwire.spi.Registry;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Immutable {@link Registry} read from a JSON object of {@code "name": id} pairs.
 * <p>
 * Loaded once at startup and shared read-only afterwards.
 */
public final class JsonRegistry implements Registry {
    private static final Gson GSON = new Gson();

    private final String name;
    private final Object2IntMap<String> nameToId;

    private JsonRegistry(String name, Object2IntMap<String> nameToId) {
        this.name = name;
        this.nameToId = nameToId;
    }

    /**
     * Builds a registry from an in-memory mapping.
     *
     * @throws IllegalArgumentException if an id is negative or used twice
     */
    public static JsonRegistry of(String name, Map<String, Integer> ids) {
        Object2IntOpenHashMap<String> map = new Object2IntOpenHashMap<>(ids.size());
        map.defaultReturnValue(MISSING_ID);

        IntOpenHashSet seen = new IntOpenHashSet(ids.size());
        for (Map.Entry<String, Integer> entry : ids.entrySet()) {
            Integer id = entry.getValue();
            if (id == null || id < 0) {
                throw new IllegalArgumentException(name + ": invalid id " + id + " for " + entry.getKey());
            }
            if (!seen.add((int) id)) {
                throw new IllegalArgumentException(name + ": id " + id + " assigned twice (again to "
                        + entry.getKey() + ")");
            }
            map.put(entry.getKey(), (int) id);
        }
        map.trim();
        return new JsonRegistry(name, Object2IntMaps.unmodifiable(map));
    }

    /**
     * Loads a registry from a JSON file.
     */
    public static JsonRegistry load(String name, Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(name, reader);
        }
    }

    /**
     * Loads a registry from a classpath resource.
     *
     * @throws IOException if the resource is missing or malformed
     */
    public static JsonRegistry loadResource(String name, String resource) throws IOException {
        InputStream in = JsonRegistry.class.getResourceAsStream(resource);
        if (in == null) {
            throw new IOException("Registry resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return read(name, reader);
        }
    }

    private static JsonRegistry read(String name, Reader reader) throws IOException {
        Map<String, Integer> ids;
        try {
            ids = GSON.fromJson(reader, new TypeToken<Map<String, Integer>>() {
            }.getType());
        } catch (JsonParseException e) {
            throw new IOException("Malformed " + name + " registry: " + e.getMessage(), e);
        }
        if (ids == null) {
            throw new IOException("Empty " + name + " registry");
        }
        return of(name, ids);
    }

    public String name() {
        return name;
    }

    @Override
    public int getId(String entry) {
        return nameToId.getInt(entry);
    }

    @Override
    public int size() {
        return nameToId.size();
    }

    @Override
    public String toString() {
        return "JsonRegistry[" + name + ", " + nameToId.size() + " entries]";
    }
}
