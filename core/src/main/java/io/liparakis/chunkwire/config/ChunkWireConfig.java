package io.liparakis.chunkwire.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.liparakis.chunkwire.ChunkWire;
import io.liparakis.chunkwire.light.LightMode;
import io.liparakis.chunkwire.registry.RegistryLookupPolicy;
import io.liparakis.chunkwire.section.BitPacker;
import io.liparakis.chunkwire.section.BitsPerEntryPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Settings of the chunk packet pipeline. Public fields are the config entries; Gson maps them
 * to and from JSON.
 */
public class ChunkWireConfig {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /** Classpath location of the bundled defaults. */
    public static final String DEFAULT_RESOURCE = "/chunkwire.json";

    /**
     * Ways of choosing bits per entry.
     */
    public enum BitsPolicyType {
        /** A fixed width from the config. */
        FIXED,
        /** {@code max(minimum, ceil(log2(paletteSize)))}. */
        LOG2,
        /** The client's own thresholds, including single-valued and direct layouts. */
        VANILLA
    }

    public BitsPolicyType blockStateBitsPolicy = BitsPolicyType.FIXED;
    public int fixedBlockStateBits = 15;
    public BitsPolicyType biomeBitsPolicy = BitsPolicyType.LOG2;
    public int fixedBiomeBits = 1;
    public int minimumBiomeBits = 1;
    public boolean strictRegistryLookup = false;
    public LightMode lightMode = LightMode.FULL_BRIGHT;

    /** Clamps field values after deserialization. */
    protected void validate() {
        if (blockStateBitsPolicy == null) {
            blockStateBitsPolicy = BitsPolicyType.FIXED;
        }
        if (biomeBitsPolicy == null) {
            biomeBitsPolicy = BitsPolicyType.LOG2;
        }
        if (lightMode == null) {
            lightMode = LightMode.FULL_BRIGHT;
        }
        fixedBlockStateBits = clamp(fixedBlockStateBits, BitPacker.MIN_BITS, BitPacker.MAX_BITS);
        fixedBiomeBits = clamp(fixedBiomeBits, BitPacker.MIN_BITS, BitPacker.MAX_BITS);
        minimumBiomeBits = clamp(minimumBiomeBits, BitPacker.MIN_BITS, BitPacker.MAX_BITS);
    }

    private static int clamp(int value, int min, int max) {
        return Math.min(Math.max(value, min), max);
    }

    /**
     * The bits-per-entry policy these settings describe.
     */
    public BitsPerEntryPolicy bitsPolicy() {
        return BitsPerEntryPolicy.perKind(
                policyFor(blockStateBitsPolicy, fixedBlockStateBits, 1),
                policyFor(biomeBitsPolicy, fixedBiomeBits, minimumBiomeBits));
    }

    private static BitsPerEntryPolicy policyFor(BitsPolicyType type, int fixedBits, int minimumBits) {
        if (type == BitsPolicyType.VANILLA) {
            return BitsPerEntryPolicy.vanilla();
        }
        if (type == BitsPolicyType.LOG2) {
            return BitsPerEntryPolicy.log2(minimumBits);
        }
        return BitsPerEntryPolicy.fixed(fixedBits);
    }

    public RegistryLookupPolicy registryLookupPolicy() {
        return strictRegistryLookup ? RegistryLookupPolicy.STRICT : RegistryLookupPolicy.FALLBACK_TO_ZERO;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Writes the settings to {@code path}, creating parent directories.
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(), StandardCharsets.UTF_8);
    }

    /**
     * Loads settings from {@code path}. A missing, empty or malformed file yields the bundled
     * defaults.
     */
    public static ChunkWireConfig load(Path path) {
        if (Files.isRegularFile(path)) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                ChunkWireConfig config = GSON.fromJson(reader, ChunkWireConfig.class);
                if (config != null) {
                    config.validate();
                    return config;
                }
                ChunkWire.LOGGER.warn("Config {} was empty or invalid, using defaults", path);
            } catch (IOException | JsonParseException e) {
                ChunkWire.LOGGER.error("Failed to read config {}, using defaults", path, e);
            }
        }
        return defaults();
    }

    /**
     * The settings bundled on the classpath, or built-in values if the resource is absent.
     */
    public static ChunkWireConfig defaults() {
        InputStream in = ChunkWireConfig.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (in != null) {
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                ChunkWireConfig config = GSON.fromJson(reader, ChunkWireConfig.class);
                if (config != null) {
                    config.validate();
                    return config;
                }
            } catch (IOException | JsonParseException e) {
                ChunkWire.LOGGER.error("Failed to read bundled config {}, using built-in values", DEFAULT_RESOURCE, e);
            }
        }
        ChunkWireConfig config = new ChunkWireConfig();
        config.validate();
        return config;
    }
}
