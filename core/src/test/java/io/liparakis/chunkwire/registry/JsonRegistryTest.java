package io.liparakis.chunkwire.registry;

import io.liparakis.chunkwire.spi.Registry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JsonRegistry} and {@link Registries}.
 */
class JsonRegistryTest {

    @TempDir
    Path tempDir;

    // ========== of Tests ==========

    @Test
    void of_lookupsKnownAndMissingNames() {
        JsonRegistry registry = JsonRegistry.of("blocks", Map.of("minecraft:air", 0, "minecraft:stone", 1));

        assertThat(registry.getId("minecraft:stone")).isEqualTo(1);
        assertThat(registry.getId("minecraft:dirt")).isEqualTo(Registry.MISSING_ID);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.name()).isEqualTo("blocks");
        assertThat(registry).hasToString("JsonRegistry[blocks, 2 entries]");
    }

    @Test
    void of_negativeId_throws() {
        assertThatThrownBy(() -> JsonRegistry.of("blocks", Map.of("minecraft:air", -1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid id -1");
    }

    @Test
    void of_nullId_throws() {
        Map<String, Integer> ids = new HashMap<>();
        ids.put("minecraft:air", null);

        assertThatThrownBy(() -> JsonRegistry.of("blocks", ids))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_duplicateId_throws() {
        assertThatThrownBy(() -> JsonRegistry.of("blocks", Map.of("a", 3, "b", 3)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("assigned twice");
    }

    @Test
    void of_copiesInput() {
        Map<String, Integer> ids = new HashMap<>();
        ids.put("a", 0);
        JsonRegistry registry = JsonRegistry.of("blocks", ids);

        ids.put("b", 1);

        assertThat(registry.getId("b")).isEqualTo(Registry.MISSING_ID);
    }

    // ========== load Tests ==========

    @Test
    void load_readsJsonFile() throws IOException {
        Path file = tempDir.resolve("biomes.json");
        Files.writeString(file, "{\"minecraft:plains\": 1, \"minecraft:desert\": 2}");

        JsonRegistry registry = JsonRegistry.load("biomes", file);

        assertThat(registry.getId("minecraft:desert")).isEqualTo(2);
    }

    @Test
    void load_malformedJson_throwsIOException() throws IOException {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"minecraft:plains\": ");

        assertThatThrownBy(() -> JsonRegistry.load("biomes", file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Malformed biomes registry");
    }

    @Test
    void load_emptyFile_throwsIOException() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "");

        assertThatThrownBy(() -> JsonRegistry.load("biomes", file))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Empty biomes registry");
    }

    @Test
    void loadResource_missing_throwsIOException() {
        assertThatThrownBy(() -> JsonRegistry.loadResource("blocks", "/registries/nope.json"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    // ========== Registries Tests ==========

    @Test
    void loadDefault_readsBundledRegistries() throws IOException {
        Registries registries = Registries.loadDefault();

        assertThat(registries.blockStates().getId("minecraft:air")).isZero();
        assertThat(registries.blockStates().getId("minecraft:stone")).isEqualTo(1);
        assertThat(registries.biomes().getId("minecraft:plains")).isEqualTo(1);
    }
}
