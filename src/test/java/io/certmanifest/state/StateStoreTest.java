package io.certmanifest.state;

import io.certmanifest.exception.FilesystemException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StateStore
 */
class StateStoreTest {

    @TempDir
    Path tempDir;

    private StateStore store;

    @BeforeEach
    void setUp() {
        store = new StateStore();
    }

    @Test
    @DisplayName("a missing state file should load as empty state")
    void missingFileIsEmpty() {
        ManifestState state = store.load(tempDir.resolve("state.json"));

        assertTrue(state.isEmpty());
    }

    @Test
    @DisplayName("should persist and reload fingerprints")
    void shouldPersistAndReload() {
        Path file = tempDir.resolve("nested/state.json");
        ManifestState state = new ManifestState(
            Map.of("root", "aa", "leaf", "bb"),
            Map.of("root", "cc"));

        store.save(file, state);
        ManifestState loaded = store.load(file);

        assertEquals(state, loaded);
        assertEquals("bb", loaded.getCertificateFingerprint("leaf"));
        assertEquals("cc", loaded.getRevocationListFingerprint("root"));
        assertNull(loaded.getCertificateFingerprint("other"));
    }

    @Test
    @DisplayName("should write sorted keys so equal state gives identical bytes")
    void shouldWriteStableOutput() throws IOException {
        Path first = tempDir.resolve("a.json");
        Path second = tempDir.resolve("b.json");

        store.save(first, new ManifestState(Map.of("b", "2", "a", "1"), Map.of()));
        store.save(second, new ManifestState(Map.of("a", "1", "b", "2"), Map.of()));

        String content = Files.readString(first);
        assertEquals(content, Files.readString(second));
        assertTrue(content.indexOf("\"a\"") < content.indexOf("\"b\""));
        assertTrue(content.contains("\"version\" : 1"));
    }

    @Test
    @DisplayName("should reject malformed state")
    void shouldRejectMalformed() throws IOException {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "[1, 2, 3]");

        assertThrows(FilesystemException.class, () -> store.load(file));

        Files.writeString(file, "{\"version\": 1, \"certificates\": \"oops\"}");
        assertThrows(FilesystemException.class, () -> store.load(file));
    }

    @Test
    @DisplayName("should reject an unknown version")
    void shouldRejectUnknownVersion() throws IOException {
        Path file = tempDir.resolve("state.json");
        Files.writeString(file, "{\"version\": 99, \"certificates\": {}}");

        assertThrows(FilesystemException.class, () -> store.load(file));
    }
}
