package io.certmanifest.state;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.certmanifest.exception.FilesystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes the JSON state file.
 *
 * <p>Format:
 * <pre>{@code
 * {
 *   "version" : 1,
 *   "certificates" : { "root" : "3f2a...", "leaf" : "9b1c..." },
 *   "revocationLists" : { "root" : "77d0..." }
 * }
 * }</pre>
 */
public class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    /** Current state file format version */
    static final int VERSION = 1;

    private final ObjectMapper objectMapper;

    public StateStore() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    /**
     * Load the state of the previous run.
     *
     * @param path state file
     * @return recorded state, empty if the file does not exist
     * @throws FilesystemException if the file exists but cannot be read or parsed
     */
    public ManifestState load(Path path) {
        if (!Files.exists(path)) {
            logger.debug("No state file at {}, starting from empty state", path);
            return ManifestState.empty();
        }

        try {
            String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
            Map<String, Object> data = objectMapper.readValue(content, new TypeReference<Map<String, Object>>() {});

            Object version = data.getOrDefault("version", 0);
            if (!(version instanceof Number) || ((Number) version).intValue() != VERSION) {
                throw new FilesystemException("Unsupported state file version: " + version, path);
            }

            ManifestState state = new ManifestState(
                stringMap(data.get("certificates"), path),
                stringMap(data.get("revocationLists"), path));
            logger.debug("Loaded state for {} certificates from {}", state.getCertificates().size(), path);
            return state;
        } catch (IOException e) {
            throw new FilesystemException("Failed to read state file " + path + ": " + e.getMessage(), path, e);
        }
    }

    /**
     * Replace the state file. Uses atomic write to prevent corruption.
     *
     * @param path state file
     * @param state state to persist
     * @throws FilesystemException if the file cannot be written
     */
    public void save(Path path, ManifestState state) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("version", VERSION);
        data.put("certificates", state.getCertificates());
        data.put("revocationLists", state.getRevocationLists());

        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
            Files.write(tempPath, objectMapper.writeValueAsBytes(data));
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Saved state for {} certificates to {}", state.getCertificates().size(), path);
        } catch (IOException e) {
            throw new FilesystemException("Failed to write state file " + path + ": " + e.getMessage(), path, e);
        }
    }

    private static Map<String, String> stringMap(Object value, Path path) {
        if (value == null) {
            return Collections.emptyMap();
        }
        if (!(value instanceof Map)) {
            throw new FilesystemException("Malformed state file " + path, path);
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            result.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
        }
        return result;
    }
}
