package io.certmanifest.config;

import io.certmanifest.exception.CertManifestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader
 */
class ConfigLoaderTest {
    
    private ConfigLoader loader;
    
    @BeforeEach
    void setUp() {
        loader = new ConfigLoader();
    }
    
    @Nested
    @DisplayName("merge")
    class Merge {
        
        @Test
        @DisplayName("should merge multiple configurations with priority")
        void shouldMergeWithPriority() {
            Map<String, Object> base = new HashMap<>();
            base.put("destinationDir", "/base");
            base.put("manifestPath", "base.yaml");
            
            Map<String, Object> override = new HashMap<>();
            override.put("destinationDir", "/override");
            override.put("crlValidity", "24h");
            
            Map<String, Object> result = loader.merge(base, override);
            
            assertEquals("/override", result.get("destinationDir"));
            assertEquals("base.yaml", result.get("manifestPath"));
            assertEquals("24h", result.get("crlValidity"));
        }
        
        @Test
        @DisplayName("should not include null values from overrides")
        void shouldFilterNullValues() {
            Map<String, Object> base = new HashMap<>();
            base.put("destinationDir", "/base");
            
            Map<String, Object> override = new HashMap<>();
            override.put("destinationDir", null);
            
            Map<String, Object> result = loader.merge(base, override);
            
            assertEquals("/base", result.get("destinationDir"));
        }
    }
    
    @Nested
    @DisplayName("resolve")
    class Resolve {
        
        @Test
        @DisplayName("should apply default values")
        void shouldApplyDefaults() {
            GeneratorConfig config = loader.resolve(new HashMap<>());
            
            assertEquals(GeneratorConfigConstants.DEFAULT_MANIFEST_PATH, config.getManifestPath());
            assertEquals(GeneratorConfigConstants.DEFAULT_DESTINATION_DIR, config.getDestinationDir());
            assertNull(config.getStateFile());
            assertEquals(StatePolicy.PRUNE, config.getStatePolicy());
            assertEquals(Duration.ofHours(8760), config.getDefaultLifetime());
            assertEquals(Duration.ofHours(168), config.getCrlValidity());
        }
        
        @Test
        @DisplayName("should parse durations and state policy from strings")
        void shouldParseStrings() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("crlValidity", "24h");
            configMap.put("defaultLifetime", "1h30m");
            configMap.put("statePolicy", "retain");
            
            GeneratorConfig config = loader.resolve(configMap);
            
            assertEquals(Duration.ofHours(24), config.getCrlValidity());
            assertEquals(Duration.ofMinutes(90), config.getDefaultLifetime());
            assertEquals(StatePolicy.RETAIN, config.getStatePolicy());
        }
        
        @Test
        @DisplayName("should accept StatePolicy values directly")
        void shouldAcceptEnumValues() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("statePolicy", StatePolicy.RETAIN);
            
            assertEquals(StatePolicy.RETAIN, loader.resolve(configMap).getStatePolicy());
        }
        
        @Test
        @DisplayName("should reject an unparseable duration")
        void shouldRejectInvalidDuration() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("crlValidity", "one week");
            
            ConfigValidationException e = assertThrows(ConfigValidationException.class,
                () -> loader.resolve(configMap));
            assertEquals("crlValidity", e.getField());
        }
        
        @Test
        @DisplayName("should reject an unknown state policy")
        void shouldRejectUnknownPolicy() {
            Map<String, Object> configMap = new HashMap<>();
            configMap.put("statePolicy", "forget");
            
            assertThrows(ConfigValidationException.class, () -> loader.resolve(configMap));
        }
    }
    
    @Nested
    @DisplayName("fromEnvironment")
    class FromEnvironment {
        
        @Test
        @DisplayName("should map CERTMANIFEST_ variables to config keys")
        void shouldMapVariables() {
            Map<String, String> env = new HashMap<>();
            env.put(GeneratorConfigConstants.ENV_DESTINATION_DIR, "/out");
            env.put(GeneratorConfigConstants.ENV_STATE_POLICY, "retain");
            env.put(GeneratorConfigConstants.ENV_CRL_VALIDITY, "");
            env.put("UNRELATED", "x");
            
            Map<String, Object> result = loader.fromEnvironment(env);
            
            assertEquals(2, result.size());
            assertEquals("/out", result.get("destinationDir"));
            assertEquals("retain", result.get("statePolicy"));
        }
    }
    
    @Nested
    @DisplayName("fromFile")
    class FromFile {
        
        @TempDir
        Path tempDir;
        
        @Test
        @DisplayName("should load configuration from JSON file")
        void shouldLoadFromJsonFile() throws IOException {
            String json = """
                {
                    "manifestPath": "/etc/pki/certs.yaml",
                    "destinationDir": "/var/lib/pki",
                    "crlValidity": "48h"
                }
                """;
            
            Path configFile = tempDir.resolve("config.json");
            Files.writeString(configFile, json);
            
            Map<String, Object> result = loader.fromFile(configFile.toString());
            
            assertEquals(Path.of("/etc/pki/certs.yaml").toString(), result.get("manifestPath"));
            assertEquals("48h", result.get("crlValidity"));
        }
        
        @Test
        @DisplayName("should resolve relative paths against the config file directory")
        void shouldResolveRelativePaths() throws IOException {
            Path configFile = tempDir.resolve("config.json");
            Files.writeString(configFile, "{\"manifestPath\": \"certs.yaml\", \"destinationDir\": \"out\"}");
            
            Map<String, Object> result = loader.fromFile(configFile.toString());
            
            assertEquals(tempDir.toAbsolutePath().resolve("certs.yaml").toString(), result.get("manifestPath"));
            assertEquals(tempDir.toAbsolutePath().resolve("out").toString(), result.get("destinationDir"));
        }
        
        @Test
        @DisplayName("should throw for missing file")
        void shouldThrowForMissingFile() {
            assertThrows(CertManifestException.class, () -> {
                loader.fromFile("/nonexistent/path.json");
            });
        }
        
        @Test
        @DisplayName("should throw for invalid JSON")
        void shouldThrowForInvalidJson() throws IOException {
            Path configFile = tempDir.resolve("broken.json");
            Files.writeString(configFile, "{ not json");
            
            CertManifestException e = assertThrows(CertManifestException.class,
                () -> loader.fromFile(configFile.toString()));
            assertEquals("CONFIG01", e.getCode());
        }
    }
    
    @Nested
    @DisplayName("load")
    class Load {
        
        @TempDir
        Path tempDir;
        
        @Test
        @DisplayName("programmatic values should override the file")
        void programmaticShouldOverrideFile() throws IOException {
            Path configFile = tempDir.resolve("config.json");
            Files.writeString(configFile, "{\"destinationDir\": \"/from-file\", \"statePolicy\": \"retain\"}");
            
            Map<String, Object> overrides = new HashMap<>();
            overrides.put("destinationDir", "/from-cli");
            
            GeneratorConfig config = loader.load(configFile.toString(), false, overrides);
            
            assertEquals("/from-cli", config.getDestinationDir());
            assertEquals(StatePolicy.RETAIN, config.getStatePolicy());
        }
    }
}
