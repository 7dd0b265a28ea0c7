package io.certmanifest.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.certmanifest.exception.CertManifestException;
import io.certmanifest.exception.ErrorCode;
import io.certmanifest.manifest.DurationParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generator configuration loader.
 * Provides multiple ways to load and merge configuration
 */
public class ConfigLoader {
    
    private static final List<String> PATH_KEYS = Arrays.asList("manifestPath", "destinationDir", "stateFile");
    
    private final ObjectMapper objectMapper;
    
    public ConfigLoader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }
    
    /**
     * Load configuration from a JSON file. Relative paths in the file are resolved
     * against the file's directory.
     * 
     * @param path path to JSON configuration file
     * @return configuration map
     * @throws CertManifestException if file not found or invalid JSON
     */
    public Map<String, Object> fromFile(String path) {
        Path filePath = Paths.get(path).toAbsolutePath();
        
        if (!Files.exists(filePath)) {
            throw new CertManifestException("Configuration file not found: " + filePath, ErrorCode.CONFIG);
        }
        
        try {
            Map<String, Object> config = objectMapper.readValue(filePath.toFile(),
                new TypeReference<Map<String, Object>>() { });
            return processPaths(config, filePath.getParent());
        } catch (IOException e) {
            throw new CertManifestException("Invalid JSON in configuration file: " + filePath, ErrorCode.CONFIG, e);
        }
    }
    
    /**
     * Load configuration from environment variables
     * 
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment() {
        return fromEnvironment(System.getenv());
    }
    
    /**
     * Load configuration from a map of environment variables
     * 
     * @param environment variable name to value
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment(Map<String, String> environment) {
        Map<String, Object> config = new HashMap<>();
        
        for (Map.Entry<String, String> entry : GeneratorConfigConstants.ENV_VAR_MAPPING.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                config.put(entry.getValue(), value);
            }
        }
        
        return config;
    }
    
    /**
     * Merge multiple configuration sources
     * Priority: later sources override earlier sources
     * 
     * @param sources configuration maps in order of increasing priority
     * @return merged configuration
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();
        
        for (Map<String, Object> source : sources) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }
        
        return merged;
    }
    
    /**
     * Resolve configuration map to GeneratorConfig object
     * 
     * @param configMap configuration map
     * @return resolved and validated GeneratorConfig
     * @throws ConfigValidationException if a value cannot be converted or is out of range
     */
    public GeneratorConfig resolve(Map<String, Object> configMap) {
        GeneratorConfig.Builder builder = GeneratorConfig.builder();
        
        if (configMap.containsKey("manifestPath")) {
            builder.manifestPath(String.valueOf(configMap.get("manifestPath")));
        }
        if (configMap.containsKey("destinationDir")) {
            builder.destinationDir(String.valueOf(configMap.get("destinationDir")));
        }
        if (configMap.containsKey("stateFile")) {
            builder.stateFile(String.valueOf(configMap.get("stateFile")));
        }
        if (configMap.containsKey("statePolicy")) {
            Object policy = configMap.get("statePolicy");
            if (policy instanceof StatePolicy) {
                builder.statePolicy((StatePolicy) policy);
            } else {
                try {
                    builder.statePolicy(StatePolicy.fromString(String.valueOf(policy)));
                } catch (IllegalArgumentException e) {
                    throw new ConfigValidationException(e.getMessage(), "statePolicy", e);
                }
            }
        }
        if (configMap.containsKey("defaultLifetime")) {
            builder.defaultLifetime(toDuration("defaultLifetime", configMap.get("defaultLifetime")));
        }
        if (configMap.containsKey("crlValidity")) {
            builder.crlValidity(toDuration("crlValidity", configMap.get("crlValidity")));
        }
        
        return builder.build();
    }
    
    /**
     * Load, merge, and resolve configuration from multiple sources
     * 
     * @param filePath path to JSON configuration file (optional, null to skip)
     * @param loadEnv whether to load from environment variables
     * @param programmaticConfig programmatic configuration (optional, null to skip)
     * @return resolved GeneratorConfig
     */
    public GeneratorConfig load(String filePath, boolean loadEnv, Map<String, Object> programmaticConfig) {
        Map<String, Object> fileConfig = filePath != null ? fromFile(filePath) : new HashMap<>();
        Map<String, Object> envConfig = loadEnv ? fromEnvironment() : new HashMap<>();
        Map<String, Object> progConfig = programmaticConfig != null ? programmaticConfig : new HashMap<>();
        
        Map<String, Object> merged = merge(fileConfig, envConfig, progConfig);
        return resolve(merged);
    }
    
    private Map<String, Object> processPaths(Map<String, Object> config, Path basePath) {
        Map<String, Object> processed = new HashMap<>(config);
        
        for (String key : PATH_KEYS) {
            Object value = processed.get(key);
            if (value instanceof String && !Paths.get((String) value).isAbsolute()) {
                processed.put(key, basePath.resolve((String) value).normalize().toString());
            }
        }
        
        return processed;
    }
    
    private Duration toDuration(String field, Object value) {
        if (value instanceof Duration) {
            return (Duration) value;
        }
        try {
            return DurationParser.parse(String.valueOf(value));
        } catch (IllegalArgumentException e) {
            throw new ConfigValidationException(field + ": " + e.getMessage(), field, e);
        }
    }
}
