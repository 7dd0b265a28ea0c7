package io.certmanifest.config;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Generator configuration constants and defaults
 */
public final class GeneratorConfigConstants {
    
    private GeneratorConfigConstants() {
        // Utility class
    }
    
    // Default values
    public static final String DEFAULT_MANIFEST_PATH = "certs.yaml";
    public static final String DEFAULT_DESTINATION_DIR = ".";
    public static final String DEFAULT_STATE_FILE_NAME = "state.json";
    public static final StatePolicy DEFAULT_STATE_POLICY = StatePolicy.PRUNE;
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(8760);
    public static final Duration DEFAULT_CRL_VALIDITY = Duration.ofHours(168);
    
    // Environment variable names
    public static final String ENV_MANIFEST_PATH = "CERTMANIFEST_MANIFEST";
    public static final String ENV_DESTINATION_DIR = "CERTMANIFEST_DESTINATION";
    public static final String ENV_STATE_FILE = "CERTMANIFEST_STATE_FILE";
    public static final String ENV_STATE_POLICY = "CERTMANIFEST_STATE_POLICY";
    public static final String ENV_DEFAULT_LIFETIME = "CERTMANIFEST_DEFAULT_LIFETIME";
    public static final String ENV_CRL_VALIDITY = "CERTMANIFEST_CRL_VALIDITY";
    
    /**
     * Environment variable to config field mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;
    
    static {
        Map<String, String> map = new HashMap<>();
        map.put(ENV_MANIFEST_PATH, "manifestPath");
        map.put(ENV_DESTINATION_DIR, "destinationDir");
        map.put(ENV_STATE_FILE, "stateFile");
        map.put(ENV_STATE_POLICY, "statePolicy");
        map.put(ENV_DEFAULT_LIFETIME, "defaultLifetime");
        map.put(ENV_CRL_VALIDITY, "crlValidity");
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
}
