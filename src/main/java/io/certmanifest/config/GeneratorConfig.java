package io.certmanifest.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Objects;

/**
 * Generator configuration.
 * Use the Builder pattern to construct instances
 */
public class GeneratorConfig {
    
    private final String manifestPath;
    private final String destinationDir;
    private final String stateFile;
    private final StatePolicy statePolicy;
    private final Duration defaultLifetime;
    private final Duration crlValidity;
    
    private GeneratorConfig(Builder builder) {
        this.manifestPath = builder.manifestPath;
        this.destinationDir = builder.destinationDir;
        this.stateFile = builder.stateFile;
        this.statePolicy = builder.statePolicy;
        this.defaultLifetime = builder.defaultLifetime;
        this.crlValidity = builder.crlValidity;
    }
    
    // Getters
    
    public String getManifestPath() {
        return manifestPath;
    }
    
    public String getDestinationDir() {
        return destinationDir;
    }
    
    /**
     * @return the configured state file, or null to use {@code state.json} in the destination
     */
    public String getStateFile() {
        return stateFile;
    }
    
    public StatePolicy getStatePolicy() {
        return statePolicy;
    }
    
    public Duration getDefaultLifetime() {
        return defaultLifetime;
    }
    
    public Duration getCrlValidity() {
        return crlValidity;
    }
    
    /**
     * Resolve the state file location
     * 
     * @return the configured state file, else {@code state.json} inside the destination directory
     */
    public Path resolveStateFile() {
        if (stateFile != null && !stateFile.isEmpty()) {
            return Paths.get(stateFile);
        }
        return Paths.get(destinationDir).resolve(GeneratorConfigConstants.DEFAULT_STATE_FILE_NAME);
    }
    
    /**
     * Create a new Builder instance
     * 
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * Create a Builder initialized with this config's values
     * 
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .manifestPath(this.manifestPath)
            .destinationDir(this.destinationDir)
            .stateFile(this.stateFile)
            .statePolicy(this.statePolicy)
            .defaultLifetime(this.defaultLifetime)
            .crlValidity(this.crlValidity);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GeneratorConfig that = (GeneratorConfig) o;
        return Objects.equals(manifestPath, that.manifestPath) &&
               Objects.equals(destinationDir, that.destinationDir) &&
               Objects.equals(stateFile, that.stateFile) &&
               statePolicy == that.statePolicy &&
               Objects.equals(defaultLifetime, that.defaultLifetime) &&
               Objects.equals(crlValidity, that.crlValidity);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(manifestPath, destinationDir, stateFile, statePolicy, defaultLifetime, crlValidity);
    }
    
    @Override
    public String toString() {
        return "GeneratorConfig{" +
               "manifestPath='" + manifestPath + '\'' +
               ", destinationDir='" + destinationDir + '\'' +
               ", stateFile='" + stateFile + '\'' +
               ", statePolicy=" + statePolicy +
               ", defaultLifetime=" + defaultLifetime +
               ", crlValidity=" + crlValidity +
               '}';
    }
    
    /**
     * Builder for GeneratorConfig
     */
    public static class Builder {
        private String manifestPath = GeneratorConfigConstants.DEFAULT_MANIFEST_PATH;
        private String destinationDir = GeneratorConfigConstants.DEFAULT_DESTINATION_DIR;
        private String stateFile;
        private StatePolicy statePolicy = GeneratorConfigConstants.DEFAULT_STATE_POLICY;
        private Duration defaultLifetime = GeneratorConfigConstants.DEFAULT_LIFETIME;
        private Duration crlValidity = GeneratorConfigConstants.DEFAULT_CRL_VALIDITY;
        
        public Builder manifestPath(String manifestPath) {
            this.manifestPath = manifestPath;
            return this;
        }
        
        public Builder destinationDir(String destinationDir) {
            this.destinationDir = destinationDir;
            return this;
        }
        
        public Builder stateFile(String stateFile) {
            this.stateFile = stateFile;
            return this;
        }
        
        public Builder statePolicy(StatePolicy statePolicy) {
            this.statePolicy = statePolicy;
            return this;
        }
        
        public Builder defaultLifetime(Duration defaultLifetime) {
            this.defaultLifetime = defaultLifetime;
            return this;
        }
        
        public Builder crlValidity(Duration crlValidity) {
            this.crlValidity = crlValidity;
            return this;
        }
        
        /**
         * Build and validate the GeneratorConfig
         * 
         * @return the validated GeneratorConfig
         * @throws ConfigValidationException if validation fails
         */
        public GeneratorConfig build() {
            GeneratorConfig config = new GeneratorConfig(this);
            ConfigValidator validator = new ConfigValidator();
            validator.validateOrThrow(config);
            return config;
        }
        
        /**
         * Build without validation
         * 
         * @return the GeneratorConfig (unvalidated)
         */
        public GeneratorConfig buildUnchecked() {
            return new GeneratorConfig(this);
        }
    }
}
