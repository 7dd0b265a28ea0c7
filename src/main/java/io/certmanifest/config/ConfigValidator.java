package io.certmanifest.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Generator configuration validator
 */
public class ConfigValidator {
    
    /**
     * Validation error detail
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final Object value;
        
        public ValidationError(String field, String message) {
            this(field, message, null);
        }
        
        public ValidationError(String field, String message, Object value) {
            this.field = field;
            this.message = message;
            this.value = value;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getValue() { return value; }
        
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
    
    /**
     * Validation result
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        
        public ValidationResult(boolean valid, List<ValidationError> errors) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
        }
        
        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
    }
    
    /**
     * Validate the configuration
     * 
     * @param config the configuration to validate
     * @return the validation result
     */
    public ValidationResult validate(GeneratorConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateRequired(config, errors);
        validateDurations(config, errors);
        
        return new ValidationResult(errors.isEmpty(), errors);
    }
    
    /**
     * Validate and throw exception if invalid
     * 
     * @param config the configuration to validate
     * @throws ConfigValidationException if validation fails
     */
    public void validateOrThrow(GeneratorConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            StringBuilder sb = new StringBuilder("Configuration validation failed: ");
            List<ValidationError> errors = result.getErrors();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) sb.append("; ");
                sb.append(errors.get(i));
            }
            throw new ConfigValidationException(sb.toString(), errors.get(0).getField());
        }
    }
    
    private void validateRequired(GeneratorConfig config, List<ValidationError> errors) {
        if (isNullOrEmpty(config.getManifestPath())) {
            errors.add(new ValidationError("manifestPath", "manifestPath is required"));
        }
        if (isNullOrEmpty(config.getDestinationDir())) {
            errors.add(new ValidationError("destinationDir", "destinationDir is required"));
        }
        if (config.getStateFile() != null && config.getStateFile().trim().isEmpty()) {
            errors.add(new ValidationError("stateFile", "stateFile must not be blank"));
        }
        if (config.getStatePolicy() == null) {
            errors.add(new ValidationError("statePolicy", "statePolicy is required"));
        }
    }
    
    private void validateDurations(GeneratorConfig config, List<ValidationError> errors) {
        validatePositive("defaultLifetime", config.getDefaultLifetime(), errors);
        validatePositive("crlValidity", config.getCrlValidity(), errors);
    }
    
    private void validatePositive(String field, Duration value, List<ValidationError> errors) {
        if (value == null) {
            errors.add(new ValidationError(field, field + " is required"));
        } else if (value.isZero() || value.isNegative()) {
            errors.add(new ValidationError(field, field + " must be a positive duration", value));
        }
    }
    
    private boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
