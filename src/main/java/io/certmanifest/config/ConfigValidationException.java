package io.certmanifest.config;

import io.certmanifest.exception.ErrorCode;
import io.certmanifest.exception.ValidationException;

/**
 * Configuration validation exception
 */
public class ConfigValidationException extends ValidationException {
    
    public ConfigValidationException(String message) {
        super(message, ErrorCode.CONFIG, null);
    }
    
    public ConfigValidationException(String message, String field) {
        super(message, ErrorCode.CONFIG, field);
    }

    public ConfigValidationException(String message, String field, Throwable cause) {
        super(message, ErrorCode.CONFIG, field, cause);
    }
}
