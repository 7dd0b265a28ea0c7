package io.certmanifest.exception;

/**
 * Validation exception class
 */
public class ValidationException extends CertManifestException {
    private final String field;

    public ValidationException(String message) {
        this(message, ErrorCode.MANIFEST, null);
    }

    public ValidationException(String message, String field) {
        this(message, ErrorCode.MANIFEST, field);
    }
    
    public ValidationException(String message, ErrorCode errorCode, String field) {
        this(message, errorCode, field, null);
    }

    public ValidationException(String message, ErrorCode errorCode, String field, Throwable cause) {
        super(message, errorCode, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
