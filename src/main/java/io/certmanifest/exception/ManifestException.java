package io.certmanifest.exception;

/**
 * Malformed manifest: unknown field, wrong value type, missing subject or
 * duplicate filename.
 */
public class ManifestException extends ValidationException {

    public ManifestException(String message) {
        super(message, ErrorCode.MANIFEST, null);
    }

    public ManifestException(String message, String field) {
        super(message, ErrorCode.MANIFEST, field);
    }

    public ManifestException(String message, String field, Throwable cause) {
        super(message, ErrorCode.MANIFEST, field, cause);
    }
}
