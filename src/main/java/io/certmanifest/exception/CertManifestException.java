package io.certmanifest.exception;

/**
 * Base certmanifest exception class
 * 
 * This is an unchecked exception (RuntimeException) so a generation run can abort
 * from any depth while still carrying a stable error code for the caller.
 */
public class CertManifestException extends RuntimeException {
    private final String code;

    public CertManifestException(String message) {
        this(message, (String) null, null);
    }

    public CertManifestException(String message, String code) {
        this(message, code, null);
    }

    public CertManifestException(String message, ErrorCode errorCode) {
        this(message, errorCode.getCode(), null);
    }

    public CertManifestException(String message, ErrorCode errorCode, Throwable cause) {
        this(message, errorCode.getCode(), cause);
    }

    public CertManifestException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
