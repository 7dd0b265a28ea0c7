package io.certmanifest.exception;

/**
 * Error codes reported by a generation run
 */
public enum ErrorCode {
    MANIFEST("MANIFEST01"),
    UNRESOLVED_ISSUER("ISSUER01"),
    INVALID_KEY_SPEC("KEY01"),
    INVALID_SAN("SAN01"),
    FILESYSTEM("FS01"),
    CRYPTO("CRYPTO01"),
    REVOCATION("CRL01"),
    CONFIG("CONFIG01");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
