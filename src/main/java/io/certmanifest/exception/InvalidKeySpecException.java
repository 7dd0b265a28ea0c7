package io.certmanifest.exception;

/**
 * Unsupported key type / key size combination.
 */
public class InvalidKeySpecException extends ValidationException {

    public InvalidKeySpecException(String message) {
        super(message, ErrorCode.INVALID_KEY_SPEC, "key_size");
    }

    public InvalidKeySpecException(String message, String field) {
        super(message, ErrorCode.INVALID_KEY_SPEC, field);
    }
}
