package io.certmanifest.exception;

/**
 * Key generation, signing or encoding failure. Never retried.
 */
public class CryptoException extends CertManifestException {

    public CryptoException(String message) {
        super(message, ErrorCode.CRYPTO);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, ErrorCode.CRYPTO, cause);
    }
}
