package io.certmanifest.exception;

/**
 * Revocation requested for a certificate that has no issuing authority able to sign a CRL.
 */
public class RevocationException extends ValidationException {

    public RevocationException(String message) {
        super(message, ErrorCode.REVOCATION, "revoked");
    }
}
