package io.certmanifest.exception;

/**
 * Issuer reference that does not name a certificate declared earlier in the manifest.
 */
public class UnresolvedIssuerException extends ValidationException {
    private final String subject;
    private final String issuer;

    public UnresolvedIssuerException(String subject, String issuer) {
        super(String.format("Issuer '%s' of '%s' not found among previously declared certificates", issuer, subject),
            ErrorCode.UNRESOLVED_ISSUER, "issuer");
        this.subject = subject;
        this.issuer = issuer;
    }

    public String getSubject() {
        return subject;
    }

    public String getIssuer() {
        return issuer;
    }
}
