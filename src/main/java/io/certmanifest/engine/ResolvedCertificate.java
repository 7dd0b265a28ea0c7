package io.certmanifest.engine;

import io.certmanifest.crypto.CertificateMaterial;
import io.certmanifest.model.CertificateDescriptor;

/**
 * A descriptor bound to its issuer for the duration of one run.
 *
 * <p>The fingerprint and decision are assigned once by {@link FingerprintEngine}; key material
 * is attached when the certificate is generated, or loaded from disk when a descendant or a
 * revocation list needs it.
 */
public class ResolvedCertificate {
    private final CertificateDescriptor descriptor;
    private final ResolvedCertificate issuer;

    private String fingerprint;
    private Decision decision;
    private CertificateMaterial material;

    ResolvedCertificate(CertificateDescriptor descriptor, ResolvedCertificate issuer) {
        this.descriptor = descriptor;
        this.issuer = issuer;
    }

    public CertificateDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * @return the issuing entry, or null when self-signed
     */
    public ResolvedCertificate getIssuer() {
        return issuer;
    }

    public boolean isSelfSigned() {
        return issuer == null;
    }

    public String getFilename() {
        return descriptor.getFilename();
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public Decision getDecision() {
        return decision;
    }

    public boolean isRegenerated() {
        return decision == Decision.REGENERATE;
    }

    public CertificateMaterial getMaterial() {
        return material;
    }

    void assign(String fingerprint, Decision decision) {
        if (this.fingerprint != null) {
            throw new IllegalStateException("Fingerprint of " + getFilename() + " already assigned");
        }
        this.fingerprint = fingerprint;
        this.decision = decision;
    }

    void attachMaterial(CertificateMaterial material) {
        this.material = material;
    }

    @Override
    public String toString() {
        return "ResolvedCertificate{" +
               "filename='" + getFilename() + '\'' +
               ", issuer=" + (issuer != null ? issuer.getFilename() : "<self>") +
               ", decision=" + decision +
               '}';
    }
}
