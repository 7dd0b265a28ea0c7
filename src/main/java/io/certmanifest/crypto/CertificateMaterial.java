package io.certmanifest.crypto;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * A signed certificate together with its key pair
 */
public class CertificateMaterial {
    private final X509Certificate certificate;
    private final KeyPair keyPair;

    public CertificateMaterial(X509Certificate certificate, KeyPair keyPair) {
        this.certificate = certificate;
        this.keyPair = keyPair;
    }

    public CertificateMaterial(X509Certificate certificate, PrivateKey privateKey) {
        this(certificate, new KeyPair(certificate.getPublicKey(), privateKey));
    }

    public X509Certificate getCertificate() {
        return certificate;
    }

    public KeyPair getKeyPair() {
        return keyPair;
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }
}
