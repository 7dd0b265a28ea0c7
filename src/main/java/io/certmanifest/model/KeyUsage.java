package io.certmanifest.model;

import io.certmanifest.exception.ManifestException;

/**
 * Named key-usage flags and their X.509 bit values
 */
public enum KeyUsage {
    DIGITAL_SIGNATURE("DigitalSignature", org.bouncycastle.asn1.x509.KeyUsage.digitalSignature),
    CONTENT_COMMITMENT("ContentCommitment", org.bouncycastle.asn1.x509.KeyUsage.nonRepudiation),
    KEY_ENCIPHERMENT("KeyEncipherment", org.bouncycastle.asn1.x509.KeyUsage.keyEncipherment),
    DATA_ENCIPHERMENT("DataEncipherment", org.bouncycastle.asn1.x509.KeyUsage.dataEncipherment),
    KEY_AGREEMENT("KeyAgreement", org.bouncycastle.asn1.x509.KeyUsage.keyAgreement),
    CERT_SIGN("CertSign", org.bouncycastle.asn1.x509.KeyUsage.keyCertSign),
    CRL_SIGN("CRLSign", org.bouncycastle.asn1.x509.KeyUsage.cRLSign),
    ENCIPHER_ONLY("EncipherOnly", org.bouncycastle.asn1.x509.KeyUsage.encipherOnly),
    DECIPHER_ONLY("DecipherOnly", org.bouncycastle.asn1.x509.KeyUsage.decipherOnly);

    private final String name;
    private final int bit;

    KeyUsage(String name, int bit) {
        this.name = name;
        this.bit = bit;
    }

    /**
     * Name used in the manifest.
     */
    public String getName() {
        return name;
    }

    public int getBit() {
        return bit;
    }

    public static KeyUsage fromName(String name) {
        for (KeyUsage usage : values()) {
            if (usage.name.equalsIgnoreCase(name)) {
                return usage;
            }
        }
        throw new ManifestException("Unknown key usage: " + name, "key_usages");
    }
}
