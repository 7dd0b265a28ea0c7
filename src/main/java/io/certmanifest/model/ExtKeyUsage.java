package io.certmanifest.model;

import io.certmanifest.exception.ManifestException;

/**
 * Named extended key usages and their object identifiers
 */
public enum ExtKeyUsage {
    ANY("Any", "2.5.29.37.0"),
    SERVER_AUTH("ServerAuth", "1.3.6.1.5.5.7.3.1"),
    CLIENT_AUTH("ClientAuth", "1.3.6.1.5.5.7.3.2"),
    CODE_SIGNING("CodeSigning", "1.3.6.1.5.5.7.3.3"),
    EMAIL_PROTECTION("EmailProtection", "1.3.6.1.5.5.7.3.4"),
    IPSEC_END_SYSTEM("IPSECEndSystem", "1.3.6.1.5.5.7.3.5"),
    IPSEC_TUNNEL("IPSECTunnel", "1.3.6.1.5.5.7.3.6"),
    IPSEC_USER("IPSECUser", "1.3.6.1.5.5.7.3.7"),
    TIME_STAMPING("TimeStamping", "1.3.6.1.5.5.7.3.8"),
    OCSP_SIGNING("OCSPSigning", "1.3.6.1.5.5.7.3.9"),
    MICROSOFT_SERVER_GATED_CRYPTO("MicrosoftServerGatedCrypto", "1.3.6.1.4.1.311.10.3.3"),
    NETSCAPE_SERVER_GATED_CRYPTO("NetscapeServerGatedCrypto", "2.16.840.1.113730.4.1"),
    MICROSOFT_COMMERCIAL_CODE_SIGNING("MicrosoftCommercialCodeSigning", "1.3.6.1.4.1.311.2.1.22"),
    MICROSOFT_KERNEL_CODE_SIGNING("MicrosoftKernelCodeSigning", "1.3.6.1.4.1.311.61.1.1");

    private final String name;
    private final String oid;

    ExtKeyUsage(String name, String oid) {
        this.name = name;
        this.oid = oid;
    }

    public String getName() {
        return name;
    }

    public String getOid() {
        return oid;
    }

    public static ExtKeyUsage fromName(String name) {
        for (ExtKeyUsage usage : values()) {
            if (usage.name.equalsIgnoreCase(name)) {
                return usage;
            }
        }
        throw new ManifestException("Unknown extended key usage: " + name, "ext_key_usages");
    }
}
