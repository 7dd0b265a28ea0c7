package io.certmanifest.model;

import io.certmanifest.exception.InvalidKeySpecException;
import io.certmanifest.exception.ManifestException;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One normalized certificate specification from the manifest.
 *
 * <p>Instances are immutable. {@link Builder#build()} applies the defaults:
 * <ul>
 *   <li>key type {@code EC}, key size per algorithm</li>
 *   <li>CA flag true for self-signed entries, false otherwise</li>
 *   <li>key usages {CertSign, CRLSign} for CAs and {KeyEncipherment, DigitalSignature} otherwise</li>
 *   <li>filename taken from the subject's common name</li>
 * </ul>
 */
public class CertificateDescriptor {

    public static final Set<KeyUsage> CA_KEY_USAGES =
        Collections.unmodifiableSet(EnumSet.of(KeyUsage.CERT_SIGN, KeyUsage.CRL_SIGN));
    public static final Set<KeyUsage> END_ENTITY_KEY_USAGES =
        Collections.unmodifiableSet(EnumSet.of(KeyUsage.KEY_ENCIPHERMENT, KeyUsage.DIGITAL_SIGNATURE));

    private final String subject;
    private final List<SubjectAltName> sans;
    private final KeyType keyType;
    private final int keySize;
    private final Duration expires;
    private final Instant notBefore;
    private final Instant notAfter;
    private final Set<KeyUsage> keyUsages;
    private final List<ExtKeyUsage> extKeyUsages;
    private final String issuer;
    private final String filename;
    private final boolean ca;
    private final BigInteger serial;
    private final boolean revoked;
    private final List<String> crlDistributionPoints;

    private CertificateDescriptor(Builder builder) {
        this.subject = builder.subject;
        this.sans = Collections.unmodifiableList(new ArrayList<>(builder.sans));
        this.keyType = builder.keyType != null ? builder.keyType : KeyType.EC;
        this.keySize = resolveKeySize(keyType, builder.keySize);
        this.expires = builder.expires;
        this.notBefore = builder.notBefore;
        this.notAfter = builder.notAfter;
        this.issuer = builder.issuer != null ? builder.issuer.trim() : "";
        this.ca = builder.ca != null ? builder.ca : this.issuer.isEmpty();
        this.keyUsages = resolveKeyUsages(builder.keyUsages, ca);
        this.extKeyUsages = Collections.unmodifiableList(new ArrayList<>(builder.extKeyUsages));
        this.filename = checkFilename(builder.filename != null && !builder.filename.isEmpty()
            ? builder.filename : commonNameOf(subject), subject);
        this.serial = builder.serial;
        this.revoked = builder.revoked;
        this.crlDistributionPoints = Collections.unmodifiableList(new ArrayList<>(builder.crlDistributionPoints));
    }

    private static int resolveKeySize(KeyType keyType, Integer requested) {
        if (!keyType.hasKeySize()) {
            return 0;
        }
        int size = requested != null && requested != 0 ? requested : keyType.getDefaultKeySize();
        if (!keyType.supportsKeySize(size)) {
            throw new InvalidKeySpecException("Unsupported key size " + size + " for key type " + keyType.getValue());
        }
        return size;
    }

    // output names are plain basenames inside the destination directory
    private static String checkFilename(String filename, String subject) {
        if (filename.trim().isEmpty() || filename.indexOf('/') >= 0 || filename.indexOf('\\') >= 0
                || filename.indexOf('\0') >= 0 || ".".equals(filename) || "..".equals(filename)) {
            throw new ManifestException(String.format(
                "Invalid filename '%s' for '%s': must not be empty or contain path separators", filename, subject),
                "filename");
        }
        return filename;
    }

    private static Set<KeyUsage> resolveKeyUsages(Set<KeyUsage> requested, boolean ca) {
        if (requested == null || requested.isEmpty()) {
            return ca ? CA_KEY_USAGES : END_ENTITY_KEY_USAGES;
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(requested));
    }

    /**
     * Extract the common name of a distinguished name.
     *
     * @param distinguishedName subject such as {@code cn=server,o=example}
     * @return the CN value
     * @throws ManifestException if the name cannot be parsed or has no CN
     */
    public static String commonNameOf(String distinguishedName) {
        X500Name name = parseName(distinguishedName, "subject");
        RDN[] rdns = name.getRDNs(BCStyle.CN);
        if (rdns.length == 0) {
            throw new ManifestException(
                "Cannot derive filename: subject '" + distinguishedName + "' has no common name", "filename");
        }
        return IETFUtils.valueToString(rdns[0].getFirst().getValue());
    }

    private static X500Name parseName(String distinguishedName, String field) {
        try {
            return new X500Name(distinguishedName);
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid distinguished name: " + distinguishedName, field, e);
        }
    }

    // Getters

    public String getSubject() {
        return subject;
    }

    public List<SubjectAltName> getSans() {
        return sans;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    /**
     * @return key size in bits, 0 for algorithms with a fixed size
     */
    public int getKeySize() {
        return keySize;
    }

    public Duration getExpires() {
        return expires;
    }

    public Instant getNotBefore() {
        return notBefore;
    }

    public Instant getNotAfter() {
        return notAfter;
    }

    public Set<KeyUsage> getKeyUsages() {
        return keyUsages;
    }

    public List<ExtKeyUsage> getExtKeyUsages() {
        return extKeyUsages;
    }

    /**
     * @return subject of the issuing certificate, empty for self-signed
     */
    public String getIssuer() {
        return issuer;
    }

    public boolean isSelfSigned() {
        return issuer.isEmpty();
    }

    public String getFilename() {
        return filename;
    }

    public boolean isCa() {
        return ca;
    }

    /**
     * @return pinned serial number, or null for a random one
     */
    public BigInteger getSerial() {
        return serial;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public List<String> getCrlDistributionPoints() {
        return crlDistributionPoints;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a Builder initialized with this descriptor's values
     *
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .subject(subject)
            .sans(sans)
            .keyType(keyType)
            .keySize(keyType.hasKeySize() ? keySize : null)
            .expires(expires)
            .notBefore(notBefore)
            .notAfter(notAfter)
            .keyUsages(keyUsages)
            .extKeyUsages(extKeyUsages)
            .issuer(issuer)
            .filename(filename)
            .ca(ca)
            .serial(serial)
            .revoked(revoked)
            .crlDistributionPoints(crlDistributionPoints);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CertificateDescriptor that = (CertificateDescriptor) o;
        return keySize == that.keySize &&
               ca == that.ca &&
               revoked == that.revoked &&
               Objects.equals(subject, that.subject) &&
               Objects.equals(sans, that.sans) &&
               keyType == that.keyType &&
               Objects.equals(expires, that.expires) &&
               Objects.equals(notBefore, that.notBefore) &&
               Objects.equals(notAfter, that.notAfter) &&
               Objects.equals(keyUsages, that.keyUsages) &&
               Objects.equals(extKeyUsages, that.extKeyUsages) &&
               Objects.equals(issuer, that.issuer) &&
               Objects.equals(filename, that.filename) &&
               Objects.equals(serial, that.serial) &&
               Objects.equals(crlDistributionPoints, that.crlDistributionPoints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, sans, keyType, keySize, expires, notBefore, notAfter,
            keyUsages, extKeyUsages, issuer, filename, ca, serial, revoked, crlDistributionPoints);
    }

    @Override
    public String toString() {
        return "CertificateDescriptor{" +
               "subject='" + subject + '\'' +
               ", issuer='" + issuer + '\'' +
               ", filename='" + filename + '\'' +
               ", keyType=" + keyType +
               ", keySize=" + keySize +
               ", ca=" + ca +
               ", revoked=" + revoked +
               '}';
    }

    /**
     * Builder for CertificateDescriptor
     */
    public static class Builder {
        private String subject;
        private final List<SubjectAltName> sans = new ArrayList<>();
        private KeyType keyType;
        private Integer keySize;
        private Duration expires;
        private Instant notBefore;
        private Instant notAfter;
        private Set<KeyUsage> keyUsages;
        private final List<ExtKeyUsage> extKeyUsages = new ArrayList<>();
        private String issuer;
        private String filename;
        private Boolean ca;
        private BigInteger serial;
        private boolean revoked;
        private final List<String> crlDistributionPoints = new ArrayList<>();

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder sans(Collection<SubjectAltName> sans) {
            this.sans.clear();
            if (sans != null) {
                this.sans.addAll(sans);
            }
            return this;
        }

        public Builder san(SubjectAltName san) {
            this.sans.add(san);
            return this;
        }

        public Builder keyType(KeyType keyType) {
            this.keyType = keyType;
            return this;
        }

        public Builder keySize(Integer keySize) {
            this.keySize = keySize;
            return this;
        }

        public Builder expires(Duration expires) {
            this.expires = expires;
            return this;
        }

        public Builder notBefore(Instant notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder notAfter(Instant notAfter) {
            this.notAfter = notAfter;
            return this;
        }

        public Builder keyUsages(Collection<KeyUsage> keyUsages) {
            this.keyUsages = keyUsages == null || keyUsages.isEmpty() ? null : EnumSet.copyOf(keyUsages);
            return this;
        }

        public Builder extKeyUsages(Collection<ExtKeyUsage> extKeyUsages) {
            this.extKeyUsages.clear();
            if (extKeyUsages != null) {
                this.extKeyUsages.addAll(extKeyUsages);
            }
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder ca(Boolean ca) {
            this.ca = ca;
            return this;
        }

        public Builder serial(BigInteger serial) {
            this.serial = serial;
            return this;
        }

        public Builder revoked(boolean revoked) {
            this.revoked = revoked;
            return this;
        }

        public Builder crlDistributionPoints(Collection<String> crlDistributionPoints) {
            this.crlDistributionPoints.clear();
            if (crlDistributionPoints != null) {
                this.crlDistributionPoints.addAll(crlDistributionPoints);
            }
            return this;
        }

        /**
         * Apply defaults and build the descriptor
         *
         * @return the normalized descriptor
         * @throws ManifestException if the subject is missing or has no usable common name
         * @throws InvalidKeySpecException if the key size is not supported by the key type
         */
        public CertificateDescriptor build() {
            if (subject == null || subject.trim().isEmpty()) {
                throw new ManifestException("subject is required", "subject");
            }
            parseName(subject, "subject");
            if (notBefore != null && notAfter != null && !notAfter.isAfter(notBefore)) {
                throw new ManifestException(
                    "not_after must be later than not_before for '" + subject + "'", "not_after");
            }
            if (serial != null && serial.signum() <= 0) {
                throw new ManifestException("serial must be positive for '" + subject + "'", "serial");
            }
            return new CertificateDescriptor(this);
        }
    }
}
