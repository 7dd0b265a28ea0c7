package io.certmanifest.crypto;

import io.certmanifest.exception.CryptoException;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.ExtKeyUsage;
import io.certmanifest.model.KeyUsage;
import io.certmanifest.model.SubjectAltName;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.CRLDistPoint;
import org.bouncycastle.asn1.x509.DistributionPoint;
import org.bouncycastle.asn1.x509.DistributionPointName;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Builds and signs an X.509 v3 certificate for a descriptor.
 *
 * <p>The validity window runs from {@code not_before} (default: now) to the first of
 * explicit {@code not_after}, now + {@code expires}, or now + the default lifetime.
 * Serial numbers are 128-bit random values unless pinned in the descriptor.
 */
public class CertificateBuilder {

    /** Default certificate lifetime (8760h) */
    public static final Duration DEFAULT_LIFETIME = Duration.ofHours(8760);

    private static final int SERIAL_NUMBER_BITS = 128;

    private final SecureRandom random;
    private final Duration defaultLifetime;

    public CertificateBuilder() {
        this(new SecureRandom(), DEFAULT_LIFETIME);
    }

    public CertificateBuilder(Duration defaultLifetime) {
        this(new SecureRandom(), defaultLifetime);
    }

    public CertificateBuilder(SecureRandom random, Duration defaultLifetime) {
        this.random = random;
        this.defaultLifetime = defaultLifetime;
    }

    public Duration getDefaultLifetime() {
        return defaultLifetime;
    }

    /**
     * Build a self-signed certificate.
     *
     * @param descriptor certificate specification
     * @param keyPair freshly generated key pair of the subject
     * @param now reference time for defaulted validity bounds
     * @return signed certificate
     */
    public X509Certificate selfSigned(CertificateDescriptor descriptor, KeyPair keyPair, Instant now) {
        X500Name subject = new X500Name(descriptor.getSubject());
        return sign(descriptor, keyPair.getPublic(), subject, keyPair.getPrivate(), keyPair.getPublic(), now);
    }

    /**
     * Build a certificate signed by an issuer.
     *
     * @param descriptor certificate specification
     * @param keyPair freshly generated key pair of the subject
     * @param issuer certificate and key of the issuing authority
     * @param now reference time for defaulted validity bounds
     * @return signed certificate
     */
    public X509Certificate issued(CertificateDescriptor descriptor, KeyPair keyPair,
                                  CertificateMaterial issuer, Instant now) {
        X509Certificate issuerCertificate = issuer.getCertificate();
        X500Name issuerName = X500Name.getInstance(issuerCertificate.getSubjectX500Principal().getEncoded());
        return sign(descriptor, keyPair.getPublic(), issuerName, issuer.getPrivateKey(),
            issuerCertificate.getPublicKey(), now);
    }

    /**
     * Resolve the certificate's not-before bound.
     */
    public Instant notBefore(CertificateDescriptor descriptor, Instant now) {
        return descriptor.getNotBefore() != null ? descriptor.getNotBefore() : now;
    }

    /**
     * Resolve the certificate's not-after bound: explicit value, then now + expires,
     * then now + default lifetime.
     */
    public Instant notAfter(CertificateDescriptor descriptor, Instant now) {
        if (descriptor.getNotAfter() != null) {
            return descriptor.getNotAfter();
        }
        Duration lifetime = descriptor.getExpires() != null ? descriptor.getExpires() : defaultLifetime;
        return now.plus(lifetime);
    }

    private X509Certificate sign(CertificateDescriptor descriptor, PublicKey subjectKey, X500Name issuerName,
                                 PrivateKey signingKey, PublicKey signingPublicKey, Instant now) {
        X500Name subject = new X500Name(descriptor.getSubject());
        BigInteger serial = descriptor.getSerial() != null
            ? descriptor.getSerial()
            : new BigInteger(SERIAL_NUMBER_BITS, random);

        try {
            JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();
            X509v3CertificateBuilder certBuilder = new JcaX509v3CertificateBuilder(
                issuerName,
                serial,
                Date.from(notBefore(descriptor, now)),
                Date.from(notAfter(descriptor, now)),
                subject,
                subjectKey);

            certBuilder.addExtension(Extension.basicConstraints, true, new BasicConstraints(descriptor.isCa()));
            certBuilder.addExtension(Extension.keyUsage, true,
                new org.bouncycastle.asn1.x509.KeyUsage(keyUsageBits(descriptor)));
            if (!descriptor.getExtKeyUsages().isEmpty()) {
                certBuilder.addExtension(Extension.extendedKeyUsage, false,
                    extendedKeyUsage(descriptor.getExtKeyUsages()));
            }
            certBuilder.addExtension(Extension.subjectKeyIdentifier, false,
                extUtils.createSubjectKeyIdentifier(subjectKey));
            certBuilder.addExtension(Extension.authorityKeyIdentifier, false,
                extUtils.createAuthorityKeyIdentifier(signingPublicKey));
            if (!descriptor.getSans().isEmpty()) {
                certBuilder.addExtension(Extension.subjectAlternativeName, false,
                    subjectAlternativeNames(descriptor.getSans()));
            }
            if (!descriptor.getCrlDistributionPoints().isEmpty()) {
                certBuilder.addExtension(Extension.cRLDistributionPoints, false,
                    distributionPoints(descriptor.getCrlDistributionPoints()));
            }

            ContentSigner signer = new JcaContentSignerBuilder(KeyPairFactory.signatureAlgorithm(signingKey))
                .setProvider(CryptoProviders.BC)
                .build(signingKey);
            X509CertificateHolder holder = certBuilder.build(signer);
            X509Certificate certificate = new JcaX509CertificateConverter()
                .setProvider(CryptoProviders.BC)
                .getCertificate(holder);

            certificate.verify(signingPublicKey, CryptoProviders.BC);
            return certificate;
        } catch (OperatorCreationException | CertIOException | GeneralSecurityException e) {
            throw new CryptoException(
                "Failed to sign certificate for '" + descriptor.getSubject() + "': " + e.getMessage(), e);
        }
    }

    private static int keyUsageBits(CertificateDescriptor descriptor) {
        int bits = 0;
        for (KeyUsage usage : descriptor.getKeyUsages()) {
            bits |= usage.getBit();
        }
        return bits;
    }

    private static ExtendedKeyUsage extendedKeyUsage(List<ExtKeyUsage> usages) {
        KeyPurposeId[] purposes = new KeyPurposeId[usages.size()];
        for (int i = 0; i < purposes.length; i++) {
            purposes[i] = KeyPurposeId.getInstance(new ASN1ObjectIdentifier(usages.get(i).getOid()));
        }
        return new ExtendedKeyUsage(purposes);
    }

    private static GeneralNames subjectAlternativeNames(List<SubjectAltName> sans) {
        GeneralName[] names = new GeneralName[sans.size()];
        for (int i = 0; i < names.length; i++) {
            SubjectAltName san = sans.get(i);
            switch (san.getType()) {
                case DNS:
                    names[i] = new GeneralName(GeneralName.dNSName, san.getValue());
                    break;
                case IP:
                    names[i] = new GeneralName(GeneralName.iPAddress, san.getAddress().getHostAddress());
                    break;
                case URI:
                    names[i] = new GeneralName(GeneralName.uniformResourceIdentifier, san.getUri().toString());
                    break;
                default:
                    throw new IllegalStateException("Unhandled SAN type " + san.getType());
            }
        }
        return new GeneralNames(names);
    }

    private static CRLDistPoint distributionPoints(List<String> urls) {
        DistributionPoint[] points = new DistributionPoint[urls.size()];
        for (int i = 0; i < points.length; i++) {
            GeneralNames location = new GeneralNames(
                new GeneralName(GeneralName.uniformResourceIdentifier, urls.get(i)));
            points[i] = new DistributionPoint(new DistributionPointName(location), null, null);
        }
        return new CRLDistPoint(points);
    }
}
