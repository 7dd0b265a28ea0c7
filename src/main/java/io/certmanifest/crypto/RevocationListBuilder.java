package io.certmanifest.crypto;

import io.certmanifest.exception.CryptoException;
import io.certmanifest.model.RevocationEntry;
import org.bouncycastle.asn1.x509.CRLNumber;
import org.bouncycastle.asn1.x509.CRLReason;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.cert.X509v2CRLBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CRLConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v2CRLBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.cert.X509CRL;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Builds a certificate revocation list signed by an issuing authority.
 */
public class RevocationListBuilder {

    /** Default interval between thisUpdate and nextUpdate (168h) */
    public static final Duration DEFAULT_VALIDITY = Duration.ofHours(168);

    private final Duration validity;

    public RevocationListBuilder() {
        this(DEFAULT_VALIDITY);
    }

    public RevocationListBuilder(Duration validity) {
        this.validity = validity;
    }

    public Duration getValidity() {
        return validity;
    }

    /**
     * Build and sign a CRL listing the entry's revoked certificates in order.
     *
     * @param entry revoked serial numbers of one issuer
     * @param issuer certificate and key of the issuer
     * @param thisUpdate issue time of the list
     * @return signed CRL
     * @throws CryptoException if signing fails
     */
    public X509CRL build(RevocationEntry entry, CertificateMaterial issuer, Instant thisUpdate) {
        try {
            X509v2CRLBuilder crlBuilder = new JcaX509v2CRLBuilder(issuer.getCertificate(), Date.from(thisUpdate));
            crlBuilder.setNextUpdate(Date.from(thisUpdate.plus(validity)));

            for (RevocationEntry.RevokedCertificate revoked : entry.getRevoked()) {
                crlBuilder.addCRLEntry(revoked.getSerialNumber(), Date.from(revoked.getRevocationTime()),
                    CRLReason.unspecified);
            }

            JcaX509ExtensionUtils extUtils = new JcaX509ExtensionUtils();
            crlBuilder.addExtension(Extension.authorityKeyIdentifier, false,
                extUtils.createAuthorityKeyIdentifier(issuer.getCertificate()));
            crlBuilder.addExtension(Extension.cRLNumber, false,
                new CRLNumber(BigInteger.valueOf(thisUpdate.getEpochSecond())));

            ContentSigner signer = new JcaContentSignerBuilder(KeyPairFactory.signatureAlgorithm(issuer.getPrivateKey()))
                .setProvider(CryptoProviders.BC)
                .build(issuer.getPrivateKey());
            X509CRLHolder holder = crlBuilder.build(signer);
            return new JcaX509CRLConverter().setProvider(CryptoProviders.BC).getCRL(holder);
        } catch (OperatorCreationException | CertIOException | GeneralSecurityException e) {
            throw new CryptoException(
                "Failed to sign revocation list for '" + entry.getIssuer() + "': " + e.getMessage(), e);
        }
    }
}
