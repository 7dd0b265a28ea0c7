package io.certmanifest.crypto;

import io.certmanifest.exception.CryptoException;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMException;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.util.io.pem.PemGenerationException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;

/**
 * PEM encoding and decoding of certificates, private keys and revocation lists.
 *
 * <p>Private keys are written as unencrypted PKCS#8 ({@code PRIVATE KEY}); traditional
 * {@code EC PRIVATE KEY} / {@code RSA PRIVATE KEY} blocks are accepted when reading.
 */
public class PemCodec {

    public byte[] encodeCertificate(X509Certificate certificate) {
        return write(certificate, "certificate");
    }

    public byte[] encodePrivateKey(PrivateKey privateKey) {
        try {
            return write(new JcaPKCS8Generator(privateKey, null), "private key");
        } catch (PemGenerationException e) {
            throw new CryptoException("Failed to encode private key: " + e.getMessage(), e);
        }
    }

    public byte[] encodeRevocationList(X509CRL crl) {
        return write(crl, "revocation list");
    }

    /**
     * Decode the first certificate of a PEM document.
     *
     * @param pem PEM bytes
     * @return decoded certificate
     * @throws CryptoException if no certificate can be read
     */
    public X509Certificate decodeCertificate(byte[] pem) {
        Object object = readFirst(pem);
        if (!(object instanceof X509CertificateHolder)) {
            throw new CryptoException("PEM data does not contain a certificate");
        }
        try {
            return new JcaX509CertificateConverter()
                .setProvider(CryptoProviders.BC)
                .getCertificate((X509CertificateHolder) object);
        } catch (CertificateException e) {
            throw new CryptoException("Failed to decode certificate: " + e.getMessage(), e);
        }
    }

    /**
     * Decode the first private key of a PEM document.
     *
     * @param pem PEM bytes
     * @return decoded private key
     * @throws CryptoException if no unencrypted private key can be read
     */
    public PrivateKey decodePrivateKey(byte[] pem) {
        Object object = readFirst(pem);
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(CryptoProviders.BC);
        try {
            if (object instanceof PrivateKeyInfo) {
                return converter.getPrivateKey((PrivateKeyInfo) object);
            }
            if (object instanceof PEMKeyPair) {
                return converter.getKeyPair((PEMKeyPair) object).getPrivate();
            }
        } catch (PEMException e) {
            throw new CryptoException("Failed to decode private key: " + e.getMessage(), e);
        }
        throw new CryptoException("PEM data does not contain an unencrypted private key");
    }

    private byte[] write(Object object, String description) {
        StringWriter sw = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(sw)) {
            writer.writeObject(object);
            writer.flush();
        } catch (IOException e) {
            throw new CryptoException("Failed to encode " + description + ": " + e.getMessage(), e);
        }
        return sw.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private Object readFirst(byte[] pem) {
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object object = parser.readObject();
            if (object == null) {
                throw new CryptoException("No PEM block found");
            }
            return object;
        } catch (IOException e) {
            throw new CryptoException("Failed to parse PEM data: " + e.getMessage(), e);
        }
    }
}
