package io.certmanifest.crypto;

import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.KeyType;
import io.certmanifest.model.RevocationEntry;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.X509CRLEntryHolder;
import org.bouncycastle.cert.X509CRLHolder;
import org.bouncycastle.openssl.PEMParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.cert.X509CRL;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RevocationListBuilderTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private CertificateMaterial ca;

    @BeforeEach
    void setUp() {
        KeyPair keys = new KeyPairFactory().generate(KeyType.EC, 256);
        CertificateDescriptor descriptor = CertificateDescriptor.builder().subject("cn=ca1").build();
        ca = new CertificateMaterial(new CertificateBuilder().selfSigned(descriptor, keys, NOW), keys);
    }

    private static X509CRLHolder parse(X509CRL crl) throws Exception {
        String pem = new String(new PemCodec().encodeRevocationList(crl), StandardCharsets.US_ASCII);
        assertTrue(pem.startsWith("-----BEGIN X509 CRL-----"));
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            return (X509CRLHolder) parser.readObject();
        }
    }

    @Test
    @DisplayName("should list revoked serials in order under the issuer's name")
    void shouldListRevokedSerials() throws Exception {
        RevocationEntry entry = new RevocationEntry("cn=ca1")
            .add(BigInteger.valueOf(123), NOW)
            .add(BigInteger.valueOf(456), NOW);

        X509CRL crl = new RevocationListBuilder().build(entry, ca, NOW);
        X509CRLHolder holder = parse(crl);

        assertEquals("CN=ca1", holder.getIssuer().toString());
        List<BigInteger> serials = new ArrayList<>();
        for (Object revoked : holder.getRevokedCertificates()) {
            serials.add(((X509CRLEntryHolder) revoked).getSerialNumber());
        }
        assertEquals(List.of(BigInteger.valueOf(123), BigInteger.valueOf(456)), serials);
        crl.verify(ca.getCertificate().getPublicKey(), CryptoProviders.BC);
    }

    @Test
    @DisplayName("should set nextUpdate from the configured validity")
    void shouldSetNextUpdate() {
        RevocationEntry entry = new RevocationEntry("cn=ca1").add(BigInteger.ONE, NOW);

        X509CRL crl = new RevocationListBuilder(Duration.ofHours(24)).build(entry, ca, NOW);

        assertEquals(NOW, crl.getThisUpdate().toInstant());
        assertEquals(NOW.plus(Duration.ofHours(24)), crl.getNextUpdate().toInstant());
    }

    @Test
    @DisplayName("should carry a CRL number and authority key identifier")
    void shouldCarryExtensions() throws Exception {
        RevocationEntry entry = new RevocationEntry("cn=ca1").add(BigInteger.ONE, NOW);

        X509CRLHolder holder = parse(new RevocationListBuilder().build(entry, ca, NOW));

        ASN1Integer number = ASN1Integer.getInstance(holder.getExtension(Extension.cRLNumber).getParsedValue());
        assertEquals(BigInteger.valueOf(NOW.getEpochSecond()), number.getValue());
        assertNotNull(holder.getExtension(Extension.authorityKeyIdentifier));
    }

    @Test
    @DisplayName("should build an empty list when nothing is revoked")
    void shouldBuildEmptyList() throws Exception {
        X509CRLHolder holder = parse(new RevocationListBuilder().build(new RevocationEntry("cn=ca1"), ca, NOW));

        assertTrue(holder.getRevokedCertificates().isEmpty());
    }
}
