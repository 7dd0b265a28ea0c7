package io.certmanifest.manifest;

import io.certmanifest.exception.FilesystemException;
import io.certmanifest.exception.InvalidKeySpecException;
import io.certmanifest.exception.InvalidSanException;
import io.certmanifest.exception.ManifestException;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.ExtKeyUsage;
import io.certmanifest.model.KeyType;
import io.certmanifest.model.KeyUsage;
import io.certmanifest.model.SubjectAltName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ManifestLoader
 */
class ManifestLoaderTest {

    private ManifestLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ManifestLoader();
    }

    static Path manifest(String name) {
        try {
            return Paths.get(ManifestLoaderTest.class.getResource("/manifests/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    @Nested
    @DisplayName("load")
    class Load {

        @Test
        @DisplayName("should read every document in declaration order")
        void shouldReadDocumentsInOrder() {
            List<CertificateDescriptor> descriptors = loader.load(manifest("state-1.yaml"));

            assertEquals(8, descriptors.size());
            assertEquals("cn=server-root-ca", descriptors.get(0).getSubject());
            assertEquals("cn=fixedtime", descriptors.get(7).getSubject());
            assertEquals("cn=server-root-ca", descriptors.get(1).getIssuer());
        }

        @Test
        @DisplayName("should parse every supported field")
        void shouldParseAllFields() {
            List<CertificateDescriptor> descriptors = loader.load(manifest("all-fields.yaml"));
            CertificateDescriptor rsa = descriptors.get(1);

            assertEquals("rsa-cert", rsa.getFilename());
            assertEquals(KeyType.RSA, rsa.getKeyType());
            assertEquals(2048, rsa.getKeySize());
            assertTrue(rsa.isCa());
            assertEquals(Instant.parse("2020-01-01T09:00:00Z"), rsa.getNotBefore());
            assertEquals(Instant.parse("2030-01-01T09:00:00Z"), rsa.getNotAfter());
            assertEquals(KeyUsage.values().length, rsa.getKeyUsages().size());
            assertEquals(List.of(ExtKeyUsage.values()), rsa.getExtKeyUsages());
            assertEquals(List.of(
                SubjectAltName.dns("www.example.com"),
                SubjectAltName.ip("127.0.0.1"),
                SubjectAltName.uri("spiffe://myworkload")), rsa.getSans());
            assertEquals(List.of("http://ca1.example.com/crl", "http://ca2.example.com/crl"),
                rsa.getCrlDistributionPoints());

            CertificateDescriptor ec = descriptors.get(2);
            assertEquals(BigInteger.valueOf(123), ec.getSerial());
            assertTrue(ec.isSelfSigned());

            CertificateDescriptor ed = descriptors.get(3);
            assertEquals(KeyType.ED25519, ed.getKeyType());
            assertEquals(Duration.ofHours(1), ed.getExpires());
        }

        @Test
        @DisplayName("should skip empty documents")
        void shouldSkipEmptyDocuments() {
            List<CertificateDescriptor> descriptors = loader.load(manifest("empty-documents.yaml"));

            assertEquals(2, descriptors.size());
            assertEquals("leaf", descriptors.get(1).getFilename());
        }

        @Test
        @DisplayName("should reject unknown fields")
        void shouldRejectUnknownFields() {
            ManifestException e = assertThrows(ManifestException.class,
                () -> loader.load(manifest("invalid-field.yaml")));
            assertEquals("not_a_field", e.getField());
        }

        @Test
        @DisplayName("should fail with a filesystem error for a missing manifest")
        void shouldFailForMissingFile() {
            assertThrows(FilesystemException.class,
                () -> loader.load(Paths.get("does-not-exist", "certs.yaml")));
        }
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("should reject an unknown key usage name")
        void shouldRejectUnknownKeyUsage() {
            ManifestException e = assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\nkey_usages: [Teleport]\n"));
            assertEquals("key_usages", e.getField());
        }

        @Test
        @DisplayName("should reject an unknown extended key usage name")
        void shouldRejectUnknownExtKeyUsage() {
            assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\next_key_usages: [Whatever]\n"));
        }

        @Test
        @DisplayName("should reject a missing subject")
        void shouldRejectMissingSubject() {
            ManifestException e = assertThrows(ManifestException.class, () -> loader.parse("filename: x\n"));
            assertEquals("subject", e.getField());
        }

        @Test
        @DisplayName("should reject bad timestamps and durations")
        void shouldRejectBadTimes() {
            assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\nnot_before: yesterday\n"));
            assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\nexpires: 1y\n"));
            assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\nexpires: \"0\"\n"));
        }

        @Test
        @DisplayName("should reject wrongly typed values")
        void shouldRejectWrongTypes() {
            assertThrows(ManifestException.class,
                () -> loader.parse("subject: cn=a\nsans:\n  nested: map\n"));
        }

        @Test
        @DisplayName("should surface SAN and key errors with their own types")
        void shouldSurfaceSpecificErrors() {
            assertThrows(InvalidSanException.class,
                () -> loader.parse("subject: cn=a\nsans: [\"IP:not-an-ip\"]\n"));
            assertThrows(InvalidKeySpecException.class,
                () -> loader.parse("subject: cn=a\nkey_type: RSA\nkey_size: 123\n"));
        }

        @Test
        @DisplayName("should accept timestamps with offsets")
        void shouldAcceptOffsets() {
            CertificateDescriptor d = loader.parse("subject: cn=a\nnot_before: \"2020-01-01T11:00:00+02:00\"\n").get(0);

            assertEquals(Instant.parse("2020-01-01T09:00:00Z"), d.getNotBefore());
        }
    }
}
