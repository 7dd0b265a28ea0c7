package io.certmanifest.engine;

import io.certmanifest.exception.ManifestException;
import io.certmanifest.exception.UnresolvedIssuerException;
import io.certmanifest.model.CertificateDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    private final DependencyResolver resolver = new DependencyResolver();

    private static CertificateDescriptor cert(String subject, String issuer) {
        return CertificateDescriptor.builder().subject(subject).issuer(issuer).build();
    }

    @Test
    @DisplayName("should bind each entry to the earlier entry it names as issuer")
    void shouldBindIssuers() {
        List<ResolvedCertificate> resolved = resolver.resolve(List.of(
            cert("cn=root", null),
            cert("cn=intermediate", "cn=root"),
            cert("cn=leaf", "cn=intermediate")));

        assertEquals(3, resolved.size());
        assertTrue(resolved.get(0).isSelfSigned());
        assertSame(resolved.get(0), resolved.get(1).getIssuer());
        assertSame(resolved.get(1), resolved.get(2).getIssuer());
    }

    @Test
    @DisplayName("should reject a forward reference")
    void shouldRejectForwardReference() {
        UnresolvedIssuerException e = assertThrows(UnresolvedIssuerException.class, () -> resolver.resolve(List.of(
            cert("cn=leaf", "cn=root"),
            cert("cn=root", null))));

        assertEquals("cn=leaf", e.getSubject());
        assertEquals("cn=root", e.getIssuer());
    }

    @Test
    @DisplayName("should reject an entry naming itself as issuer")
    void shouldRejectSelfReference() {
        assertThrows(UnresolvedIssuerException.class, () -> resolver.resolve(List.of(cert("cn=loop", "cn=loop"))));
    }

    @Test
    @DisplayName("should match issuer names exactly")
    void shouldMatchExactly() {
        assertThrows(UnresolvedIssuerException.class, () -> resolver.resolve(List.of(
            cert("cn=root", null),
            cert("cn=leaf", "CN=root"))));
    }

    @Test
    @DisplayName("should reject two entries writing the same files")
    void shouldRejectDuplicateFilenames() {
        ManifestException e = assertThrows(ManifestException.class, () -> resolver.resolve(List.of(
            cert("cn=server,o=a", null),
            cert("cn=server,o=b", null))));

        assertEquals("filename", e.getField());
    }

    @Test
    @DisplayName("a repeated subject should shadow the earlier one for later entries")
    void laterSubjectShouldShadow() {
        List<ResolvedCertificate> resolved = resolver.resolve(List.of(
            cert("cn=ca", null),
            CertificateDescriptor.builder().subject("cn=ca").filename("ca2").build(),
            cert("cn=leaf", "cn=ca")));

        assertSame(resolved.get(1), resolved.get(2).getIssuer());
    }

    @Test
    @DisplayName("should reject a certificate named like an issuer's revocation list")
    void shouldRejectRevocationListCollision() {
        List<ResolvedCertificate> resolved = resolver.resolve(List.of(
            cert("cn=ca1", null),
            cert("cn=leaf", "cn=ca1"),
            cert("cn=ca1-crl", null)));

        ManifestException e = assertThrows(ManifestException.class,
            () -> resolver.checkRevocationListFiles(resolved, List.of(resolved.get(0))));

        assertEquals("filename", e.getField());
        assertTrue(e.getMessage().contains("ca1-crl.pem"));
    }

    @Test
    @DisplayName("revocation lists of other issuers should not collide")
    void shouldAcceptDistinctRevocationLists() {
        List<ResolvedCertificate> resolved = resolver.resolve(List.of(
            cert("cn=ca1", null),
            cert("cn=ca2-crl", null)));

        assertDoesNotThrow(() -> resolver.checkRevocationListFiles(resolved, List.of(resolved.get(0))));
    }
}
