package io.certmanifest.crypto;

import io.certmanifest.exception.InvalidKeySpecException;
import io.certmanifest.model.KeyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.interfaces.ECKey;
import java.security.interfaces.RSAKey;

import static org.junit.jupiter.api.Assertions.*;

class KeyPairFactoryTest {

    private final KeyPairFactory factory = new KeyPairFactory();

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("should generate EC keys on the matching curve")
        void shouldGenerateEcKeys() {
            for (int size : new int[] {256, 384, 521}) {
                KeyPair keyPair = factory.generate(KeyType.EC, size);
                int fieldSize = ((ECKey) keyPair.getPublic()).getParams().getCurve().getField().getFieldSize();
                assertEquals(size, fieldSize);
            }
        }

        @Test
        @DisplayName("should generate RSA keys of the requested size")
        void shouldGenerateRsaKeys() {
            KeyPair keyPair = factory.generate(KeyType.RSA, 1024);

            assertEquals(1024, ((RSAKey) keyPair.getPublic()).getModulus().bitLength());
        }

        @Test
        @DisplayName("should generate Ed25519 keys")
        void shouldGenerateEd25519Keys() {
            KeyPair keyPair = factory.generate(KeyType.ED25519, 0);

            assertEquals("Ed25519", keyPair.getPublic().getAlgorithm());
        }

        @Test
        @DisplayName("should reject unsupported sizes")
        void shouldRejectUnsupportedSizes() {
            assertThrows(InvalidKeySpecException.class, () -> factory.generate(KeyType.EC, 128));
            assertThrows(InvalidKeySpecException.class, () -> factory.generate(KeyType.RSA, 512));
        }
    }

    @Nested
    @DisplayName("signatureAlgorithm")
    class SignatureAlgorithm {

        @Test
        @DisplayName("should pick the digest from the curve size")
        void shouldMatchCurve() {
            assertEquals("SHA256withECDSA",
                KeyPairFactory.signatureAlgorithm(factory.generate(KeyType.EC, 256).getPrivate()));
            assertEquals("SHA384withECDSA",
                KeyPairFactory.signatureAlgorithm(factory.generate(KeyType.EC, 384).getPrivate()));
            assertEquals("SHA512withECDSA",
                KeyPairFactory.signatureAlgorithm(factory.generate(KeyType.EC, 521).getPrivate()));
        }

        @Test
        @DisplayName("should sign RSA with SHA-256 and Ed25519 natively")
        void shouldHandleRsaAndEd25519() {
            assertEquals("SHA256withRSA",
                KeyPairFactory.signatureAlgorithm(factory.generate(KeyType.RSA, 1024).getPrivate()));
            assertEquals("Ed25519",
                KeyPairFactory.signatureAlgorithm(factory.generate(KeyType.ED25519, 0).getPrivate()));
        }
    }
}
