package io.certmanifest.crypto;

import io.certmanifest.exception.CryptoException;
import io.certmanifest.exception.InvalidKeySpecException;
import io.certmanifest.model.KeyType;

import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECKey;
import java.security.spec.ECGenParameterSpec;

/**
 * Key pair generation and signature algorithm selection.
 *
 * <p>Supported combinations:
 * <ul>
 *   <li>EC: NIST P-256, P-384, P-521</li>
 *   <li>RSA: 1024, 2048, 4096 bits</li>
 *   <li>Ed25519</li>
 * </ul>
 */
public class KeyPairFactory {

    /**
     * Generate a new key pair.
     *
     * @param keyType key algorithm
     * @param keySize key size in bits, ignored for Ed25519
     * @return generated KeyPair
     * @throws InvalidKeySpecException if the combination is not supported
     * @throws CryptoException if key generation fails
     */
    public KeyPair generate(KeyType keyType, int keySize) {
        checkSupported(keyType, keySize);
        try {
            KeyPairGenerator generator;
            switch (keyType) {
                case EC:
                    generator = KeyPairGenerator.getInstance("EC", CryptoProviders.BC);
                    generator.initialize(new ECGenParameterSpec(curveName(keySize)));
                    break;
                case RSA:
                    generator = KeyPairGenerator.getInstance("RSA", CryptoProviders.BC);
                    generator.initialize(keySize);
                    break;
                case ED25519:
                    generator = KeyPairGenerator.getInstance("Ed25519", CryptoProviders.BC);
                    break;
                default:
                    throw new InvalidKeySpecException("Unsupported key type: " + keyType, "key_type");
            }
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Failed to generate " + keyType.getValue() + " key pair: " + e.getMessage(), e);
        }
    }

    /**
     * @throws InvalidKeySpecException if the key type does not support the key size
     */
    public static void checkSupported(KeyType keyType, int keySize) {
        if (keyType.hasKeySize() && !keyType.supportsKeySize(keySize)) {
            throw new InvalidKeySpecException(
                "Unsupported key size " + keySize + " for key type " + keyType.getValue());
        }
    }

    /**
     * Signature algorithm used when signing with the given key.
     *
     * @param signingKey private key of the signer
     * @return JCA signature algorithm name
     */
    public static String signatureAlgorithm(Key signingKey) {
        String algorithm = signingKey.getAlgorithm();
        if ("RSA".equals(algorithm)) {
            return "SHA256withRSA";
        }
        if (("EC".equals(algorithm) || "ECDSA".equals(algorithm)) && signingKey instanceof ECKey) {
            int fieldSize = ((ECKey) signingKey).getParams().getCurve().getField().getFieldSize();
            if (fieldSize > 384) {
                return "SHA512withECDSA";
            }
            if (fieldSize > 256) {
                return "SHA384withECDSA";
            }
            return "SHA256withECDSA";
        }
        if ("Ed25519".equals(algorithm) || "EdDSA".equals(algorithm)) {
            return "Ed25519";
        }
        throw new CryptoException("No signature algorithm for key type " + algorithm);
    }

    private static String curveName(int keySize) {
        switch (keySize) {
            case 256:
                return "secp256r1";
            case 384:
                return "secp384r1";
            case 521:
                return "secp521r1";
            default:
                throw new InvalidKeySpecException("Unsupported EC key size: " + keySize);
        }
    }
}
