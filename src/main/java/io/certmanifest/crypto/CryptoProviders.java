package io.certmanifest.crypto;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import java.security.Provider;

/**
 * Bouncy Castle provider instance passed explicitly to every JCA call.
 * It is never registered globally.
 */
public final class CryptoProviders {

    public static final Provider BC = new BouncyCastleProvider();

    private CryptoProviders() {
        // Utility class
    }
}
