package io.certmanifest.engine;

/**
 * Outcome of the fingerprint comparison for one artifact
 */
public enum Decision {
    SKIP,
    REGENERATE
}
