package io.certmanifest.model;

import io.certmanifest.exception.InvalidKeySpecException;

import java.util.Collections;
import java.util.Set;

/**
 * Key algorithms accepted in a manifest
 */
public enum KeyType {
    EC("EC", 256, Set.of(256, 384, 521)),
    RSA("RSA", 2048, Set.of(1024, 2048, 4096)),
    ED25519("ED25519", 0, Collections.emptySet());
    
    private final String value;
    private final int defaultKeySize;
    private final Set<Integer> keySizes;
    
    KeyType(String value, int defaultKeySize, Set<Integer> keySizes) {
        this.value = value;
        this.defaultKeySize = defaultKeySize;
        this.keySizes = keySizes;
    }
    
    public String getValue() {
        return value;
    }
    
    public int getDefaultKeySize() {
        return defaultKeySize;
    }
    
    /**
     * Whether the key size can be chosen for this algorithm.
     */
    public boolean hasKeySize() {
        return !keySizes.isEmpty();
    }
    
    public boolean supportsKeySize(int keySize) {
        return keySizes.contains(keySize);
    }
    
    public static KeyType fromString(String value) {
        if (value == null || value.isEmpty()) {
            return EC;
        }
        
        for (KeyType type : KeyType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new InvalidKeySpecException("Unknown key type: " + value, "key_type");
    }
}
