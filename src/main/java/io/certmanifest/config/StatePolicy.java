package io.certmanifest.config;

/**
 * What happens to state entries whose certificate is no longer in the manifest
 */
public enum StatePolicy {
    /** Drop entries without a matching descriptor */
    PRUNE("prune"),
    /** Carry entries without a matching descriptor over unchanged */
    RETAIN("retain");
    
    private final String value;
    
    StatePolicy(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static StatePolicy fromString(String value) {
        if (value == null) {
            return PRUNE;
        }
        
        for (StatePolicy policy : StatePolicy.values()) {
            if (policy.value.equalsIgnoreCase(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown state policy: " + value);
    }
}
