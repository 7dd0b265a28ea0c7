package io.certmanifest.state;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Fingerprints recorded by the last successful run.
 *
 * <p>Certificates are keyed by entity filename; revocation lists by the filename of
 * their issuing authority. Both maps are sorted so the persisted form is stable.
 */
public class ManifestState {

    private static final ManifestState EMPTY = new ManifestState(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, String> certificates;
    private final Map<String, String> revocationLists;

    public ManifestState(Map<String, String> certificates, Map<String, String> revocationLists) {
        this.certificates = Collections.unmodifiableMap(new TreeMap<>(certificates));
        this.revocationLists = Collections.unmodifiableMap(new TreeMap<>(revocationLists));
    }

    public static ManifestState empty() {
        return EMPTY;
    }

    /**
     * @param filename entity filename
     * @return recorded fingerprint, or null if the entity is unknown
     */
    public String getCertificateFingerprint(String filename) {
        return certificates.get(filename);
    }

    /**
     * @param issuerFilename filename of the issuing authority
     * @return recorded fingerprint, or null if no list was recorded
     */
    public String getRevocationListFingerprint(String issuerFilename) {
        return revocationLists.get(issuerFilename);
    }

    public Map<String, String> getCertificates() {
        return certificates;
    }

    public Map<String, String> getRevocationLists() {
        return revocationLists;
    }

    public boolean isEmpty() {
        return certificates.isEmpty() && revocationLists.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ManifestState that = (ManifestState) o;
        return certificates.equals(that.certificates) && revocationLists.equals(that.revocationLists);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificates, revocationLists);
    }

    @Override
    public String toString() {
        return "ManifestState{" +
               "certificates=" + certificates.size() +
               ", revocationLists=" + revocationLists.size() +
               '}';
    }
}
