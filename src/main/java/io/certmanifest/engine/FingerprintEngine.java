package io.certmanifest.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.certmanifest.config.GeneratorConfigConstants;
import io.certmanifest.config.StatePolicy;
import io.certmanifest.crypto.ArtifactStore;
import io.certmanifest.exception.CryptoException;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.ExtKeyUsage;
import io.certmanifest.model.KeyUsage;
import io.certmanifest.model.SubjectAltName;
import io.certmanifest.state.ManifestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes content fingerprints and decides which artifacts must be rebuilt.
 *
 * <p>A certificate fingerprint is the SHA-256 of the descriptor's canonical JSON form
 * together with the fingerprint of its issuer, so a change anywhere up the chain changes
 * every fingerprint below it. Collection-valued fields are sorted before hashing.
 *
 * <p>One engine is used per run. It records every fingerprint it computes; {@link #nextState}
 * returns them as the state to persist.
 */
public class FingerprintEngine {

    private static final Logger logger = LoggerFactory.getLogger(FingerprintEngine.class);

    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final ManifestState previous;
    private final ArtifactStore store;
    private final Duration defaultLifetime;
    private final Duration crlValidity;
    private final Map<String, String> certificates = new LinkedHashMap<>();
    private final Map<String, String> revocationLists = new LinkedHashMap<>();

    public FingerprintEngine(ManifestState previous, ArtifactStore store) {
        this(previous, store, GeneratorConfigConstants.DEFAULT_LIFETIME, GeneratorConfigConstants.DEFAULT_CRL_VALIDITY);
    }

    /**
     * @param previous state of the last successful run
     * @param store destination directory
     * @param defaultLifetime lifetime of certificates without {@code expires} or {@code not_after}
     * @param crlValidity interval between a CRL's thisUpdate and nextUpdate
     */
    public FingerprintEngine(ManifestState previous, ArtifactStore store, Duration defaultLifetime,
                             Duration crlValidity) {
        this.previous = previous != null ? previous : ManifestState.empty();
        this.store = store;
        this.defaultLifetime = defaultLifetime;
        this.crlValidity = crlValidity;
    }

    /**
     * Fingerprint of a descriptor under a given issuer.
     *
     * @param descriptor certificate specification
     * @param issuerFingerprint fingerprint of the issuer, empty for self-signed
     * @return lowercase hex SHA-256
     */
    public static String fingerprint(CertificateDescriptor descriptor, String issuerFingerprint) {
        return fingerprint(descriptor, issuerFingerprint, GeneratorConfigConstants.DEFAULT_LIFETIME);
    }

    /**
     * Fingerprint of a descriptor under a given issuer and default lifetime. The default lifetime
     * only counts when the descriptor sets neither {@code expires} nor {@code not_after}.
     *
     * @param descriptor certificate specification
     * @param issuerFingerprint fingerprint of the issuer, empty for self-signed
     * @param defaultLifetime lifetime applied when the descriptor has none
     * @return lowercase hex SHA-256
     */
    public static String fingerprint(CertificateDescriptor descriptor, String issuerFingerprint,
                                     Duration defaultLifetime) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("subject", descriptor.getSubject());
        canonical.put("issuer", descriptor.getIssuer());
        canonical.put("issuerFingerprint", issuerFingerprint != null ? issuerFingerprint : "");
        canonical.put("filename", descriptor.getFilename());
        canonical.put("keyType", descriptor.getKeyType().getValue());
        canonical.put("keySize", descriptor.getKeySize());
        canonical.put("ca", descriptor.isCa());
        canonical.put("revoked", descriptor.isRevoked());

        List<String> sans = new ArrayList<>();
        for (SubjectAltName san : descriptor.getSans()) {
            sans.add(san.toString());
        }
        canonical.put("sans", sorted(sans));

        List<String> keyUsages = new ArrayList<>();
        for (KeyUsage usage : descriptor.getKeyUsages()) {
            keyUsages.add(usage.getName());
        }
        canonical.put("keyUsages", sorted(keyUsages));

        List<String> extKeyUsages = new ArrayList<>();
        for (ExtKeyUsage usage : descriptor.getExtKeyUsages()) {
            extKeyUsages.add(usage.getName());
        }
        canonical.put("extKeyUsages", sorted(extKeyUsages));
        canonical.put("crlDistributionPoints", sorted(new ArrayList<>(descriptor.getCrlDistributionPoints())));

        if (descriptor.getExpires() != null) {
            canonical.put("expires", descriptor.getExpires().toString());
        } else if (descriptor.getNotAfter() == null) {
            canonical.put("expires", defaultLifetime.toString());
        }
        if (descriptor.getNotBefore() != null) {
            canonical.put("notBefore", descriptor.getNotBefore().toString());
        }
        if (descriptor.getNotAfter() != null) {
            canonical.put("notAfter", descriptor.getNotAfter().toString());
        }
        if (descriptor.getSerial() != null) {
            canonical.put("serial", descriptor.getSerial().toString());
        }
        return sha256(canonical);
    }

    /**
     * Fingerprint of the revocation list of one issuer.
     *
     * @param issuerFingerprint fingerprint of the issuing authority
     * @param memberFingerprints fingerprints of the revoked certificates in manifest order
     * @return lowercase hex SHA-256
     */
    public static String revocationListFingerprint(String issuerFingerprint, List<String> memberFingerprints) {
        return revocationListFingerprint(issuerFingerprint, memberFingerprints,
            GeneratorConfigConstants.DEFAULT_CRL_VALIDITY);
    }

    /**
     * Fingerprint of the revocation list of one issuer.
     *
     * @param issuerFingerprint fingerprint of the issuing authority
     * @param memberFingerprints fingerprints of the revoked certificates in manifest order
     * @param validity interval between thisUpdate and nextUpdate
     * @return lowercase hex SHA-256
     */
    public static String revocationListFingerprint(String issuerFingerprint, List<String> memberFingerprints,
                                                   Duration validity) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("issuer", issuerFingerprint);
        canonical.put("revoked", memberFingerprints);
        canonical.put("validity", validity.toString());
        return sha256(canonical);
    }

    /**
     * Compute the fingerprint of an entry and decide whether it must be regenerated.
     * The issuer must already have been evaluated.
     *
     * @param entry resolved entry
     * @return the decision, also assigned to the entry
     */
    public Decision evaluate(ResolvedCertificate entry) {
        CertificateDescriptor descriptor = entry.getDescriptor();
        String filename = entry.getFilename();
        ResolvedCertificate issuer = entry.getIssuer();
        if (issuer != null && issuer.getFingerprint() == null) {
            throw new IllegalStateException("Issuer of " + filename + " has not been evaluated");
        }

        String fingerprint = fingerprint(descriptor, issuer != null ? issuer.getFingerprint() : "", defaultLifetime);
        certificates.put(filename, fingerprint);

        String reason = null;
        if (!fingerprint.equals(previous.getCertificateFingerprint(filename))) {
            reason = "configuration changed";
        } else if (!store.hasCertificate(filename)) {
            reason = "files missing";
        } else if (issuer != null && issuer.isRegenerated()) {
            reason = "issuer regenerated";
        } else if (descriptor.isRevoked() && !store.hasRevocationList(issuer.getFilename())) {
            reason = "revocation list missing";
        }

        Decision decision = reason != null ? Decision.REGENERATE : Decision.SKIP;
        entry.assign(fingerprint, decision);
        if (decision == Decision.REGENERATE) {
            logger.info("Writing {} ({})", ArtifactStore.certificateFile(filename), reason);
        } else {
            logger.info("Skipping {}: up to date", ArtifactStore.certificateFile(filename));
        }
        return decision;
    }

    /**
     * Decide whether the revocation list of an issuer must be rebuilt. All entries must
     * already have been evaluated.
     *
     * @param issuer issuing authority
     * @param revoked revoked entries issued by it, in manifest order
     * @return the decision
     */
    public Decision evaluateRevocationList(ResolvedCertificate issuer, List<ResolvedCertificate> revoked) {
        List<String> members = new ArrayList<>(revoked.size());
        boolean memberRegenerated = false;
        for (ResolvedCertificate entry : revoked) {
            members.add(entry.getFingerprint());
            memberRegenerated |= entry.isRegenerated();
        }
        String fingerprint = revocationListFingerprint(issuer.getFingerprint(), members, crlValidity);
        revocationLists.put(issuer.getFilename(), fingerprint);

        String reason = null;
        if (!fingerprint.equals(previous.getRevocationListFingerprint(issuer.getFilename()))) {
            reason = "revocations changed";
        } else if (!store.hasRevocationList(issuer.getFilename())) {
            reason = "file missing";
        } else if (issuer.isRegenerated() || memberRegenerated) {
            reason = "certificates regenerated";
        }

        String file = ArtifactStore.revocationListFile(issuer.getFilename());
        if (reason != null) {
            logger.info("Writing {} ({})", file, reason);
            return Decision.REGENERATE;
        }
        logger.info("Skipping {}: up to date", file);
        return Decision.SKIP;
    }

    /**
     * State to persist after this run.
     *
     * @param policy what to do with entries of the previous state that were not evaluated
     * @return the new state
     */
    public ManifestState nextState(StatePolicy policy) {
        if (policy == StatePolicy.RETAIN) {
            Map<String, String> mergedCertificates = new TreeMap<>(previous.getCertificates());
            mergedCertificates.putAll(certificates);
            Map<String, String> mergedLists = new TreeMap<>(previous.getRevocationLists());
            mergedLists.putAll(revocationLists);
            return new ManifestState(mergedCertificates, mergedLists);
        }

        for (String stale : previous.getCertificates().keySet()) {
            if (!certificates.containsKey(stale)) {
                logger.debug("Dropping state of {}", stale);
            }
        }
        return new ManifestState(certificates, revocationLists);
    }

    private static List<String> sorted(List<String> values) {
        Collections.sort(values);
        return values;
    }

    private static String sha256(Map<String, Object> canonical) {
        try {
            byte[] json = CANONICAL_MAPPER.writeValueAsBytes(canonical);
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(json);
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new CryptoException("Failed to compute fingerprint: " + e.getMessage(), e);
        }
    }
}
