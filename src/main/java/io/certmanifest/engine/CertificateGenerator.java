package io.certmanifest.engine;

import io.certmanifest.config.GeneratorConfig;
import io.certmanifest.config.StatePolicy;
import io.certmanifest.crypto.ArtifactStore;
import io.certmanifest.crypto.CertificateBuilder;
import io.certmanifest.crypto.CertificateMaterial;
import io.certmanifest.crypto.KeyPairFactory;
import io.certmanifest.crypto.RevocationListBuilder;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.RevocationEntry;
import io.certmanifest.state.ManifestState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.KeyPair;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Turns a list of descriptors into certificate, key and CRL files.
 *
 * <p>Issuer resolution and revocation grouping run before anything is written, so a
 * manifest with a dangling issuer or an impossible revocation leaves the destination
 * untouched. Entries are then processed in manifest order; an issuer is always handled
 * before the certificates it signs.
 */
public class CertificateGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CertificateGenerator.class);

    private final DependencyResolver resolver;
    private final RevocationPlanner planner;
    private final KeyPairFactory keyPairFactory;
    private final CertificateBuilder certificateBuilder;
    private final RevocationListBuilder revocationListBuilder;
    private final StatePolicy statePolicy;
    private final Clock clock;

    public CertificateGenerator(GeneratorConfig config) {
        this(new KeyPairFactory(),
            new CertificateBuilder(config.getDefaultLifetime()),
            new RevocationListBuilder(config.getCrlValidity()),
            config.getStatePolicy(),
            Clock.systemUTC());
    }

    public CertificateGenerator(KeyPairFactory keyPairFactory, CertificateBuilder certificateBuilder,
                                RevocationListBuilder revocationListBuilder, StatePolicy statePolicy, Clock clock) {
        this.resolver = new DependencyResolver();
        this.planner = new RevocationPlanner();
        this.keyPairFactory = keyPairFactory;
        this.certificateBuilder = certificateBuilder;
        this.revocationListBuilder = revocationListBuilder;
        this.statePolicy = statePolicy != null ? statePolicy : StatePolicy.PRUNE;
        this.clock = clock;
    }

    /**
     * Generate everything that is missing or out of date.
     *
     * @param descriptors manifest entries in declaration order
     * @param previous state of the last successful run
     * @param store destination directory
     * @return new state and per-file outcome
     */
    public GenerationResult generate(List<CertificateDescriptor> descriptors, ManifestState previous,
                                     ArtifactStore store) {
        List<ResolvedCertificate> resolved = resolver.resolve(descriptors);
        Map<ResolvedCertificate, List<ResolvedCertificate>> revocations = planner.group(resolved);
        resolver.checkRevocationListFiles(resolved, revocations.keySet());

        FingerprintEngine engine = new FingerprintEngine(previous, store,
            certificateBuilder.getDefaultLifetime(), revocationListBuilder.getValidity());
        GenerationResult.Builder result = GenerationResult.builder();
        Instant now = clock.instant();

        for (ResolvedCertificate entry : resolved) {
            if (engine.evaluate(entry) == Decision.SKIP) {
                result.skipped(entry.getFilename());
                continue;
            }
            CertificateDescriptor descriptor = entry.getDescriptor();
            KeyPair keyPair = keyPairFactory.generate(descriptor.getKeyType(), descriptor.getKeySize());
            X509Certificate certificate = entry.isSelfSigned()
                ? certificateBuilder.selfSigned(descriptor, keyPair, now)
                : certificateBuilder.issued(descriptor, keyPair, materialOf(entry.getIssuer(), store), now);

            CertificateMaterial material = new CertificateMaterial(certificate, keyPair);
            store.writeCertificate(entry.getFilename(), material);
            entry.attachMaterial(material);
            result.regenerated(entry.getFilename());
        }

        for (Map.Entry<ResolvedCertificate, List<ResolvedCertificate>> group : revocations.entrySet()) {
            ResolvedCertificate issuer = group.getKey();
            if (engine.evaluateRevocationList(issuer, group.getValue()) == Decision.SKIP) {
                result.revocationListSkipped(issuer.getFilename());
                continue;
            }
            RevocationEntry revocationEntry = new RevocationEntry(issuer.getDescriptor().getSubject());
            for (ResolvedCertificate revoked : group.getValue()) {
                revocationEntry.add(materialOf(revoked, store).getCertificate().getSerialNumber(), now);
            }
            X509CRL crl = revocationListBuilder.build(revocationEntry, materialOf(issuer, store), now);
            store.writeRevocationList(issuer.getFilename(), crl);
            result.revocationListWritten(issuer.getFilename());
        }

        return result.state(engine.nextState(statePolicy)).build();
    }

    private static CertificateMaterial materialOf(ResolvedCertificate entry, ArtifactStore store) {
        if (entry.getMaterial() == null) {
            logger.debug("Loading {} from {}", entry.getFilename(), store.getDirectory());
            entry.attachMaterial(store.readCertificate(entry.getFilename()));
        }
        return entry.getMaterial();
    }
}
