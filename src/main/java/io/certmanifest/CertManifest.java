package io.certmanifest;

import io.certmanifest.config.GeneratorConfig;
import io.certmanifest.crypto.ArtifactStore;
import io.certmanifest.engine.CertificateGenerator;
import io.certmanifest.engine.GenerationResult;
import io.certmanifest.manifest.ManifestLoader;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.state.ManifestState;
import io.certmanifest.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Entry point for one generation run.
 *
 * <pre>{@code
 * GeneratorConfig config = GeneratorConfig.builder()
 *     .manifestPath("certs.yaml")
 *     .destinationDir("out")
 *     .build();
 * GenerationResult result = new CertManifest().run(config);
 * }</pre>
 *
 * <p>The state file is only written when the run succeeds.
 */
public class CertManifest {

    private static final Logger logger = LoggerFactory.getLogger(CertManifest.class);

    private final ManifestLoader manifestLoader;
    private final StateStore stateStore;

    public CertManifest() {
        this(new ManifestLoader(), new StateStore());
    }

    public CertManifest(ManifestLoader manifestLoader, StateStore stateStore) {
        this.manifestLoader = manifestLoader;
        this.stateStore = stateStore;
    }

    public GenerationResult run(GeneratorConfig config) {
        return run(config, new CertificateGenerator(config));
    }

    /**
     * Run with a preconfigured generator.
     *
     * @param config paths and state policy
     * @param generator generator to use
     * @return what was written and the persisted state
     */
    public GenerationResult run(GeneratorConfig config, CertificateGenerator generator) {
        Path manifestPath = Paths.get(config.getManifestPath());
        Path stateFile = config.resolveStateFile();

        List<CertificateDescriptor> descriptors = manifestLoader.load(manifestPath);
        ArtifactStore store = new ArtifactStore(Paths.get(config.getDestinationDir()));
        ManifestState previous = stateStore.load(stateFile);

        GenerationResult result = generator.generate(descriptors, previous, store);
        stateStore.save(stateFile, result.getState());

        logger.info("Generated {} certificate(s), {} up to date, {} revocation list(s) written",
            result.getRegenerated().size(), result.getSkipped().size(), result.getRevocationListsWritten().size());
        return result;
    }
}
