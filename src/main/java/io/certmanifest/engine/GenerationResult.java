package io.certmanifest.engine;

import io.certmanifest.state.ManifestState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of one generation run: the new state plus the entities and revocation lists
 * that were written or left alone, by filename.
 */
public class GenerationResult {
    private final ManifestState state;
    private final List<String> regenerated;
    private final List<String> skipped;
    private final List<String> revocationListsWritten;
    private final List<String> revocationListsSkipped;

    private GenerationResult(Builder builder) {
        this.state = builder.state;
        this.regenerated = Collections.unmodifiableList(new ArrayList<>(builder.regenerated));
        this.skipped = Collections.unmodifiableList(new ArrayList<>(builder.skipped));
        this.revocationListsWritten = Collections.unmodifiableList(new ArrayList<>(builder.revocationListsWritten));
        this.revocationListsSkipped = Collections.unmodifiableList(new ArrayList<>(builder.revocationListsSkipped));
    }

    public ManifestState getState() {
        return state;
    }

    public List<String> getRegenerated() {
        return regenerated;
    }

    public List<String> getSkipped() {
        return skipped;
    }

    /**
     * @return issuer filenames whose revocation list was written
     */
    public List<String> getRevocationListsWritten() {
        return revocationListsWritten;
    }

    public List<String> getRevocationListsSkipped() {
        return revocationListsSkipped;
    }

    @Override
    public String toString() {
        return "GenerationResult{" +
               "regenerated=" + regenerated +
               ", skipped=" + skipped +
               ", revocationListsWritten=" + revocationListsWritten +
               ", revocationListsSkipped=" + revocationListsSkipped +
               '}';
    }

    static Builder builder() {
        return new Builder();
    }

    static class Builder {
        private ManifestState state;
        private final List<String> regenerated = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<String> revocationListsWritten = new ArrayList<>();
        private final List<String> revocationListsSkipped = new ArrayList<>();

        Builder state(ManifestState state) {
            this.state = state;
            return this;
        }

        Builder regenerated(String filename) {
            regenerated.add(filename);
            return this;
        }

        Builder skipped(String filename) {
            skipped.add(filename);
            return this;
        }

        Builder revocationListWritten(String issuerFilename) {
            revocationListsWritten.add(issuerFilename);
            return this;
        }

        Builder revocationListSkipped(String issuerFilename) {
            revocationListsSkipped.add(issuerFilename);
            return this;
        }

        GenerationResult build() {
            return new GenerationResult(this);
        }
    }
}
