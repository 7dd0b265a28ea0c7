package io.certmanifest.engine;

import io.certmanifest.crypto.ArtifactStore;
import io.certmanifest.exception.ManifestException;
import io.certmanifest.exception.UnresolvedIssuerException;
import io.certmanifest.model.CertificateDescriptor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds each descriptor to its issuer in a single pass over the manifest.
 *
 * <p>An issuer must be declared before it is referenced, so a forward reference, a typo and
 * a cycle all surface the same way: the issuer is not yet in the map when it is looked up.
 */
public class DependencyResolver {

    /**
     * Resolve issuer references in manifest order.
     *
     * @param descriptors manifest entries in declaration order
     * @return resolved entries in the same order
     * @throws UnresolvedIssuerException if an issuer is not declared earlier
     * @throws ManifestException if two entries would write the same file
     */
    public List<ResolvedCertificate> resolve(List<CertificateDescriptor> descriptors) {
        Map<String, ResolvedCertificate> bySubject = new HashMap<>();
        Set<String> outputFiles = new HashSet<>();
        List<ResolvedCertificate> resolved = new ArrayList<>(descriptors.size());

        for (CertificateDescriptor descriptor : descriptors) {
            reserveOutputFiles(descriptor, outputFiles);

            ResolvedCertificate issuer = null;
            if (!descriptor.isSelfSigned()) {
                issuer = bySubject.get(descriptor.getIssuer());
                if (issuer == null) {
                    throw new UnresolvedIssuerException(descriptor.getSubject(), descriptor.getIssuer());
                }
            }

            ResolvedCertificate entry = new ResolvedCertificate(descriptor, issuer);
            // a later duplicate subject shadows the earlier one for descendants declared after it
            bySubject.put(descriptor.getSubject(), entry);
            resolved.add(entry);
        }
        return resolved;
    }

    /**
     * Check that no certificate or key file of the manifest is also the revocation list of
     * one of the given issuers.
     *
     * @param resolved all entries in manifest order
     * @param issuers authorities that will write a revocation list
     * @throws ManifestException if a revocation list would overwrite another output file
     */
    public void checkRevocationListFiles(List<ResolvedCertificate> resolved,
                                         Collection<ResolvedCertificate> issuers) {
        Map<String, String> outputFiles = new HashMap<>();
        for (ResolvedCertificate entry : resolved) {
            outputFiles.put(ArtifactStore.certificateFile(entry.getFilename()), entry.getDescriptor().getSubject());
            outputFiles.put(ArtifactStore.keyFile(entry.getFilename()), entry.getDescriptor().getSubject());
        }
        for (ResolvedCertificate issuer : issuers) {
            String listFile = ArtifactStore.revocationListFile(issuer.getFilename());
            String owner = outputFiles.get(listFile);
            if (owner != null) {
                throw new ManifestException(String.format(
                    "Revocation list %s of '%s' collides with the output of '%s'",
                    listFile, issuer.getDescriptor().getSubject(), owner), "filename");
            }
        }
    }

    private static void reserveOutputFiles(CertificateDescriptor descriptor, Set<String> outputFiles) {
        String filename = descriptor.getFilename();
        if (!outputFiles.add(ArtifactStore.certificateFile(filename))
                || !outputFiles.add(ArtifactStore.keyFile(filename))) {
            throw new ManifestException(String.format(
                "Filename '%s' of '%s' collides with another certificate", filename, descriptor.getSubject()),
                "filename");
        }
    }
}
