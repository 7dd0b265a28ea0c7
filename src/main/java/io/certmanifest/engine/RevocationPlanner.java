package io.certmanifest.engine;

import io.certmanifest.exception.RevocationException;
import io.certmanifest.model.KeyUsage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups revoked certificates by their issuing authority.
 */
public class RevocationPlanner {

    /**
     * @param resolved all entries in manifest order
     * @return issuer → revoked entries it issued, both in manifest order
     * @throws RevocationException if a revoked entry has no issuer able to sign a CRL
     */
    public Map<ResolvedCertificate, List<ResolvedCertificate>> group(List<ResolvedCertificate> resolved) {
        Map<ResolvedCertificate, List<ResolvedCertificate>> groups = new LinkedHashMap<>();
        for (ResolvedCertificate entry : resolved) {
            if (!entry.getDescriptor().isRevoked()) {
                continue;
            }
            if (entry.isSelfSigned()) {
                throw new RevocationException(
                    "Cannot revoke self-signed certificate '" + entry.getDescriptor().getSubject() + "'");
            }
            ResolvedCertificate issuer = entry.getIssuer();
            if (!issuer.getDescriptor().getKeyUsages().contains(KeyUsage.CRL_SIGN)) {
                throw new RevocationException(String.format(
                    "Cannot revoke '%s': issuer '%s' does not have the CRLSign key usage",
                    entry.getDescriptor().getSubject(), issuer.getDescriptor().getSubject()));
            }
            groups.computeIfAbsent(issuer, k -> new ArrayList<>()).add(entry);
        }
        return groups;
    }
}
