package io.certmanifest.model;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Revoked certificates of one issuing authority, in manifest order
 */
public class RevocationEntry {

    /**
     * One (serial number, revocation time) pair
     */
    public static class RevokedCertificate {
        private final BigInteger serialNumber;
        private final Instant revocationTime;

        public RevokedCertificate(BigInteger serialNumber, Instant revocationTime) {
            this.serialNumber = serialNumber;
            this.revocationTime = revocationTime;
        }

        public BigInteger getSerialNumber() { return serialNumber; }
        public Instant getRevocationTime() { return revocationTime; }
    }

    private final String issuer;
    private final List<RevokedCertificate> revoked = new ArrayList<>();

    public RevocationEntry(String issuer) {
        this.issuer = issuer;
    }

    public RevocationEntry add(BigInteger serialNumber, Instant revocationTime) {
        revoked.add(new RevokedCertificate(serialNumber, revocationTime));
        return this;
    }

    /**
     * @return distinguished name of the issuing authority
     */
    public String getIssuer() {
        return issuer;
    }

    public List<RevokedCertificate> getRevoked() {
        return Collections.unmodifiableList(revoked);
    }
}
