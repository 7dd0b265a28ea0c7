package io.certmanifest.manifest;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigInteger;
import java.util.List;

/**
 * One YAML document of the manifest, as written by the user
 */
public class ManifestEntry {

    @JsonProperty("subject")
    private String subject;

    @JsonProperty("sans")
    private List<String> sans;

    @JsonProperty("key_type")
    private String keyType;

    @JsonProperty("key_size")
    private Integer keySize;

    @JsonProperty("expires")
    private String expires;

    @JsonProperty("not_before")
    private String notBefore;

    @JsonProperty("not_after")
    private String notAfter;

    @JsonProperty("key_usages")
    private List<String> keyUsages;

    @JsonProperty("ext_key_usages")
    private List<String> extKeyUsages;

    @JsonProperty("issuer")
    private String issuer;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("ca")
    private Boolean ca;

    @JsonProperty("serial")
    private BigInteger serial;

    @JsonProperty("revoked")
    private Boolean revoked;

    @JsonProperty("crl_distribution_points")
    private List<String> crlDistributionPoints;

    public String getSubject() { return subject; }
    public List<String> getSans() { return sans; }
    public String getKeyType() { return keyType; }
    public Integer getKeySize() { return keySize; }
    public String getExpires() { return expires; }
    public String getNotBefore() { return notBefore; }
    public String getNotAfter() { return notAfter; }
    public List<String> getKeyUsages() { return keyUsages; }
    public List<String> getExtKeyUsages() { return extKeyUsages; }
    public String getIssuer() { return issuer; }
    public String getFilename() { return filename; }
    public Boolean getCa() { return ca; }
    public BigInteger getSerial() { return serial; }
    public Boolean getRevoked() { return revoked; }
    public List<String> getCrlDistributionPoints() { return crlDistributionPoints; }
}
