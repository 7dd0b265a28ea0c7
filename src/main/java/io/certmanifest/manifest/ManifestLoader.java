package io.certmanifest.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.certmanifest.exception.FilesystemException;
import io.certmanifest.exception.ManifestException;
import io.certmanifest.model.CertificateDescriptor;
import io.certmanifest.model.ExtKeyUsage;
import io.certmanifest.model.KeyType;
import io.certmanifest.model.KeyUsage;
import io.certmanifest.model.SubjectAltName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads a YAML manifest into normalized certificate descriptors.
 *
 * <p>The manifest holds one certificate per YAML document:
 * <pre>{@code
 * subject: cn=root
 * ---
 * subject: cn=leaf
 * issuer: cn=root
 * sans:
 *   - DNS:leaf.example.com
 * }</pre>
 *
 * <p>Unknown fields are rejected.
 */
public class ManifestLoader {

    private static final Logger logger = LoggerFactory.getLogger(ManifestLoader.class);

    private final ObjectMapper objectMapper;

    public ManifestLoader() {
        this.objectMapper = new ObjectMapper(new YAMLFactory());
        this.objectMapper.enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Load a manifest file
     *
     * @param path manifest path
     * @return descriptors in declaration order
     * @throws FilesystemException if the file cannot be read
     * @throws ManifestException if the content is invalid
     */
    public List<CertificateDescriptor> load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new FilesystemException("Manifest file not found: " + path, path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException e) {
            throw new FilesystemException("Failed to read manifest " + path + ": " + e.getMessage(), path, e);
        }
    }

    /**
     * Parse manifest content held in memory
     *
     * @param yaml manifest text
     * @return descriptors in declaration order
     */
    public List<CertificateDescriptor> parse(String yaml) {
        try {
            return read(new StringReader(yaml), "<inline>");
        } catch (IOException e) {
            throw new ManifestException("Failed to parse manifest: " + e.getMessage(), null, e);
        }
    }

    private List<CertificateDescriptor> read(Reader reader, String source) throws IOException {
        List<CertificateDescriptor> descriptors = new ArrayList<>();
        int document = 0;
        try (MappingIterator<ManifestEntry> entries = objectMapper.readerFor(ManifestEntry.class).readValues(reader)) {
            while (entries.hasNextValue()) {
                ManifestEntry entry = entries.nextValue();
                document++;
                if (entry == null) {
                    continue;
                }
                descriptors.add(toDescriptor(entry, document));
            }
        } catch (UnrecognizedPropertyException e) {
            throw new ManifestException(String.format("Unknown field '%s' in document %d of %s",
                e.getPropertyName(), document + 1, source), e.getPropertyName(), e);
        } catch (JsonProcessingException e) {
            throw new ManifestException(String.format("Invalid manifest %s (document %d): %s",
                source, document + 1, e.getOriginalMessage()), null, e);
        }
        logger.debug("Loaded {} certificate descriptors from {}", descriptors.size(), source);
        return descriptors;
    }

    CertificateDescriptor toDescriptor(ManifestEntry entry, int document) {
        if (entry.getSubject() == null || entry.getSubject().trim().isEmpty()) {
            throw new ManifestException("subject is required (document " + document + ")", "subject");
        }

        CertificateDescriptor.Builder builder = CertificateDescriptor.builder()
            .subject(entry.getSubject().trim())
            .keyType(KeyType.fromString(entry.getKeyType()))
            .keySize(entry.getKeySize())
            .issuer(entry.getIssuer())
            .filename(entry.getFilename())
            .ca(entry.getCa())
            .serial(entry.getSerial())
            .revoked(Boolean.TRUE.equals(entry.getRevoked()))
            .crlDistributionPoints(entry.getCrlDistributionPoints());

        for (String san : orEmpty(entry.getSans())) {
            builder.san(SubjectAltName.parse(san));
        }

        List<KeyUsage> keyUsages = new ArrayList<>();
        for (String name : orEmpty(entry.getKeyUsages())) {
            keyUsages.add(KeyUsage.fromName(name));
        }
        builder.keyUsages(keyUsages);

        List<ExtKeyUsage> extKeyUsages = new ArrayList<>();
        for (String name : orEmpty(entry.getExtKeyUsages())) {
            extKeyUsages.add(ExtKeyUsage.fromName(name));
        }
        builder.extKeyUsages(extKeyUsages);

        if (entry.getExpires() != null) {
            builder.expires(parseDuration(entry.getExpires(), "expires"));
        }
        if (entry.getNotBefore() != null) {
            builder.notBefore(parseTimestamp(entry.getNotBefore(), "not_before"));
        }
        if (entry.getNotAfter() != null) {
            builder.notAfter(parseTimestamp(entry.getNotAfter(), "not_after"));
        }

        return builder.build();
    }

    private static Duration parseDuration(String value, String field) {
        try {
            Duration duration = DurationParser.parse(value);
            if (duration.isNegative() || duration.isZero()) {
                throw new ManifestException(field + " must be positive: " + value, field);
            }
            return duration;
        } catch (IllegalArgumentException e) {
            throw new ManifestException("Invalid " + field + ": " + value, field, e);
        }
    }

    private static Instant parseTimestamp(String value, String field) {
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ManifestException("Invalid " + field + " timestamp (RFC 3339 expected): " + value, field, e);
        }
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values != null ? values : Collections.emptyList();
    }
}
