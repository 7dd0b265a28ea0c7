package io.certmanifest.crypto;

import io.certmanifest.exception.FilesystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.PrivateKey;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.EnumSet;
import java.util.Set;

/**
 * Certificate, key and CRL files in the destination directory.
 *
 * <p>File layout for an entity with filename {@code f}:
 * <ul>
 *   <li>{@code f.pem}: certificate</li>
 *   <li>{@code f-key.pem}: private key, mode 0600</li>
 *   <li>{@code f-crl.pem}: revocation list issued by {@code f}</li>
 * </ul>
 *
 * <p>Writes go to a temporary file that is then renamed over the target.
 */
public class ArtifactStore {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String CERTIFICATE_SUFFIX = ".pem";
    public static final String KEY_SUFFIX = "-key.pem";
    public static final String CRL_SUFFIX = "-crl.pem";

    /** Certificates and CRLs (644) */
    private static final Set<PosixFilePermission> PUBLIC_FILE_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OTHERS_READ
    );

    /** Private keys (600) */
    private static final Set<PosixFilePermission> KEY_FILE_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE
    );

    private final Path directory;
    private final PemCodec pemCodec;

    /**
     * @param directory existing destination directory
     * @throws FilesystemException if the directory does not exist
     */
    public ArtifactStore(Path directory) {
        this(directory, new PemCodec());
    }

    public ArtifactStore(Path directory, PemCodec pemCodec) {
        if (!Files.isDirectory(directory)) {
            throw new FilesystemException("Destination directory does not exist: " + directory, directory);
        }
        this.directory = directory;
        this.pemCodec = pemCodec;
    }

    public Path getDirectory() {
        return directory;
    }

    public static String certificateFile(String filename) {
        return filename + CERTIFICATE_SUFFIX;
    }

    public static String keyFile(String filename) {
        return filename + KEY_SUFFIX;
    }

    public static String revocationListFile(String issuerFilename) {
        return issuerFilename + CRL_SUFFIX;
    }

    public boolean hasCertificate(String filename) {
        return Files.isRegularFile(directory.resolve(certificateFile(filename)))
            && Files.isRegularFile(directory.resolve(keyFile(filename)));
    }

    public boolean hasRevocationList(String issuerFilename) {
        return Files.isRegularFile(directory.resolve(revocationListFile(issuerFilename)));
    }

    /**
     * Write certificate and key of an entity.
     *
     * @param filename entity filename without suffix
     * @param material certificate and key pair
     */
    public void writeCertificate(String filename, CertificateMaterial material) {
        write(keyFile(filename), pemCodec.encodePrivateKey(material.getPrivateKey()), KEY_FILE_PERMISSIONS);
        write(certificateFile(filename), pemCodec.encodeCertificate(material.getCertificate()),
            PUBLIC_FILE_PERMISSIONS);
    }

    public void writeRevocationList(String issuerFilename, X509CRL crl) {
        write(revocationListFile(issuerFilename), pemCodec.encodeRevocationList(crl), PUBLIC_FILE_PERMISSIONS);
    }

    /**
     * Load a previously written certificate and key.
     *
     * @param filename entity filename without suffix
     * @return certificate and key pair
     * @throws FilesystemException if either file cannot be read
     */
    public CertificateMaterial readCertificate(String filename) {
        X509Certificate certificate = pemCodec.decodeCertificate(read(certificateFile(filename)));
        PrivateKey privateKey = pemCodec.decodePrivateKey(read(keyFile(filename)));
        return new CertificateMaterial(certificate, privateKey);
    }

    private byte[] read(String name) {
        Path path = directory.resolve(name);
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new FilesystemException("Failed to read " + path + ": " + e.getMessage(), path, e);
        }
    }

    private void write(String name, byte[] content, Set<PosixFilePermission> permissions) {
        Path target = directory.resolve(name);
        Path tempPath = target.resolveSibling(name + ".tmp");
        try {
            Files.write(tempPath, content);
            setFilePermissions(tempPath, permissions);
            Files.move(tempPath, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Wrote {}", target);
        } catch (IOException e) {
            throw new FilesystemException("Failed to write " + target + ": " + e.getMessage(), target, e);
        }
    }

    private void setFilePermissions(Path path, Set<PosixFilePermission> permissions) throws IOException {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            logger.warn("POSIX permissions not supported, leaving default mode on {}", path);
        }
    }
}
