package io.certmanifest.exception;

import java.nio.file.Path;

/**
 * Unreadable manifest, unwritable or missing destination, unreadable state or key file.
 */
public class FilesystemException extends CertManifestException {
    private final Path path;

    public FilesystemException(String message, Path path) {
        this(message, path, null);
    }

    public FilesystemException(String message, Path path, Throwable cause) {
        super(message, ErrorCode.FILESYSTEM, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
