package org.modcat.scan;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a module file cannot be read. Aborts the run: no artifact is written once a module is missing.
 */
public class ModuleReadException extends IOException {

    private final Path path;

    /**
     * @param path  The module file that failed to load.
     * @param cause The underlying I/O failure.
     */
    public ModuleReadException(Path path, IOException cause) {
        super("Could not read module " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
