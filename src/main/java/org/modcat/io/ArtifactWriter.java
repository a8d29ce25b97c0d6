package org.modcat.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Writes a fully assembled artifact in one step: temp file next to the target, then atomic rename.
 * A reader never observes a partially written artifact, and a failed write leaves any previous file intact.
 */
public final class ArtifactWriter {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWriter.class);

    private ArtifactWriter() {}

    /**
     * Writes the content to the target file, replacing an existing file.
     *
     * @param target  The artifact file.
     * @param content The complete artifact text.
     * @return The absolute path of the written file.
     * @throws IOException If the temp file cannot be written or moved into place.
     */
    public static Path write(Path target, String content) throws IOException {
        Path absolute = target.toAbsolutePath().normalize();
        Path parentDir = absolute.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }

        // Suffix .UUID.tmp keeps the temp file in the same directory (same file store) as the target
        Path tempFile = absolute.resolveSibling(absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                writer.write(content);
            }
            try {
                Files.move(tempFile, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", absolute);
                Files.move(tempFile, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw e;
        }
        return absolute;
    }
}
