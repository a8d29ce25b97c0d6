package org.modcat.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes text file loading for the scanner: strict UTF-8 decoding and line-ending normalization.
 */
public final class SourceLoader {

    /**
     * Result of loading a source file.
     *
     * @param content     The file content (line endings normalized to {@code \n}).
     * @param logicalName The normalized path used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private SourceLoader() {}

    /**
     * Loads content from a local file system path.
     * <p>
     * Decoding is strict: a file that is not valid UTF-8 (typically binary data that happens to carry a
     * module extension) fails with a {@link java.nio.charset.MalformedInputException}.
     *
     * @param path The file to load.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read or decoded.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.normalize().toString().replace('\\', '/');
        String content = normalizeLineEndings(Files.readString(path, StandardCharsets.UTF_8));
        return new LoadResult(content, logicalName);
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n");
    }
}
