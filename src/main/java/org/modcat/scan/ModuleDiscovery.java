package org.modcat.scan;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds module files below the scan root.
 * <p>
 * The walk result is sorted by root-relative path, which makes the discovery order (and with it the
 * tie-break and cycle fallback order of the pipeline) independent of the file system's listing order.
 */
public final class ModuleDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ModuleDiscovery.class);

    private ModuleDiscovery() {}

    /**
     * Lists all module files below the root that are not excluded.
     *
     * @param options The scan options.
     * @return Module files in discovery order.
     * @throws IOException If the root cannot be walked.
     */
    public static List<Path> discover(ScanOptions options) throws IOException {
        Path root = options.root();
        if (!Files.isDirectory(root)) {
            throw new IOException("Source directory not found: " + root);
        }
        try (Stream<Path> files = Files.walk(root)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(options::isModuleFile)
                    .filter(file -> {
                        if (options.isExcluded(file)) {
                            log.debug("Excluding {}", root.relativize(file));
                            return false;
                        }
                        return true;
                    })
                    .sorted((a, b) -> ModuleId.of(root, a).path().compareTo(ModuleId.of(root, b).path()))
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            // Files.walk reports unreadable subdirectories lazily, during iteration
            throw e.getCause();
        }
    }
}
