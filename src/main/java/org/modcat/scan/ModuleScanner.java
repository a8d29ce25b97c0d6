package org.modcat.scan;

import org.modcat.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads module files and turns them into {@link ModuleRecord}s.
 *
 * <p>Excluded files yield no record. Empty or unrecognizable files yield a record without imports or
 * declarations. A file that cannot be read aborts the scan with a {@link ModuleReadException}.</p>
 */
public final class ModuleScanner {

    private static final Logger log = LoggerFactory.getLogger(ModuleScanner.class);

    private final ScanOptions options;
    private final IDeclarationExtractor extractor;

    public ModuleScanner(ScanOptions options) {
        this(options, new LinePatternExtractor());
    }

    public ModuleScanner(ScanOptions options, IDeclarationExtractor extractor) {
        this.options = options;
        this.extractor = extractor;
    }

    /**
     * Discovers and scans every module below the scan root.
     *
     * @return Records in discovery order.
     * @throws IOException If the root cannot be walked or a module cannot be read.
     */
    public List<ModuleRecord> scanAll() throws IOException {
        List<ModuleRecord> records = new ArrayList<>();
        for (Path file : ModuleDiscovery.discover(options)) {
            scan(file).ifPresent(records::add);
        }
        log.debug("Scanned {} modules below {}", records.size(), options.root());
        return records;
    }

    /**
     * Scans a single module file.
     *
     * @param file A file below the scan root.
     * @return The record, or empty if the file is excluded.
     * @throws ModuleReadException If the file cannot be read or is not valid text.
     */
    public Optional<ModuleRecord> scan(Path file) throws ModuleReadException {
        if (options.isExcluded(file)) {
            log.debug("Excluding {}", file);
            return Optional.empty();
        }
        String content;
        try {
            content = SourceLoader.loadFile(file).content();
        } catch (IOException e) {
            throw new ModuleReadException(file, e);
        }
        return Optional.of(scanContent(ModuleId.of(options.root(), file), file, content));
    }

    /**
     * Builds a record from already loaded text. Performs no I/O.
     */
    public ModuleRecord scanContent(ModuleId id, Path file, String content) {
        IDeclarationExtractor.Declarations declarations = extractor.extract(content);
        ModuleRecord record = new ModuleRecord(id, file, content,
                declarations.imports(), declarations.types(), declarations.callables());
        if (!record.imports().isEmpty()) {
            log.debug("Added module {} with imports: {}", id, String.join(", ", record.imports()));
        } else {
            log.debug("Added module {}", id);
        }
        return record;
    }
}
