package org.modcat.scan;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Per-module metadata produced by the {@link ModuleScanner}. Immutable once created: the name sets are
 * copied into sorted, unmodifiable views so reports list them deterministically.
 *
 * @param id        The unique, root-relative identity of this module.
 * @param file      The file the content was read from.
 * @param content   The raw source text.
 * @param imports   Imported names as written, including leading dots of relative imports.
 * @param types     Names introduced by type declarations.
 * @param callables Names introduced by function or method declarations.
 */
public record ModuleRecord(
        ModuleId id,
        Path file,
        String content,
        Set<String> imports,
        Set<String> types,
        Set<String> callables
) {

    public ModuleRecord {
        imports = Collections.unmodifiableSortedSet(new TreeSet<>(imports));
        types = Collections.unmodifiableSortedSet(new TreeSet<>(types));
        callables = Collections.unmodifiableSortedSet(new TreeSet<>(callables));
    }

    /**
     * Checks whether this module declares no imports at all.
     */
    public boolean hasNoImports() {
        return imports.isEmpty();
    }
}
