package org.modcat.output;

import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.util.Collection;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Splits imports into internal and external ones.
 *
 * <p>An import is external if it is not relative and its dotted root (the part before the first dot)
 * names no internal top-level entry. Top-level entries are the first directory of every module path,
 * and the module name itself for modules located directly in the scan root.</p>
 */
public final class ImportClassifier {

    private final Set<String> internalRoots;

    private ImportClassifier(Set<String> internalRoots) {
        this.internalRoots = internalRoots;
    }

    public static ImportClassifier of(Collection<ModuleRecord> modules) {
        return new ImportClassifier(modules.stream()
                .map(ModuleRecord::id)
                .map(ModuleId::topLevelName)
                .collect(Collectors.toUnmodifiableSet()));
    }

    public static boolean isRelative(String imported) {
        return imported.startsWith(".");
    }

    public boolean isExternal(String imported) {
        if (isRelative(imported)) {
            return false;
        }
        int dot = imported.indexOf('.');
        String root = dot < 0 ? imported : imported.substring(0, dot);
        return !internalRoots.contains(root);
    }

    /**
     * Collects the external imports of all modules, sorted.
     */
    public SortedSet<String> externalImports(Collection<ModuleRecord> modules) {
        return modules.stream()
                .flatMap(m -> m.imports().stream())
                .filter(this::isExternal)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Collects the relative imports of all modules, sorted.
     */
    public static SortedSet<String> relativeImports(Collection<ModuleRecord> modules) {
        return modules.stream()
                .flatMap(m -> m.imports().stream())
                .filter(ImportClassifier::isRelative)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Collects all imports that are not relative, internal or not, sorted.
     */
    public static SortedSet<String> absoluteImports(Collection<ModuleRecord> modules) {
        return modules.stream()
                .flatMap(m -> m.imports().stream())
                .filter(imp -> !isRelative(imp))
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
