package org.modcat.graph;

import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;
import org.modcat.scan.ScanOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Resolves the imports of every module against the module table and builds the {@link DependencyGraph}.
 *
 * <p>Resolution is total: every import either produces edges or is silently treated as external or
 * unresolvable. Nothing here throws for odd input.</p>
 *
 * <ul>
 *   <li><b>Relative</b> ({@code .mod}, {@code ..pkg.mod}, {@code .}): one dot is the importing module's own
 *   directory, each further dot ascends one level. Ascending above the scan root makes the import
 *   unresolvable. The remainder, dots turned into {@code /}, names {@code <remainder>.py} or the package
 *   index {@code <remainder>/__init__.py}; an empty remainder names the index of the base directory.
 *   At most one module matches.</li>
 *   <li><b>Absolute</b> ({@code pkg.mod}): every module whose path ends with {@code pkg/mod.py} or
 *   {@code pkg/mod/__init__.py} on a path-segment boundary matches, so one import may produce
 *   several edges.</li>
 * </ul>
 */
public final class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    static final String INDEX_MODULE = "__init__";

    private final List<String> extensions;

    public DependencyGraphBuilder() {
        this(ScanOptions.DEFAULT_EXTENSIONS);
    }

    /**
     * @param extensions Module file extensions, tried in order when turning an import into a file name.
     */
    public DependencyGraphBuilder(List<String> extensions) {
        this.extensions = List.copyOf(extensions);
    }

    /**
     * Builds the graph. The module table is filled completely before the first import is resolved.
     *
     * @param records All scanned modules in discovery order.
     * @return The dependency graph.
     */
    public DependencyGraph build(Collection<ModuleRecord> records) {
        DependencyGraph graph = new DependencyGraph();

        // First pass: module table
        for (ModuleRecord record : records) {
            if (!graph.addModule(record)) {
                log.debug("Ignoring duplicate module {}", record.id());
            }
        }

        // Second pass: edges
        for (ModuleRecord record : graph.modules()) {
            for (String imported : record.imports()) {
                for (ModuleId target : resolve(record.id(), imported, graph)) {
                    if (target.equals(record.id())) {
                        log.debug("  Ignoring self-import of {} via '{}'", record.id(), imported);
                        continue;
                    }
                    if (graph.addEdge(target, record.id())) {
                        log.debug("  Adding edge: {} -> {}", target, record.id());
                    }
                }
            }
        }
        return graph;
    }

    /**
     * Resolves one import of a module to the internal modules it refers to.
     *
     * @param importer The importing module.
     * @param imported The import as written.
     * @param graph    The graph holding the complete module table.
     * @return Matching modules; empty for external or unresolvable imports.
     */
    public List<ModuleId> resolve(ModuleId importer, String imported, DependencyGraph graph) {
        if (imported.isEmpty()) {
            return List.of();
        }
        if (imported.startsWith(".")) {
            return resolveRelative(importer, imported, graph);
        }
        return resolveAbsolute(imported, graph);
    }

    private List<ModuleId> resolveRelative(ModuleId importer, String imported, DependencyGraph graph) {
        int dots = 0;
        while (dots < imported.length() && imported.charAt(dots) == '.') {
            dots++;
        }
        int ascend = dots - 1;
        if (ascend > importer.depth()) {
            log.debug("  Unresolvable relative import '{}' in {}", imported, importer);
            return List.of();
        }

        List<String> parts = importer.directory().isEmpty()
                ? List.of()
                : Arrays.asList(importer.directory().split("/"));
        String base = String.join("/", parts.subList(0, parts.size() - ascend));
        String remainder = imported.substring(dots);

        for (String candidate : candidates(base, remainder)) {
            ModuleId id = new ModuleId(candidate);
            if (graph.contains(id)) {
                return List.of(id);
            }
        }
        return List.of();
    }

    private List<ModuleId> resolveAbsolute(String imported, DependencyGraph graph) {
        List<String> suffixes = candidates("", imported);
        List<ModuleId> matches = new ArrayList<>();
        for (ModuleId id : graph.nodes()) {
            for (String suffix : suffixes) {
                if (endsWithSegments(id.path(), suffix)) {
                    matches.add(id);
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Candidate module paths for a dotted name below a base directory, module file first, package index second.
     */
    private List<String> candidates(String base, String dotted) {
        String prefix = base.isEmpty() ? "" : base + "/";
        List<String> result = new ArrayList<>();
        if (dotted.isEmpty()) {
            for (String extension : extensions) {
                result.add(prefix + INDEX_MODULE + extension);
            }
            return result;
        }
        String relative = prefix + dotted.replace('.', '/');
        for (String extension : extensions) {
            result.add(relative + extension);
        }
        for (String extension : extensions) {
            result.add(relative + "/" + INDEX_MODULE + extension);
        }
        return result;
    }

    private static boolean endsWithSegments(String path, String suffix) {
        return path.equals(suffix) || path.endsWith("/" + suffix);
    }
}
