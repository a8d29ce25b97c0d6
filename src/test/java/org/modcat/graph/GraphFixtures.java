package org.modcat.graph;

import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.nio.file.Path;
import java.util.Set;

/**
 * Small builders shared by the graph tests.
 */
final class GraphFixtures {

    private GraphFixtures() {
    }

    static ModuleRecord record(String path, String... imports) {
        return new ModuleRecord(new ModuleId(path), Path.of(path), "", Set.of(imports), Set.of(), Set.of());
    }

    static ModuleId id(String path) {
        return new ModuleId(path);
    }

    /**
     * Graph with the given modules in discovery order and no edges.
     */
    static DependencyGraph graphOf(String... paths) {
        DependencyGraph graph = new DependencyGraph();
        for (String path : paths) {
            graph.addModule(record(path));
        }
        return graph;
    }
}
