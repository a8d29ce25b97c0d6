package org.modcat.output;

import org.modcat.graph.DependencyGraph;
import org.modcat.output.render.DirectoryTreeRenderer;
import org.modcat.output.render.GraphAsciiRenderer;
import org.modcat.output.render.LabelMode;
import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

final class OutputFixtures {

    static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-01T12:30:45Z"), ZoneOffset.UTC);

    private OutputFixtures() {
    }

    static OutputAssembler assembler() {
        return new OutputAssembler(new ArtifactBanner(FIXED_CLOCK),
                new GraphAsciiRenderer(LabelMode.LETTERS, false), new DirectoryTreeRenderer());
    }

    /**
     * {@code main.py} imports {@code pkg.util}, which imports {@code requests}.
     */
    static DependencyGraph twoModuleGraph() {
        DependencyGraph graph = new DependencyGraph();
        graph.addModule(new ModuleRecord(new ModuleId("main.py"), Path.of("main.py"),
                "import os\nfrom pkg.util import run\nrun()\n", Set.of("os", "pkg.util"), Set.of(), Set.of()));
        graph.addModule(new ModuleRecord(new ModuleId("pkg/util.py"), Path.of("pkg/util.py"),
                "import requests\nclass Runner:\n    pass\ndef run():\n    pass\n",
                Set.of("requests"), Set.of("Runner"), Set.of("run")));
        graph.addEdge(new ModuleId("pkg/util.py"), new ModuleId("main.py"));
        return graph;
    }
}
