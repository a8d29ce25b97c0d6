package org.modcat.output.render;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.modcat.graph.DependencyGraph;
import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class GraphAsciiRendererTest {

    @Test
    @Tag("unit")
    void layersEdgesAndIsolatedNodes() {
        RenderedGraph rendered = new GraphAsciiRenderer(LabelMode.LETTERS, false).render(sampleGraph());

        assertThat(rendered.legendText()).isEqualTo("Legend:\nA: a.py\nB: b.py\nC: c.py");
        assertThat(rendered.diagram()).startsWith(GraphAsciiRenderer.ISOLATED_NOTE + "\n");
        assertThat(rendered.diagram()).contains(
                "Layer 1:  [A]  [C]\n", "Layer 2:  [B]\n", "A --> B\n", "Isolated:  [C]\n");
    }

    @Test
    @Tag("unit")
    void removingDisconnectedNodesDropsThemFromLegendAndDiagram() {
        RenderedGraph rendered = new GraphAsciiRenderer(LabelMode.NUMBERS, true).render(sampleGraph());

        assertThat(rendered.legend()).containsOnlyKeys("1", "2");
        assertThat(rendered.diagram()).startsWith(GraphAsciiRenderer.ELIDED_NOTE + "\n");
        assertThat(rendered.diagram()).contains("Layer 1:  [1]\n", "1 --> 2\n").doesNotContain("[3]");
    }

    @Test
    @Tag("unit")
    void cyclicNodesAreGroupedSeparately() {
        DependencyGraph graph = sampleGraph();
        graph.addEdge(id("b.py"), id("a.py"));

        RenderedGraph rendered = new GraphAsciiRenderer(LabelMode.LETTERS, false).render(graph);

        assertThat(rendered.diagram()).contains("Cyclic:  [A]  [B]\n", "A --> B\n", "B --> A\n");
    }

    private static DependencyGraph sampleGraph() {
        DependencyGraph graph = new DependencyGraph();
        for (String path : new String[]{"a.py", "b.py", "c.py"}) {
            graph.addModule(new ModuleRecord(id(path), Path.of(path), "", Set.of(), Set.of(), Set.of()));
        }
        graph.addEdge(id("a.py"), id("b.py"));
        return graph;
    }

    private static ModuleId id(String path) {
        return new ModuleId(path);
    }
}
