package org.modcat.output.render;

import org.modcat.graph.DependencyGraph;
import org.modcat.scan.ModuleId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders a {@link DependencyGraph} as plain text: nodes grouped into layers (a node sits one layer below
 * its deepest dependency), followed by the edge list.
 *
 * <pre>
 * Layer 1:  [A]  [B]
 * Layer 2:  [C]
 *
 * A --> C
 * B --> C
 * </pre>
 *
 * Nodes on or behind a cycle have no layer and are grouped under {@code Cyclic:}. Labels are assigned in
 * discovery order.
 */
public final class GraphAsciiRenderer {

    static final String ISOLATED_NOTE =
            "node names detached from the network and printed in isolation are non-connected/likely unused.";
    static final String ELIDED_NOTE = "non-dependent modules elided";

    private final LabelMode labelMode;
    private final boolean removeDisconnected;

    public GraphAsciiRenderer(LabelMode labelMode, boolean removeDisconnected) {
        this.labelMode = labelMode;
        this.removeDisconnected = removeDisconnected;
    }

    public RenderedGraph render(DependencyGraph graph) {
        Map<ModuleId, String> labels = new LinkedHashMap<>();
        for (ModuleId id : graph.nodes()) {
            labels.put(id, labelMode.label(labels.size()));
        }

        List<ModuleId> shown = graph.nodes().stream()
                .filter(id -> !removeDisconnected || !isIsolated(graph, id))
                .collect(Collectors.toList());

        Map<String, ModuleId> legend = new LinkedHashMap<>();
        for (ModuleId id : shown) {
            legend.put(labels.get(id), id);
        }

        StringBuilder out = new StringBuilder();
        out.append(removeDisconnected ? ELIDED_NOTE : ISOLATED_NOTE).append('\n');

        Map<ModuleId, Integer> layers = layers(graph);
        Map<Integer, List<ModuleId>> byLayer = new TreeMap<>();
        List<ModuleId> cyclic = new ArrayList<>();
        for (ModuleId id : shown) {
            Integer layer = layers.get(id);
            if (layer == null) {
                cyclic.add(id);
            } else {
                byLayer.computeIfAbsent(layer, k -> new ArrayList<>()).add(id);
            }
        }
        for (Map.Entry<Integer, List<ModuleId>> entry : byLayer.entrySet()) {
            out.append("Layer ").append(entry.getKey() + 1).append(':').append(boxes(entry.getValue(), labels)).append('\n');
        }
        if (!cyclic.isEmpty()) {
            out.append("Cyclic:").append(boxes(cyclic, labels)).append('\n');
        }

        List<DependencyGraph.Edge> edges = graph.edges();
        if (!edges.isEmpty()) {
            out.append('\n');
            for (DependencyGraph.Edge edge : edges) {
                out.append(labels.get(edge.dependency())).append(" --> ").append(labels.get(edge.dependent())).append('\n');
            }
        }

        List<ModuleId> isolated = shown.stream().filter(id -> isIsolated(graph, id)).collect(Collectors.toList());
        if (!isolated.isEmpty()) {
            out.append('\n').append("Isolated:").append(boxes(isolated, labels)).append('\n');
        }
        return new RenderedGraph(out.toString(), legend);
    }

    /**
     * Longest-path layering over the acyclic part of the graph. Nodes that are part of, or depend on,
     * a cycle are absent from the result.
     */
    private static Map<ModuleId, Integer> layers(DependencyGraph graph) {
        Map<ModuleId, Integer> pending = new HashMap<>();
        List<ModuleId> ready = new ArrayList<>();
        for (ModuleId id : graph.nodes()) {
            pending.put(id, graph.dependenciesOf(id).size());
            if (graph.dependenciesOf(id).isEmpty()) {
                ready.add(id);
            }
        }
        Map<ModuleId, Integer> layers = new HashMap<>();
        for (int i = 0; i < ready.size(); i++) {
            ModuleId current = ready.get(i);
            int layer = graph.dependenciesOf(current).stream().mapToInt(d -> layers.get(d) + 1).max().orElse(0);
            layers.put(current, layer);
            for (ModuleId dependent : graph.dependentsOf(current)) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return layers;
    }

    private static boolean isIsolated(DependencyGraph graph, ModuleId id) {
        return graph.dependenciesOf(id).isEmpty() && graph.dependentsOf(id).isEmpty();
    }

    private static String boxes(List<ModuleId> ids, Map<ModuleId, String> labels) {
        return ids.stream().map(id -> "  [" + labels.get(id) + "]").collect(Collectors.joining());
    }
}
