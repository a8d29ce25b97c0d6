package org.modcat.output;

import org.modcat.graph.DependencyGraph;
import org.modcat.graph.OrderingResult;
import org.modcat.output.render.DirectoryTreeRenderer;
import org.modcat.output.render.GraphAsciiRenderer;
import org.modcat.output.render.RenderedGraph;
import org.modcat.scan.ModuleId;
import org.modcat.transform.SummaryLevel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds the concatenated artifact in memory.
 *
 * <p>Section order is fixed:</p>
 * <ol>
 *   <li>banner with generation level</li>
 *   <li>an inert string block with the directory structure, the dependency diagram and an import summary</li>
 *   <li>the sorted external imports, one {@code import} line each</li>
 *   <li>every module in ordering order: a {@code # From <path>} provenance line, then its transformed text</li>
 * </ol>
 */
public final class OutputAssembler {

    static final String BLOCK_DELIMITER = "\"\"\"";

    private final ArtifactBanner banner;
    private final GraphAsciiRenderer graphRenderer;
    private final DirectoryTreeRenderer treeRenderer;

    public OutputAssembler(ArtifactBanner banner, GraphAsciiRenderer graphRenderer, DirectoryTreeRenderer treeRenderer) {
        this.banner = banner;
        this.graphRenderer = graphRenderer;
        this.treeRenderer = treeRenderer;
    }

    /**
     * Assembles the artifact.
     *
     * @param root        The scan root, for the directory listing.
     * @param graph       The dependency graph with the module table.
     * @param ordering    The emission order.
     * @param transformed Transformed text per module.
     * @param level       The summarization level used, for the banner.
     * @return The complete artifact text.
     * @throws IllegalStateException If a module of the ordering has no transformed text.
     */
    public String assemble(Path root, DependencyGraph graph, OrderingResult ordering,
                           Map<ModuleId, String> transformed, SummaryLevel level) {
        List<String> output = new ArrayList<>();
        output.add(banner.header(level));
        output.add(BLOCK_DELIMITER);
        output.add(visualization(root, graph));
        output.add(BLOCK_DELIMITER);

        output.add("# External imports");
        for (String imported : ImportClassifier.of(graph.modules()).externalImports(graph.modules())) {
            output.add("import " + imported);
        }
        output.add("\n# Combined module code\n");

        for (ModuleId id : ordering.order()) {
            String content = transformed.get(id);
            if (content == null) {
                throw new IllegalStateException("No transformed content for module " + id);
            }
            output.add("\n# From " + id.path());
            output.add(content);
        }
        return String.join("\n", output);
    }

    /**
     * The dependency-structure block: directory listing, legend, diagram and import summary.
     */
    public String visualization(Path root, DependencyGraph graph) {
        RenderedGraph rendered = graphRenderer.render(graph);
        StringBuilder out = new StringBuilder();
        out.append("Directory Structure:\n")
                .append(treeRenderer.render(root, graph.nodes()))
                .append('\n')
                .append("Module Dependencies:\n\n")
                .append(rendered.legendText()).append('\n')
                .append(rendered.diagram())
                .append('\n')
                .append("Import Summary:\n")
                .append(importSummary(graph));
        return out.toString();
    }

    private static String importSummary(DependencyGraph graph) {
        ImportClassifier classifier = ImportClassifier.of(graph.modules());
        SortedSet<String> external = classifier.externalImports(graph.modules());
        SortedSet<String> internal = new TreeSet<>(ImportClassifier.absoluteImports(graph.modules()));
        internal.removeAll(external);
        internal.addAll(ImportClassifier.relativeImports(graph.modules()));
        return "    External Dependencies:\n    " + String.join(", ", external) + "\n\n"
                + "    Internal Dependencies:\n    " + String.join(", ", internal) + "\n";
    }
}
