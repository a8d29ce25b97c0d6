package org.modcat.pipeline;

import org.modcat.graph.DependencyGraph;
import org.modcat.graph.DependencyGraphBuilder;
import org.modcat.graph.OrderingResult;
import org.modcat.graph.TopologicalOrderer;
import org.modcat.io.ArtifactWriter;
import org.modcat.output.ArtifactBanner;
import org.modcat.output.DependencyReport;
import org.modcat.output.OutputAssembler;
import org.modcat.output.notebook.NotebookWriter;
import org.modcat.output.render.DirectoryTreeRenderer;
import org.modcat.output.render.GraphAsciiRenderer;
import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;
import org.modcat.scan.ModuleScanner;
import org.modcat.transform.ContentTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs scan, graph building, ordering, transformation and assembly for one source tree.
 *
 * <p>Each run starts from scratch; nothing is cached between runs. Artifacts are assembled completely
 * in memory and only then written, so a failing run leaves no partial output behind.</p>
 */
public final class ConcatPipeline {

    private static final Logger log = LoggerFactory.getLogger(ConcatPipeline.class);

    static final String NOTEBOOK_TITLE = "## Notebook generated by " + ArtifactBanner.TOOL_NAME;

    private final ConcatOptions options;
    private final ModuleScanner scanner;
    private final ArtifactBanner banner;
    private final OutputAssembler assembler;

    public ConcatPipeline(ConcatOptions options) {
        this(options, new ModuleScanner(options.scan()), Clock.systemDefaultZone());
    }

    public ConcatPipeline(ConcatOptions options, ModuleScanner scanner, Clock clock) {
        this.options = options;
        this.scanner = scanner;
        this.banner = new ArtifactBanner(clock);
        this.assembler = new OutputAssembler(banner,
                new GraphAsciiRenderer(options.labelMode(), options.removeDisconnected()),
                new DirectoryTreeRenderer());
    }

    /**
     * Runs the pipeline without writing anything.
     *
     * @throws IOException If the source tree cannot be walked or a module cannot be read.
     */
    public PipelineResult run() throws IOException {
        List<ModuleRecord> records = scanner.scanAll();
        log.debug("Building dependency graph for {} modules", records.size());
        DependencyGraph graph = new DependencyGraphBuilder(options.scan().extensions()).build(records);
        OrderingResult ordering = new TopologicalOrderer(options.maxReportedCycles()).order(graph);

        ContentTransformer transformer = new ContentTransformer(options.rules(), options.neutralizeRelativeImports());
        Map<ModuleId, String> transformed = new LinkedHashMap<>();
        for (ModuleId id : ordering.order()) {
            transformed.put(id, transformer.transform(graph.module(id).content(), options.level()));
        }

        String artifact = assembler.assemble(options.scan().root(), graph, ordering, transformed, options.level());
        return new PipelineResult(graph, ordering, transformed, artifact);
    }

    /**
     * Runs the pipeline and writes the concatenated artifact.
     *
     * @param output The target file.
     * @return The run's result.
     */
    public PipelineResult writeConcatFile(Path output) throws IOException {
        PipelineResult result = run();
        Path written = ArtifactWriter.write(output, result.artifact());
        log.info("Generated {} version: {}", options.level().value(), written);
        return result;
    }

    /**
     * Runs the pipeline and writes the artifact wrapped into a notebook.
     *
     * @param output The target {@code .ipynb} file.
     * @return The run's result.
     */
    public PipelineResult writeNotebook(Path output) throws IOException {
        PipelineResult result = run();
        String json = new NotebookWriter().toJson(NOTEBOOK_TITLE, result.artifact(), banner.lines());
        Path written = ArtifactWriter.write(output, json);
        log.info("Generated notebook version: {}", written);
        return result;
    }

    /**
     * Scans and orders the tree and renders the dependency report. Module bodies are not transformed.
     */
    public String dependencyReport() throws IOException {
        List<ModuleRecord> records = scanner.scanAll();
        DependencyGraph graph = new DependencyGraphBuilder(options.scan().extensions()).build(records);
        OrderingResult ordering = new TopologicalOrderer(options.maxReportedCycles()).order(graph);
        return new DependencyReport(assembler).render(options.scan().root(), graph, ordering);
    }

    public ConcatOptions options() {
        return options;
    }
}
