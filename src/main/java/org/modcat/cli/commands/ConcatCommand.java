package org.modcat.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.modcat.cli.CommandLineInterface;
import org.modcat.cli.config.ConcatSettings;
import org.modcat.graph.DependencyGraph;
import org.modcat.graph.OrderingResult;
import org.modcat.pipeline.ConcatOptions;
import org.modcat.pipeline.ConcatPipeline;
import org.modcat.pipeline.PipelineResult;
import org.modcat.scan.ModuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that writes the concatenated, dependency-ordered source file.
 * <p>
 * Prints the resolved order (with each module's direct dependencies) or, for a cyclic tree,
 * the detected cycles.
 */
@Command(
    name = "concat",
    description = "Concatenate all modules into one file, dependencies first"
)
public class ConcatCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConcatCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @Option(
        names = {"-o", "--output"},
        description = "Output file (default: modcat.output.file, 'combined.py')"
    )
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ConcatSettings settings = ConcatSettings.fromConfig(parent.getConfig());
            ConcatOptions options = sourceOptions.applyTo(settings.options());
            Path target = output != null ? output : settings.outputFile();

            PipelineResult result = new ConcatPipeline(options).writeConcatFile(target);

            printResolution(out, result.graph(), result.ordering());
            out.printf("Generated %s version: %s%n", options.level().value(), target.toAbsolutePath().normalize());
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Concatenation failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    static void printResolution(PrintWriter out, DependencyGraph graph, OrderingResult ordering) {
        if (ordering.isFallback()) {
            out.println("Warning: Circular dependencies detected:");
            for (List<ModuleId> cycle : ordering.cycles()) {
                out.println("  " + OrderingResult.describe(cycle));
            }
            out.println("Using discovery order instead.");
            return;
        }
        out.println("Dependency Resolution:");
        List<ModuleId> order = ordering.order();
        for (int i = 0; i < order.size(); i++) {
            ModuleId id = order.get(i);
            out.printf("%d. %s%n", i + 1, id);
            if (!graph.dependenciesOf(id).isEmpty()) {
                out.println("   Depends on: " + String.join(", ",
                        graph.dependenciesOf(id).stream().map(ModuleId::path).toList()));
            }
        }
    }
}
