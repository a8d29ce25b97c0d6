package org.modcat.cli.commands;

import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.modcat.cli.CommandLineInterface;
import org.modcat.cli.config.ConcatSettings;
import org.modcat.pipeline.ConcatOptions;
import org.modcat.pipeline.ConcatPipeline;
import org.modcat.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that writes the concatenated source as the code cell of a Jupyter notebook.
 */
@Command(
    name = "notebook",
    description = "Write the concatenated modules as a Jupyter notebook"
)
public class NotebookCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NotebookCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @Option(
        names = {"-o", "--output"},
        description = "Notebook file (default: modcat.output.notebook, 'combined.ipynb')"
    )
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            ConcatSettings settings = ConcatSettings.fromConfig(parent.getConfig());
            ConcatOptions options = sourceOptions.applyTo(settings.options());
            Path target = output != null ? output : settings.notebookFile();

            PipelineResult result = new ConcatPipeline(options).writeNotebook(target);

            spec.commandLine().getOut().printf("Generated notebook with %d modules: %s%n",
                    result.ordering().order().size(), target.toAbsolutePath().normalize());
            spec.commandLine().getOut().flush();
            return 0;

        } catch (Exception e) {
            log.error("Notebook generation failed: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
