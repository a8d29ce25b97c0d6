package org.modcat.cli.commands;

import java.util.concurrent.Callable;

import org.modcat.cli.CommandLineInterface;
import org.modcat.cli.config.ConcatSettings;
import org.modcat.pipeline.ConcatPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "report",
    description = "Print a dependency analysis report of the source tree"
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @Mixin
    private SourceOptions sourceOptions;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try {
            ConcatSettings settings = ConcatSettings.fromConfig(parent.getConfig());
            String report = new ConcatPipeline(sourceOptions.applyTo(settings.options())).dependencyReport();
            spec.commandLine().getOut().print(report);
            spec.commandLine().getOut().flush();
            return 0;
        } catch (Exception e) {
            log.error("Report failed: {}", e.getMessage());
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
