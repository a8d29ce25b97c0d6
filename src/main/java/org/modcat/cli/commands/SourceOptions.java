package org.modcat.cli.commands;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.modcat.output.render.LabelMode;
import org.modcat.pipeline.ConcatOptions;
import org.modcat.scan.ScanOptions;
import org.modcat.transform.SummaryLevel;

import picocli.CommandLine.Option;

/**
 * Options shared by all commands that scan a source tree. Unset options keep the configured values;
 * exclusions given here are added to the configured ones.
 */
public class SourceOptions {

    @Option(
        names = {"-s", "--source"},
        description = "Source directory to scan (default: modcat.scan.root, 'src')"
    )
    Path source;

    @Option(
        names = {"-l", "--level"},
        description = "Summary level: none, interface, core (default: modcat.summary.level, 'none')"
    )
    String level;

    @Option(
        names = {"-x", "--exclude"},
        description = "Skip modules whose path contains this substring (repeatable)"
    )
    List<String> excludes = new ArrayList<>();

    @Option(
        names = {"--labels"},
        description = "Node labels in the dependency diagram: letters, numbers"
    )
    String labels;

    @Option(
        names = {"--remove-disconnected"},
        description = "Leave modules without any dependency relation out of the diagram"
    )
    boolean removeDisconnected;

    /**
     * Applies the given command line values on top of the configured options.
     *
     * @throws IllegalArgumentException For an unknown level or label mode.
     */
    ConcatOptions applyTo(ConcatOptions configured) {
        ConcatOptions result = configured;
        if (source != null) {
            result = result.withScan(new ScanOptions(source, result.scan().extensions(),
                    result.scan().excludes(), result.scan().excludedPaths()));
        }
        if (!excludes.isEmpty()) {
            List<String> all = new ArrayList<>(result.scan().excludes());
            all.addAll(excludes);
            result = result.withScan(result.scan().withExcludes(all));
        }
        if (level != null) {
            result = result.withLevel(SummaryLevel.fromString(level));
        }
        if (labels != null) {
            result = result.withLabelMode(LabelMode.fromString(labels));
        }
        if (removeDisconnected) {
            result = result.withRemoveDisconnected(true);
        }
        return result;
    }
}
