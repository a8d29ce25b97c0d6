package org.modcat.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.modcat.output.render.LabelMode;
import org.modcat.pipeline.ConcatOptions;
import org.modcat.scan.ScanOptions;
import org.modcat.transform.SummaryLevel;
import org.modcat.transform.SummaryRule;
import org.modcat.transform.SummaryRules;

import java.nio.file.Path;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Typed view of the {@code modcat} configuration block.
 *
 * @param options      Pipeline options.
 * @param outputFile   Target of the {@code concat} command.
 * @param notebookFile Target of the {@code notebook} command.
 */
public record ConcatSettings(ConcatOptions options, Path outputFile, Path notebookFile) {

    static final String ROOT = "modcat";

    /**
     * Reads the settings. Validation happens here, before any file is touched.
     *
     * @throws ConfigException          If a required key is missing or has the wrong type.
     * @throws IllegalArgumentException If a value is out of range (e.g. an unknown summary level).
     */
    public static ConcatSettings fromConfig(Config config) {
        Config modcat = config.getConfig(ROOT);

        Config scan = modcat.getConfig("scan");
        ScanOptions scanOptions = new ScanOptions(
                Path.of(scan.getString("root")),
                scan.getStringList("extensions"),
                scan.getStringList("exclude"),
                scan.getStringList("exclude-paths").stream().map(Path::of).collect(Collectors.toSet()));

        Config summary = modcat.getConfig("summary");
        SummaryLevel level = SummaryLevel.fromString(summary.getString("level"));
        SummaryRules rules = rules(summary);

        int maxReportedCycles = modcat.getInt("graph.max-reported-cycles");
        if (maxReportedCycles < 0) {
            throw new IllegalArgumentException("modcat.graph.max-reported-cycles must not be negative");
        }

        Config output = modcat.getConfig("output");
        ConcatOptions options = new ConcatOptions(
                scanOptions,
                level,
                rules,
                summary.getBoolean("neutralize-relative-imports"),
                maxReportedCycles,
                LabelMode.fromString(output.getString("labels")),
                output.getBoolean("remove-disconnected"));

        return new ConcatSettings(options, Path.of(output.getString("file")), Path.of(output.getString("notebook")));
    }

    /**
     * A non-empty {@code rules} list replaces the default rule set wholesale.
     */
    private static SummaryRules rules(Config summary) {
        if (!summary.hasPath("rules") || summary.getConfigList("rules").isEmpty()) {
            return SummaryRules.defaults();
        }
        SummaryRules.Builder builder = SummaryRules.builder();
        for (Config rule : summary.getConfigList("rules")) {
            SummaryLevel ruleLevel = rule.hasPath("level")
                    ? SummaryLevel.fromString(rule.getString("level"))
                    : SummaryLevel.INTERFACE;
            try {
                builder.add(SummaryRule.of(
                        rule.getString("pattern"),
                        rule.getString("replacement"),
                        rule.getString("explanation"),
                        ruleLevel));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid summary rule pattern: " + e.getMessage(), e);
            }
        }
        return builder.build();
    }
}
