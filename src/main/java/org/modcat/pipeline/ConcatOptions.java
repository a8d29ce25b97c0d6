package org.modcat.pipeline;

import org.modcat.output.render.LabelMode;
import org.modcat.scan.ScanOptions;
import org.modcat.transform.SummaryLevel;
import org.modcat.transform.SummaryRules;

import java.nio.file.Path;

/**
 * Everything one pipeline run needs.
 *
 * @param scan                      What to scan.
 * @param level                     Summarization level.
 * @param rules                     Summarization rules.
 * @param neutralizeRelativeImports Whether relative imports are wrapped into inert blocks.
 * @param maxReportedCycles         Upper bound on reported cycles, 0 for all.
 * @param labelMode                 Node labels in the dependency diagram.
 * @param removeDisconnected        Whether isolated modules are left out of the diagram.
 */
public record ConcatOptions(
        ScanOptions scan,
        SummaryLevel level,
        SummaryRules rules,
        boolean neutralizeRelativeImports,
        int maxReportedCycles,
        LabelMode labelMode,
        boolean removeDisconnected
) {

    /**
     * Defaults for a root: full code, default rules, letter labels.
     */
    public static ConcatOptions defaults(Path root) {
        return new ConcatOptions(ScanOptions.of(root), SummaryLevel.NONE, SummaryRules.defaults(),
                true, 0, LabelMode.LETTERS, false);
    }

    public ConcatOptions withLevel(SummaryLevel newLevel) {
        return new ConcatOptions(scan, newLevel, rules, neutralizeRelativeImports, maxReportedCycles,
                labelMode, removeDisconnected);
    }

    public ConcatOptions withScan(ScanOptions newScan) {
        return new ConcatOptions(newScan, level, rules, neutralizeRelativeImports, maxReportedCycles,
                labelMode, removeDisconnected);
    }

    public ConcatOptions withLabelMode(LabelMode newLabelMode) {
        return new ConcatOptions(scan, level, rules, neutralizeRelativeImports, maxReportedCycles,
                newLabelMode, removeDisconnected);
    }

    public ConcatOptions withRemoveDisconnected(boolean remove) {
        return new ConcatOptions(scan, level, rules, neutralizeRelativeImports, maxReportedCycles,
                labelMode, remove);
    }
}
