package org.modcat.pipeline;

import org.modcat.graph.DependencyGraph;
import org.modcat.graph.OrderingResult;
import org.modcat.scan.ModuleId;

import java.util.Map;

/**
 * Everything produced by one run, before anything is written.
 *
 * @param graph       The dependency graph with the module table.
 * @param ordering    The emission order and any cycles.
 * @param transformed Transformed text per module.
 * @param artifact    The assembled artifact.
 */
public record PipelineResult(
        DependencyGraph graph,
        OrderingResult ordering,
        Map<ModuleId, String> transformed,
        String artifact
) {
}
