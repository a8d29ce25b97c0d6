package org.modcat.output;

import org.modcat.graph.DependencyGraph;
import org.modcat.graph.OrderingResult;
import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Human-readable analysis of a scan: diagram, statistics, dependency chains (or cycles) and per-module
 * declarations.
 */
public final class DependencyReport {

    private final OutputAssembler assembler;

    public DependencyReport(OutputAssembler assembler) {
        this.assembler = assembler;
    }

    public String render(Path root, DependencyGraph graph, OrderingResult ordering) {
        List<String> report = new ArrayList<>();
        report.add("Dependency Analysis Report");
        report.add("=".repeat(26));
        report.add("");
        report.add(assembler.visualization(root, graph));

        report.add("Module Statistics:");
        report.add("Total modules: " + graph.size());
        report.add("Total dependencies: " + graph.edgeCount());
        report.add("");

        report.add("Dependency Chains:");
        report.add("-".repeat(18));
        if (ordering.isFallback()) {
            report.add("Warning: Circular dependencies detected!");
            report.add("Cycles found:");
            for (List<ModuleId> cycle : ordering.cycles()) {
                report.add("  " + OrderingResult.describe(cycle));
            }
        } else {
            List<ModuleId> order = ordering.order();
            for (int i = 0; i < order.size(); i++) {
                ModuleId id = order.get(i);
                report.add((i + 1) + ". " + id);
                if (!graph.dependenciesOf(id).isEmpty()) {
                    report.add("   Depends on: " + join(graph.dependenciesOf(id)));
                }
            }
        }
        report.add("");

        report.add("Module Details:");
        report.add("-".repeat(15));
        for (ModuleRecord module : graph.modules()) {
            report.add("");
            report.add(module.id() + ":");
            report.add("Classes: " + orNone(module.types()));
            report.add("Functions: " + orNone(module.callables()));
            report.add("Imports: " + orNone(module.imports()));
        }
        return String.join("\n", report) + "\n";
    }

    private static String join(Collection<ModuleId> ids) {
        return ids.stream().map(ModuleId::path).collect(Collectors.joining(", "));
    }

    private static String orNone(Collection<String> names) {
        return names.isEmpty() ? "None" : String.join(", ", names);
    }
}
