package org.modcat.graph;

import org.modcat.scan.ModuleId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orders a {@link DependencyGraph} so that every dependency precedes its dependents.
 *
 * <p>Kahn's algorithm with a ready queue keyed by discovery index: among modules whose dependencies are
 * all emitted, the earliest discovered goes first. Output is therefore identical across runs on the same
 * input.</p>
 *
 * <p>A cyclic graph does not fail the run. The cycles are enumerated for diagnostics and the modules are
 * emitted in plain discovery order instead.</p>
 */
public final class TopologicalOrderer {

    private static final Logger log = LoggerFactory.getLogger(TopologicalOrderer.class);

    private final int maxReportedCycles;

    public TopologicalOrderer() {
        this(0);
    }

    /**
     * @param maxReportedCycles Upper bound on enumerated cycles, 0 for no bound.
     */
    public TopologicalOrderer(int maxReportedCycles) {
        if (maxReportedCycles < 0) {
            throw new IllegalArgumentException("maxReportedCycles must not be negative: " + maxReportedCycles);
        }
        this.maxReportedCycles = maxReportedCycles;
    }

    public OrderingResult order(DependencyGraph graph) {
        Map<ModuleId, Integer> pending = new HashMap<>();
        PriorityQueue<ModuleId> ready = new PriorityQueue<>(Comparator.comparingInt(graph::discoveryIndex));

        for (ModuleId id : graph.nodes()) {
            int count = graph.dependenciesOf(id).size();
            pending.put(id, count);
            if (count == 0) {
                ready.add(id);
            }
        }

        List<ModuleId> sorted = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            ModuleId current = ready.poll();
            sorted.add(current);
            for (ModuleId dependent : graph.dependentsOf(current)) {
                int remaining = pending.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() == graph.size()) {
            if (log.isDebugEnabled()) {
                for (int i = 0; i < sorted.size(); i++) {
                    log.debug("{}. {}", i + 1, sorted.get(i));
                }
            }
            return OrderingResult.sorted(sorted);
        }

        List<List<ModuleId>> cycles = new CycleFinder(graph, maxReportedCycles).findCycles();
        log.warn("Circular dependencies detected ({} cycle(s)):", cycles.size());
        for (List<ModuleId> cycle : cycles) {
            log.warn("  {}", OrderingResult.describe(cycle));
        }
        log.warn("Using discovery order instead.");
        return OrderingResult.fallback(graph.nodes(), cycles);
    }
}
