package org.modcat.graph;

import org.modcat.scan.ModuleId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the simple cycles of a {@link DependencyGraph} (Johnson's algorithm).
 *
 * <p>Cycles follow import direction: in {@code [a, b]} module {@code a} imports {@code b} and {@code b}
 * imports {@code a}. Start vertices are visited in discovery order and each cycle is reported once,
 * rooted at its earliest discovered member, so the result is deterministic for an unchanged input.</p>
 */
final class CycleFinder {

    private final DependencyGraph graph;
    private final int limit;
    private final List<List<ModuleId>> cycles = new ArrayList<>();

    private final Set<ModuleId> blocked = new HashSet<>();
    private final Map<ModuleId, Set<ModuleId>> blockedBy = new HashMap<>();
    private final Deque<ModuleId> stack = new ArrayDeque<>();

    private ModuleId start;
    private Set<ModuleId> component;

    /**
     * @param graph The graph to search.
     * @param limit Maximum number of cycles to collect, 0 for all.
     */
    CycleFinder(DependencyGraph graph, int limit) {
        this.graph = graph;
        this.limit = limit;
    }

    /**
     * Runs the search.
     *
     * @return The simple cycles found, at most {@code limit} unless the limit is 0.
     */
    List<List<ModuleId>> findCycles() {
        List<ModuleId> nodes = graph.nodes();
        for (int s = 0; s < nodes.size() && !limitReached(); s++) {
            start = nodes.get(s);
            component = componentOf(start, s);
            if (component.size() < 2) {
                continue;
            }
            blocked.clear();
            blockedBy.clear();
            circuit(start);
        }
        return cycles;
    }

    private boolean circuit(ModuleId v) {
        boolean found = false;
        stack.push(v);
        blocked.add(v);

        for (ModuleId w : graph.dependenciesOf(v)) {
            if (limitReached()) break;
            if (!component.contains(w)) continue;
            if (w.equals(start)) {
                List<ModuleId> cycle = new ArrayList<>(stack);
                Collections.reverse(cycle);
                cycles.add(cycle);
                found = true;
            } else if (!blocked.contains(w) && circuit(w)) {
                found = true;
            }
        }

        if (found) {
            unblock(v);
        } else {
            for (ModuleId w : graph.dependenciesOf(v)) {
                if (component.contains(w)) {
                    blockedBy.computeIfAbsent(w, k -> new HashSet<>()).add(v);
                }
            }
        }
        stack.pop();
        return found;
    }

    private void unblock(ModuleId u) {
        blocked.remove(u);
        Set<ModuleId> waiting = blockedBy.remove(u);
        if (waiting == null) return;
        for (ModuleId w : waiting) {
            if (blocked.contains(w)) {
                unblock(w);
            }
        }
    }

    /**
     * Strongly connected component of {@code s} within the subgraph of nodes discovered at or after {@code s}.
     */
    private Set<ModuleId> componentOf(ModuleId s, int minIndex) {
        Set<ModuleId> forward = reachable(s, minIndex, true);
        Set<ModuleId> backward = reachable(s, minIndex, false);
        forward.retainAll(backward);
        return forward;
    }

    private Set<ModuleId> reachable(ModuleId from, int minIndex, boolean alongImports) {
        Set<ModuleId> seen = new LinkedHashSet<>();
        Deque<ModuleId> pending = new ArrayDeque<>();
        pending.add(from);
        seen.add(from);
        while (!pending.isEmpty()) {
            ModuleId current = pending.poll();
            Set<ModuleId> next = alongImports ? graph.dependenciesOf(current) : graph.dependentsOf(current);
            for (ModuleId n : next) {
                if (graph.discoveryIndex(n) >= minIndex && seen.add(n)) {
                    pending.add(n);
                }
            }
        }
        return seen;
    }

    private boolean limitReached() {
        return limit > 0 && cycles.size() >= limit;
    }
}
