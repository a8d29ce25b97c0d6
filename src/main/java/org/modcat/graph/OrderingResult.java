package org.modcat.graph;

import org.modcat.scan.ModuleId;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of ordering a {@link DependencyGraph}.
 *
 * <p>Either a topological order (no cycles) or, when the graph is cyclic, the discovery order together
 * with the detected cycles. Every module of the graph appears in {@code order} exactly once in both cases.</p>
 *
 * @param order  All modules in emission order.
 * @param cycles Detected cycles, each listed from its earliest discovered member along import direction;
 *               empty for a topological order.
 */
public record OrderingResult(List<ModuleId> order, List<List<ModuleId>> cycles) {

    public OrderingResult {
        order = List.copyOf(order);
        cycles = cycles.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
    }

    /**
     * A dependency-consistent total order.
     */
    public static OrderingResult sorted(List<ModuleId> order) {
        return new OrderingResult(order, List.of());
    }

    /**
     * The discovery-order fallback for a graph that has no consistent order.
     *
     * @throws IllegalArgumentException If no cycle is given.
     */
    public static OrderingResult fallback(List<ModuleId> discoveryOrder, List<List<ModuleId>> cycles) {
        if (cycles.isEmpty()) {
            throw new IllegalArgumentException("A fallback ordering requires at least one cycle");
        }
        return new OrderingResult(discoveryOrder, cycles);
    }

    /**
     * Checks whether the order is the discovery-order fallback.
     */
    public boolean isFallback() {
        return !cycles.isEmpty();
    }

    /**
     * Formats a cycle as {@code a.py -> b.py -> a.py}.
     */
    public static String describe(List<ModuleId> cycle) {
        if (cycle.isEmpty()) {
            return "";
        }
        return cycle.stream().map(ModuleId::path).collect(Collectors.joining(" -> "))
                + " -> " + cycle.get(0).path();
    }
}
