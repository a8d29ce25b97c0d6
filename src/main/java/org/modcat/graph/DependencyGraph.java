package org.modcat.graph;

import org.modcat.scan.ModuleId;
import org.modcat.scan.ModuleRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Module table plus the directed "dependency before dependent" relation between its entries.
 *
 * <p>Records live in a single table keyed by {@link ModuleId}; adjacency is kept as key sets only.
 * Insertion order of the table is the discovery order, which the orderer uses for tie-breaking and
 * as cycle fallback.</p>
 */
public final class DependencyGraph {

    /**
     * A directed edge: {@code dependency} must be emitted before {@code dependent}.
     */
    public record Edge(ModuleId dependency, ModuleId dependent) {

        @Override
        public String toString() {
            return dependency + " -> " + dependent;
        }
    }

    private final Map<ModuleId, ModuleRecord> modules = new LinkedHashMap<>();
    private final Map<ModuleId, Integer> discoveryIndex = new LinkedHashMap<>();
    private final Map<ModuleId, Set<ModuleId>> dependents = new LinkedHashMap<>();
    private final Map<ModuleId, Set<ModuleId>> dependencies = new LinkedHashMap<>();
    private int edgeCount;

    /**
     * Adds a module as a node. Adding the same identity twice keeps the first record.
     *
     * @return {@code true} if the module was new.
     */
    public boolean addModule(ModuleRecord record) {
        if (modules.containsKey(record.id())) {
            return false;
        }
        modules.put(record.id(), record);
        discoveryIndex.put(record.id(), discoveryIndex.size());
        dependents.put(record.id(), new LinkedHashSet<>());
        dependencies.put(record.id(), new LinkedHashSet<>());
        return true;
    }

    /**
     * Adds the edge {@code dependency -> dependent}. Inserting an existing edge is a no-op.
     *
     * @return {@code true} if the edge was new.
     * @throws IllegalArgumentException If either end is not a known module, or both ends are the same module.
     */
    public boolean addEdge(ModuleId dependency, ModuleId dependent) {
        requireKnown(dependency);
        requireKnown(dependent);
        if (dependency.equals(dependent)) {
            throw new IllegalArgumentException("Module cannot depend on itself: " + dependency);
        }
        if (!dependents.get(dependency).add(dependent)) {
            return false;
        }
        dependencies.get(dependent).add(dependency);
        edgeCount++;
        return true;
    }

    public boolean contains(ModuleId id) {
        return modules.containsKey(id);
    }

    public ModuleRecord module(ModuleId id) {
        return modules.get(id);
    }

    /**
     * Returns all records in discovery order.
     */
    public Collection<ModuleRecord> modules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    /**
     * Returns all module identities in discovery order.
     */
    public List<ModuleId> nodes() {
        return List.copyOf(modules.keySet());
    }

    /**
     * Returns the position at which the module was added, or -1 for unknown modules.
     */
    public int discoveryIndex(ModuleId id) {
        return discoveryIndex.getOrDefault(id, -1);
    }

    /**
     * Modules that must be emitted before the given one (the modules it imports).
     */
    public Set<ModuleId> dependenciesOf(ModuleId id) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(id, Set.of()));
    }

    /**
     * Modules that must be emitted after the given one (the modules importing it).
     */
    public Set<ModuleId> dependentsOf(ModuleId id) {
        return Collections.unmodifiableSet(dependents.getOrDefault(id, Set.of()));
    }

    /**
     * Returns all edges, grouped by dependency in discovery order.
     */
    public List<Edge> edges() {
        List<Edge> result = new ArrayList<>(edgeCount);
        for (Map.Entry<ModuleId, Set<ModuleId>> entry : dependents.entrySet()) {
            for (ModuleId dependent : entry.getValue()) {
                result.add(new Edge(entry.getKey(), dependent));
            }
        }
        return result;
    }

    public boolean hasEdge(ModuleId dependency, ModuleId dependent) {
        return dependents.getOrDefault(dependency, Set.of()).contains(dependent);
    }

    public int size() {
        return modules.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    private void requireKnown(ModuleId id) {
        if (!modules.containsKey(id)) {
            throw new IllegalArgumentException("Unknown module: " + id);
        }
    }
}
