package com.netcracker.core.provisioning.graph;

import com.netcracker.core.provisioning.model.ResourceAddress;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Acyclic dependency graph of resource nodes. An edge {@code source -> target} means the target
 * must be applied before the source and deleted after it.
 */
public final class DependencyGraph {
    private final SortedMap<ResourceAddress, SortedSet<ResourceAddress>> dependencies;
    private final SortedMap<ResourceAddress, SortedSet<ResourceAddress>> dependents;

    DependencyGraph(SortedMap<ResourceAddress, SortedSet<ResourceAddress>> dependencies) {
        this.dependencies = freeze(dependencies);
        SortedMap<ResourceAddress, SortedSet<ResourceAddress>> reverse = new TreeMap<>();
        dependencies.keySet().forEach(address -> reverse.put(address, new TreeSet<>()));
        dependencies.forEach((source, targets) -> targets.forEach(target -> reverse.get(target).add(source)));
        this.dependents = freeze(reverse);
    }

    public Set<ResourceAddress> nodes() {
        return dependencies.keySet();
    }

    public boolean contains(ResourceAddress address) {
        return dependencies.containsKey(address);
    }

    /**
     * Addresses the given node directly depends on.
     */
    public SortedSet<ResourceAddress> dependenciesOf(ResourceAddress address) {
        return dependencies.getOrDefault(address, Collections.emptySortedSet());
    }

    /**
     * Addresses that directly depend on the given node.
     */
    public SortedSet<ResourceAddress> dependentsOf(ResourceAddress address) {
        return dependents.getOrDefault(address, Collections.emptySortedSet());
    }

    /**
     * Every node reachable from the given one by following dependent edges, excluding the node itself.
     */
    public Set<ResourceAddress> transitiveDependentsOf(ResourceAddress address) {
        Set<ResourceAddress> reached = new TreeSet<>();
        List<ResourceAddress> queue = new ArrayList<>(dependentsOf(address));
        while (!queue.isEmpty()) {
            ResourceAddress next = queue.remove(queue.size() - 1);
            if (reached.add(next)) {
                queue.addAll(dependentsOf(next));
            }
        }
        return reached;
    }

    /**
     * Topological order with dependencies first. Independent nodes are ordered by address.
     */
    public List<ResourceAddress> applyOrder() {
        Map<ResourceAddress, Integer> remaining = new HashMap<>();
        PriorityQueue<ResourceAddress> ready = new PriorityQueue<>();
        dependencies.forEach((address, targets) -> {
            remaining.put(address, targets.size());
            if (targets.isEmpty()) {
                ready.add(address);
            }
        });
        List<ResourceAddress> order = new ArrayList<>(dependencies.size());
        while (!ready.isEmpty()) {
            ResourceAddress next = ready.poll();
            order.add(next);
            for (ResourceAddress dependent : dependentsOf(next)) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        return Collections.unmodifiableList(order);
    }

    /**
     * Reverse of {@link #applyOrder()}: dependents are deleted before what they depend on.
     */
    public List<ResourceAddress> destroyOrder() {
        List<ResourceAddress> order = new ArrayList<>(applyOrder());
        Collections.reverse(order);
        return Collections.unmodifiableList(order);
    }

    private static SortedMap<ResourceAddress, SortedSet<ResourceAddress>> freeze(
            SortedMap<ResourceAddress, SortedSet<ResourceAddress>> edges) {
        SortedMap<ResourceAddress, SortedSet<ResourceAddress>> copy = new TreeMap<>();
        edges.forEach((k, v) -> copy.put(k, Collections.unmodifiableSortedSet(new TreeSet<>(v))));
        return Collections.unmodifiableSortedMap(copy);
    }
}
