package com.netcracker.core.provisioning.graph;

import com.netcracker.core.provisioning.exception.CycleException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.resolve.Reference;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges implicit (attribute) and explicit ({@code depends_on}) references into one graph and rejects cycles.
 */
@ApplicationScoped
@Slf4j
public class DependencyGraphBuilder {

    public DependencyGraph build(Collection<ResourceAddress> nodes, Collection<Reference> references) {
        SortedMap<ResourceAddress, SortedSet<ResourceAddress>> edges = new TreeMap<>();
        nodes.forEach(address -> edges.put(address, new TreeSet<>()));
        for (Reference reference : references) {
            SortedSet<ResourceAddress> targets = edges.get(reference.source());
            if (targets == null || !edges.containsKey(reference.target())) {
                throw new IllegalArgumentException("Reference " + reference + " points outside of the node set");
            }
            targets.add(reference.target());
        }
        detectCycle(edges);
        log.debug("Built dependency graph with {} nodes and {} edges", edges.size(), references.size());
        return new DependencyGraph(edges);
    }

    /**
     * Depth-first traversal with explicit stack and three-color marking. A gray node met again is on
     * the current path, so the path from it to the top of the stack is a cycle.
     */
    private void detectCycle(SortedMap<ResourceAddress, SortedSet<ResourceAddress>> edges) {
        Map<ResourceAddress, Color> colors = new HashMap<>();
        for (ResourceAddress start : edges.keySet()) {
            if (colors.getOrDefault(start, Color.WHITE) != Color.WHITE) {
                continue;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(start, edges.get(start).iterator()));
            colors.put(start, Color.GRAY);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.targets().hasNext()) {
                    colors.put(frame.address(), Color.BLACK);
                    stack.pop();
                    continue;
                }
                ResourceAddress next = frame.targets().next();
                Color color = colors.getOrDefault(next, Color.WHITE);
                if (color == Color.GRAY) {
                    throw new CycleException(cyclePath(stack, next));
                }
                if (color == Color.WHITE) {
                    colors.put(next, Color.GRAY);
                    stack.push(new Frame(next, edges.get(next).iterator()));
                }
            }
        }
    }

    private static List<ResourceAddress> cyclePath(Deque<Frame> stack, ResourceAddress repeated) {
        List<ResourceAddress> path = new ArrayList<>();
        Iterator<Frame> fromBottom = stack.descendingIterator();
        boolean onCycle = false;
        while (fromBottom.hasNext()) {
            ResourceAddress address = fromBottom.next().address();
            onCycle |= address.equals(repeated);
            if (onCycle) {
                path.add(address);
            }
        }
        path.add(repeated);
        return path;
    }

    private enum Color {
        WHITE,
        GRAY,
        BLACK
    }

    private record Frame(ResourceAddress address, Iterator<ResourceAddress> targets) {}
}
