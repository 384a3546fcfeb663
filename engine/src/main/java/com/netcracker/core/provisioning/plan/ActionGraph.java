package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.exception.CycleException;
import com.netcracker.core.provisioning.graph.DependencyGraph;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns resource changes into actions and orders them.
 * <ul>
 *     <li>creates, updates and no-ops wait for the apply step of every node they depend on;</li>
 *     <li>a delete waits for the deletes of objects that depended on the deleted one, as recorded in state,
 *     and for the apply step of desired nodes that used to depend on it;</li>
 *     <li>create-before-destroy: the old object is deleted after the replacement exists and every dependent
 *     has been rewired to it;</li>
 *     <li>destroy-before-create: the replacement is created after the old object is deleted.</li>
 * </ul>
 */
final class ActionGraph {
    private final DependencyGraph graph;
    private final List<ResourceChange> changes;
    private final StateSnapshot state;

    private final Map<ResourceAddress, ResourceChange> desiredChanges = new HashMap<>();
    private final Map<ActionId, Action> actions = new LinkedHashMap<>();

    ActionGraph(DependencyGraph graph, List<ResourceChange> changes, StateSnapshot state) {
        this.graph = graph;
        this.changes = changes;
        this.state = state;
        for (ResourceChange change : changes) {
            if (change.desired() != null) {
                desiredChanges.put(change.address(), change);
            }
        }
    }

    List<Action> linearize() {
        for (ResourceChange change : changes) {
            switch (change.type()) {
                case CREATE -> add(ActionId.create(change.address()), change, applyDependencies(change));
                case UPDATE -> add(ActionId.update(change.address()), change, applyDependencies(change));
                case NOOP -> add(ActionId.noop(change.address()), change, applyDependencies(change));
                case DELETE -> add(deleteId(change), change, deleteDependencies(change));
                case REPLACE -> addReplace(change);
            }
        }
        return sort();
    }

    private void addReplace(ResourceChange change) {
        ActionId create = ActionId.create(change.address());
        ActionId delete = deleteId(change);
        SortedSet<ActionId> createDependencies = applyDependencies(change);
        SortedSet<ActionId> deleteDependencies = deleteDependencies(change);
        if (change.isCreateBeforeDestroy()) {
            deleteDependencies.add(create);
        } else {
            createDependencies.add(delete);
        }
        add(create, change, createDependencies);
        add(delete, change, deleteDependencies);
    }

    private void add(ActionId id, ResourceChange change, SortedSet<ActionId> dependsOn) {
        actions.put(id, new Action(id, change, dependsOn));
    }

    private SortedSet<ActionId> applyDependencies(ResourceChange change) {
        SortedSet<ActionId> dependsOn = new TreeSet<>();
        for (ResourceAddress target : change.dependencies()) {
            dependsOn.add(applyId(desiredChanges.get(target)));
        }
        return dependsOn;
    }

    private SortedSet<ActionId> deleteDependencies(ResourceChange change) {
        SortedSet<ActionId> dependsOn = new TreeSet<>();
        ResourceAddress address = change.address();

        if (change.isDeposed() || change.isCreateBeforeDestroy()) {
            // the old object goes away only once everything depending on the address points at the new one
            for (ResourceAddress dependent : graph.contains(address) ? graph.dependentsOf(address) : List.<ResourceAddress>of()) {
                dependsOn.add(applyId(desiredChanges.get(dependent)));
            }
        }
        if (change.isDeposed()) {
            return dependsOn;
        }

        for (ResourceState other : state.getResources().values()) {
            if (!other.dependencies().contains(address)) {
                continue;
            }
            ResourceChange otherChange = desiredChanges.get(other.address());
            if (otherChange == null) {
                dependsOn.add(ActionId.delete(other.address(), other.id()));
            } else if (otherChange.type() == ChangeType.REPLACE) {
                dependsOn.add(ActionId.delete(other.address(), other.id()));
            } else if (!otherChange.dependencies().contains(address)) {
                dependsOn.add(applyId(otherChange));
            }
        }
        return dependsOn;
    }

    private static ActionId applyId(ResourceChange change) {
        return switch (change.type()) {
            case CREATE, REPLACE -> ActionId.create(change.address());
            case UPDATE -> ActionId.update(change.address());
            case NOOP -> ActionId.noop(change.address());
            case DELETE -> throw new IllegalArgumentException("Delete of " + change.address() + " has no apply step");
        };
    }

    private static ActionId deleteId(ResourceChange change) {
        return ActionId.delete(change.address(), change.removedObjectId());
    }

    /**
     * Kahn's algorithm; ties are broken by action id so equal inputs give equal plans.
     */
    private List<Action> sort() {
        Map<ActionId, Integer> remaining = new HashMap<>();
        Map<ActionId, List<ActionId>> dependents = new TreeMap<>();
        PriorityQueue<ActionId> ready = new PriorityQueue<>();
        for (Action action : actions.values()) {
            int count = 0;
            for (ActionId dependency : action.dependsOn()) {
                if (!actions.containsKey(dependency)) {
                    throw new IllegalStateException("Action " + action.id() + " depends on unknown action " + dependency);
                }
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(action.id());
                count++;
            }
            remaining.put(action.id(), count);
            if (count == 0) {
                ready.add(action.id());
            }
        }

        List<Action> order = new ArrayList<>(actions.size());
        while (!ready.isEmpty()) {
            ActionId next = ready.poll();
            order.add(actions.get(next));
            for (ActionId dependent : dependents.getOrDefault(next, List.of())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != actions.size()) {
            List<ResourceAddress> stuck = remaining.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(e -> e.getKey().address())
                    .distinct()
                    .sorted()
                    .toList();
            throw new CycleException(stuck);
        }
        return order;
    }
}
