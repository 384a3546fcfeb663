package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.exception.ValidationException;
import com.netcracker.core.provisioning.graph.DependencyGraph;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.StateSnapshot;
import lombok.Getter;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered actions converging the prior state to the declarations, together with the diagnostics found while
 * planning. A plan with diagnostics carries no actions and must not be applied.
 */
@Getter
public final class Plan {
    private final StateSnapshot priorState;
    private final DependencyGraph graph;
    private final List<ResourceChange> changes;
    private final List<Action> actions;
    private final List<ValidationException> diagnostics;

    Plan(StateSnapshot priorState,
         DependencyGraph graph,
         List<ResourceChange> changes,
         List<Action> actions,
         List<ValidationException> diagnostics) {
        this.priorState = priorState;
        this.graph = graph;
        this.changes = List.copyOf(changes);
        this.actions = List.copyOf(actions);
        this.diagnostics = List.copyOf(diagnostics);
    }

    static Plan invalid(StateSnapshot priorState, List<ValidationException> diagnostics) {
        return new Plan(priorState, null, List.of(), List.of(), diagnostics);
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }

    /**
     * {@code true} when the plan changes nothing: every resource is a no-op.
     */
    public boolean isEmpty() {
        return changes.stream().allMatch(change -> change.type() == ChangeType.NOOP);
    }

    public Optional<ResourceChange> change(ResourceAddress address) {
        return changes.stream()
                .filter(change -> change.address().equals(address) && !change.isDeposed())
                .findFirst();
    }

    public List<ActionId> actionOrder() {
        return actions.stream().map(Action::id).toList();
    }

    public Map<ChangeType, Long> summary() {
        Map<ChangeType, Long> counts = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            counts.put(type, 0L);
        }
        changes.stream()
                .collect(Collectors.groupingBy(ResourceChange::type, Collectors.counting()))
                .forEach(counts::put);
        return counts;
    }

    @Override
    public String toString() {
        Map<ChangeType, Long> summary = summary();
        return "Plan: %d to add, %d to change, %d to replace, %d to destroy".formatted(
                summary.get(ChangeType.CREATE),
                summary.get(ChangeType.UPDATE),
                summary.get(ChangeType.REPLACE),
                summary.get(ChangeType.DELETE));
    }
}
