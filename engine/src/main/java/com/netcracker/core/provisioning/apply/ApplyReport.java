package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.exception.ValidationException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.plan.ActionId;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Outcome of an apply: overall result, terminal status per resource and per action, and the state
 * snapshot as committed when the run ended.
 */
public record ApplyReport(ApplyResult result,
                          SortedMap<ResourceAddress, ActionStatus> nodes,
                          List<ActionOutcome> actions,
                          StateSnapshot finalState,
                          List<ValidationException> diagnostics) {
    private static final List<ActionStatus> PRECEDENCE = List.of(
            ActionStatus.FAILED, ActionStatus.SKIPPED, ActionStatus.CANCELLED, ActionStatus.APPLIED, ActionStatus.NO_OP);

    public ApplyReport {
        nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
        actions = List.copyOf(actions);
        diagnostics = List.copyOf(diagnostics);
    }

    public static ApplyReport validationFailed(StateSnapshot state, List<ValidationException> diagnostics) {
        return new ApplyReport(ApplyResult.FAILED_VALIDATION, new TreeMap<>(), List.of(), state, diagnostics);
    }

    static ApplyReport of(List<ActionOutcome> outcomes, StateSnapshot finalState, boolean cancelled) {
        SortedMap<ResourceAddress, ActionStatus> nodes = new TreeMap<>();
        Set<ActionStatus> seen = EnumSet.noneOf(ActionStatus.class);
        for (ActionOutcome outcome : outcomes) {
            seen.add(outcome.status());
            nodes.merge(outcome.id().address(), outcome.status(), ApplyReport::dominant);
        }
        ApplyResult result;
        if (cancelled && seen.contains(ActionStatus.CANCELLED)) {
            result = ApplyResult.CANCELLED;
        } else if (seen.contains(ActionStatus.FAILED) || seen.contains(ActionStatus.SKIPPED)) {
            result = ApplyResult.PARTIAL_FAILURE;
        } else {
            result = ApplyResult.SUCCESS;
        }
        return new ApplyReport(result, nodes, outcomes, finalState, List.of());
    }

    private static ActionStatus dominant(ActionStatus a, ActionStatus b) {
        return PRECEDENCE.indexOf(a) <= PRECEDENCE.indexOf(b) ? a : b;
    }

    public Optional<ActionStatus> status(ResourceAddress address) {
        return Optional.ofNullable(nodes.get(address));
    }

    public Optional<ActionOutcome> outcome(ActionId id) {
        return actions.stream().filter(outcome -> outcome.id().equals(id)).findFirst();
    }

    public boolean isSuccess() {
        return result == ApplyResult.SUCCESS;
    }
}
