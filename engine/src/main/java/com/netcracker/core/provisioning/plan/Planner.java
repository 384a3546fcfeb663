package com.netcracker.core.provisioning.plan;

import com.netcracker.core.provisioning.exception.CycleException;
import com.netcracker.core.provisioning.exception.DanglingReferenceException;
import com.netcracker.core.provisioning.exception.UnknownResourceTypeException;
import com.netcracker.core.provisioning.exception.UnresolvedReferenceException;
import com.netcracker.core.provisioning.exception.ValidationException;
import com.netcracker.core.provisioning.expand.DeclarationExpander;
import com.netcracker.core.provisioning.expand.ExpandedResources;
import com.netcracker.core.provisioning.graph.DependencyGraph;
import com.netcracker.core.provisioning.graph.DependencyGraphBuilder;
import com.netcracker.core.provisioning.model.DeposedObject;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceDeclaration;
import com.netcracker.core.provisioning.model.ResourceNode;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.model.Value;
import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.provider.ResourceSchema;
import com.netcracker.core.provisioning.resolve.ReferenceEvaluator;
import com.netcracker.core.provisioning.resolve.ReferenceResolver;
import com.netcracker.core.provisioning.resolve.ResolvedReferences;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Compares declarations with a state snapshot and produces the {@link Plan} converging one to the other.
 * <p>
 * Planning has no side effects. Validation problems (duplicate addresses, unresolved or dangling
 * references, cycles, unknown resource types) are all collected and returned as plan diagnostics.
 */
@ApplicationScoped
@Slf4j
public class Planner {
    private final DeclarationExpander expander;
    private final ReferenceResolver resolver;
    private final DependencyGraphBuilder graphBuilder;
    private final ProviderRegistry providers;

    @Inject
    public Planner(DeclarationExpander expander,
                   ReferenceResolver resolver,
                   DependencyGraphBuilder graphBuilder,
                   ProviderRegistry providers) {
        this.expander = expander;
        this.resolver = resolver;
        this.graphBuilder = graphBuilder;
        this.providers = providers;
    }

    public Plan plan(List<ResourceDeclaration> declarations, StateSnapshot state) {
        Objects.requireNonNull(declarations, "declarations");
        Objects.requireNonNull(state, "state");

        ExpandedResources expanded = expander.expand(declarations);
        List<ValidationException> errors = new ArrayList<>(expanded.errors());

        ResolvedReferences resolved = resolver.resolve(expanded);
        for (UnresolvedReferenceException unresolved : resolved.unresolved()) {
            errors.add(classify(unresolved, state));
        }
        for (ResourceNode node : expanded.nodes().values()) {
            if (!providers.supports(node.type())) {
                errors.add(new UnknownResourceTypeException(node.address()));
            }
        }

        DependencyGraph graph = null;
        try {
            graph = graphBuilder.build(expanded.nodes().keySet(), resolved.references());
        } catch (CycleException e) {
            errors.add(e);
        }

        if (!errors.isEmpty()) {
            log.warn("Planning aborted with {} validation error(s): {}", errors.size(),
                    errors.stream().map(Throwable::getMessage).toList());
            return Plan.invalid(state, errors);
        }

        List<ResourceChange> changes = diff(expanded, graph, state);
        List<Action> actions;
        try {
            actions = new ActionGraph(graph, changes, state).linearize();
        } catch (CycleException e) {
            log.warn("Planning aborted: {}", e.getMessage());
            return Plan.invalid(state, List.of(e));
        }

        Plan plan = new Plan(state, graph, changes, actions, List.of());
        log.info("{}", plan);
        return plan;
    }

    private ValidationException classify(UnresolvedReferenceException unresolved, StateSnapshot state) {
        ResourceAddress target = unresolved.getTargetAddress();
        if (target == null) {
            return unresolved;
        }
        if (state.contains(target)) {
            return new DanglingReferenceException(unresolved.getSource(), unresolved.getAttributePath(), target);
        }
        if (!target.isIndexed()) {
            Optional<ResourceAddress> instance = state.getResources().keySet().stream()
                    .filter(address -> address.declarationKey().equals(target.declarationKey()))
                    .findFirst();
            if (instance.isPresent()) {
                return new DanglingReferenceException(unresolved.getSource(), unresolved.getAttributePath(), instance.get());
            }
        }
        return unresolved;
    }

    private List<ResourceChange> diff(ExpandedResources expanded, DependencyGraph graph, StateSnapshot state) {
        Map<ResourceAddress, ResourceChange> changes = new LinkedHashMap<>();
        Set<ResourceAddress> createBeforeDestroy = createBeforeDestroyNodes(expanded, graph);

        for (ResourceAddress address : graph.applyOrder()) {
            ResourceNode node = expanded.nodes().get(address);
            SortedSet<ResourceAddress> dependencies = graph.dependenciesOf(address);
            Map<String, Value> planned = ReferenceEvaluator.evaluateAll(node.attributes(),
                    reference -> plannedValue(reference, expanded, changes, state));

            ResourceState prior = state.get(address).orElse(null);
            ResourceChange change;
            if (prior == null) {
                change = ResourceChange.create(node, planned, dependencies);
            } else {
                SortedSet<String> changed = changedAttributes(planned, prior.inputs());
                ResourceSchema schema = providers.get(node.type()).schema();
                if (changed.isEmpty()) {
                    change = ResourceChange.noop(node, planned, dependencies, prior);
                } else if (changed.stream().allMatch(schema::isUpdatable)) {
                    change = ResourceChange.update(node, planned, dependencies, prior, changed);
                } else {
                    ReplaceOrder order = createBeforeDestroy.contains(address)
                            ? ReplaceOrder.CREATE_BEFORE_DESTROY
                            : ReplaceOrder.DESTROY_BEFORE_CREATE;
                    change = ResourceChange.replace(node, planned, dependencies, prior, changed, order);
                }
            }
            log.debug("{} -> {} {}", address, change.type(), change.changedAttributes());
            changes.put(address, change);
        }

        List<ResourceChange> result = new ArrayList<>(changes.values());
        for (ResourceState prior : state.getResources().values()) {
            if (!graph.contains(prior.address())) {
                result.add(ResourceChange.delete(prior));
            }
        }
        for (DeposedObject deposed : state.getDeposed()) {
            result.add(ResourceChange.deleteDeposed(deposed));
        }
        return result;
    }

    /**
     * Nodes replaced create-before-destroy: those whose type or declaration asks for it, and every node a
     * create-before-destroy node depends on, since a dependency cannot be destroyed before a dependent's
     * replacement exists.
     */
    private Set<ResourceAddress> createBeforeDestroyNodes(ExpandedResources expanded, DependencyGraph graph) {
        Set<ResourceAddress> result = new TreeSet<>();
        for (ResourceAddress address : graph.applyOrder()) {
            if (ownPolicy(expanded.nodes().get(address))) {
                result.add(address);
            }
        }
        for (ResourceAddress address : graph.destroyOrder()) {
            if (graph.dependentsOf(address).stream().anyMatch(result::contains)) {
                result.add(address);
            }
        }
        return result;
    }

    private boolean ownPolicy(ResourceNode node) {
        if (node.createBeforeDestroy() != null) {
            return node.createBeforeDestroy();
        }
        return providers.get(node.type()).schema().isCreateBeforeDestroy();
    }

    /**
     * Value of a reference as far as it is known before apply. Targets are planned earlier in apply order.
     */
    private Value plannedValue(Value.Reference reference,
                               ExpandedResources expanded,
                               Map<ResourceAddress, ResourceChange> changes,
                               StateSnapshot state) {
        List<ResourceAddress> targets = ReferenceResolver.targets(expanded, reference);
        if (reference.selector() == Value.Selector.ALL) {
            List<Value> items = new ArrayList<>(targets.size());
            for (ResourceAddress target : targets) {
                items.add(plannedValue(target, reference.attribute(), changes, state));
            }
            return Value.list(items);
        }
        return plannedValue(targets.get(0), reference.attribute(), changes, state);
    }

    private Value plannedValue(ResourceAddress target,
                               String attribute,
                               Map<ResourceAddress, ResourceChange> changes,
                               StateSnapshot state) {
        ResourceChange change = changes.get(target);
        ResourceState prior = state.get(target).orElse(null);
        if (change == null || prior == null) {
            return Value.unknown();
        }
        return switch (change.type()) {
            case NOOP -> Value.fromPlain(prior.read(attribute));
            case UPDATE -> {
                // computed attributes may change with the update, only unchanged inputs are carried over
                String root = attribute.split("\\.", 2)[0];
                boolean known = "id".equals(attribute)
                        || (prior.inputs().containsKey(root) && !change.changedAttributes().contains(root));
                yield known ? Value.fromPlain(prior.read(attribute)) : Value.unknown();
            }
            default -> Value.unknown();
        };
    }

    static SortedSet<String> changedAttributes(Map<String, Value> planned, Map<String, Object> priorInputs) {
        SortedSet<String> keys = new TreeSet<>(planned.keySet());
        keys.addAll(priorInputs.keySet());
        SortedSet<String> changed = new TreeSet<>();
        for (String key : keys) {
            Value desired = planned.get(key);
            Object prior = priorInputs.get(key);
            if (desired == null) {
                if (prior != null) {
                    changed.add(key);
                }
            } else if (!desired.isKnown() || !Objects.equals(desired.toPlain(), prior)) {
                changed.add(key);
            }
        }
        return changed;
    }
}
