package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.exception.ProvisioningException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.model.Value;
import com.netcracker.core.provisioning.plan.Action;
import com.netcracker.core.provisioning.plan.ActionId;
import com.netcracker.core.provisioning.plan.ActionType;
import com.netcracker.core.provisioning.plan.Plan;
import com.netcracker.core.provisioning.plan.ResourceChange;
import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.provider.ProviderResult;
import com.netcracker.core.provisioning.provider.ProviderTransientException;
import com.netcracker.core.provisioning.provider.ResourceNotFoundException;
import com.netcracker.core.provisioning.provider.ResourceProvider;
import com.netcracker.core.provisioning.resolve.ReferenceEvaluator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * Executes the actions of a plan on a fixed-size worker pool.
 * <p>
 * An action is submitted once every action it depends on has succeeded. Transient provider errors are
 * retried after a backoff delay scheduled on a timer, so waiting never occupies a worker. A failed action
 * skips everything that depends on it, directly or transitively; independent actions carry on.
 * Every successful provider call is committed to the state store before dependents are released.
 */
@Slf4j
public class ApplyExecutor {
    private static final AtomicLong THREAD_SEQ = new AtomicLong();

    private final ProviderRegistry providers;
    private final ApplyConfig config;
    private final BackoffStrategy backoff;
    private final ApplyMetrics metrics;

    public ApplyExecutor(ProviderRegistry providers, ApplyConfig config, BackoffStrategy backoff, ApplyMetrics metrics) {
        this.providers = Objects.requireNonNull(providers, "providers");
        this.config = Objects.requireNonNull(config, "config");
        this.backoff = backoff != null ? backoff : new ExponentialJitterBackoff();
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        config.validate();
    }

    public ApplyReport execute(Plan plan, StateWriter writer, CancellationSignal cancellation) {
        if (!plan.isValid()) {
            return ApplyReport.validationFailed(writer.current(), plan.getDiagnostics());
        }
        ExecutorService workers = Executors.newFixedThreadPool(config.getParallelism(), threadFactory("apply-worker"));
        ScheduledExecutorService timers = Executors.newSingleThreadScheduledExecutor(threadFactory("apply-timer"));
        try {
            Run run = new Run(plan.getActions(), writer, cancellation, workers, timers);
            return run.execute();
        } finally {
            timers.shutdownNow();
            workers.shutdownNow();
        }
    }

    private static ThreadFactory threadFactory(String prefix) {
        return r -> {
            Thread t = new Thread(r, prefix + "-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, ex) ->
                    log.error("Uncaught exception in '{}'", th.getName(), ex));
            return t;
        };
    }

    /**
     * State of one apply. All bookkeeping is guarded by {@code lock}; provider calls run outside of it.
     */
    private final class Run {
        private final Map<ActionId, Action> actions = new LinkedHashMap<>();
        private final Map<ActionId, List<ActionId>> dependents = new HashMap<>();
        private final Map<ActionId, Integer> remaining = new HashMap<>();
        private final Map<ActionId, ActionStatus> statuses = new HashMap<>();
        private final Map<ActionId, Integer> attempts = new HashMap<>();
        private final Map<ActionId, Duration> delays = new HashMap<>();
        private final Map<ActionId, String> errors = new HashMap<>();
        private final Map<ActionId, ScheduledFuture<?>> backingOff = new HashMap<>();
        private final CompletableFuture<Void> done = new CompletableFuture<>();
        private final Object lock = new Object();

        private final StateWriter writer;
        private final CancellationSignal cancellation;
        private final ExecutorService workers;
        private final ScheduledExecutorService timers;
        private int finished;

        Run(List<Action> plannedActions,
            StateWriter writer,
            CancellationSignal cancellation,
            ExecutorService workers,
            ScheduledExecutorService timers) {
            this.writer = writer;
            this.cancellation = cancellation;
            this.workers = workers;
            this.timers = timers;
            for (Action action : plannedActions) {
                actions.put(action.id(), action);
                statuses.put(action.id(), ActionStatus.PENDING);
                remaining.put(action.id(), action.dependsOn().size());
                for (ActionId dependency : action.dependsOn()) {
                    dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(action.id());
                }
            }
        }

        ApplyReport execute() {
            if (actions.isEmpty()) {
                return ApplyReport.of(List.of(), writer.current(), cancellation.isCancelled());
            }
            log.info("Applying {} actions with parallelism {}", actions.size(), config.getParallelism());
            if (!config.getTimeout().isZero()) {
                timers.schedule(() -> cancellation.cancel("apply timed out after " + config.getTimeout()),
                        config.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            synchronized (lock) {
                for (ActionId id : new ArrayList<>(actions.keySet())) {
                    if (remaining.get(id) == 0 && statuses.get(id) == ActionStatus.PENDING) {
                        release(id);
                    }
                }
            }
            cancellation.onCancel(this::cancelOutstanding);
            done.join();

            List<ActionOutcome> outcomes = new ArrayList<>(actions.size());
            synchronized (lock) {
                for (ActionId id : actions.keySet()) {
                    outcomes.add(new ActionOutcome(id, statuses.get(id), attempts.getOrDefault(id, 0), errors.get(id)));
                }
            }
            ApplyReport report = ApplyReport.of(outcomes, writer.current(), cancellation.isCancelled());
            log.info("Apply finished with result {}: {}", report.result(), report.nodes());
            return report;
        }

        private void release(ActionId id) {
            if (cancellation.isCancelled()) {
                finish(id, ActionStatus.CANCELLED, null);
                return;
            }
            statuses.put(id, ActionStatus.READY);
            submit(id);
        }

        private void submit(ActionId id) {
            try {
                workers.execute(() -> run(id));
            } catch (RejectedExecutionException e) {
                finish(id, ActionStatus.CANCELLED, "worker pool is shut down");
            }
        }

        private void run(ActionId id) {
            Action action;
            synchronized (lock) {
                ActionStatus status = statuses.get(id);
                boolean retry = status == ActionStatus.RUNNING && backingOff.remove(id) != null;
                if (status != ActionStatus.READY && !retry) {
                    return;
                }
                if (cancellation.isCancelled()) {
                    finish(id, ActionStatus.CANCELLED, errors.get(id));
                    return;
                }
                action = actions.get(id);
                if (action.type() == ActionType.NOOP) {
                    finish(id, ActionStatus.NO_OP, null);
                    return;
                }
                statuses.put(id, ActionStatus.RUNNING);
                attempts.merge(id, 1, Integer::sum);
            }

            try {
                perform(action);
                synchronized (lock) {
                    finish(id, ActionStatus.APPLIED, null);
                }
            } catch (ProviderTransientException e) {
                onTransientFailure(action, e);
            } catch (StateCommitException e) {
                String message = e.getCause().getMessage();
                log.error("Action {} succeeded remotely but its state could not be saved", id, e.getCause());
                synchronized (lock) {
                    finish(id, ActionStatus.FAILED, message);
                }
                cancellation.cancel("state could not be saved: " + message);
            } catch (ProvisioningException e) {
                log.error("Action {} failed: {}", id, e.getMessage());
                synchronized (lock) {
                    finish(id, ActionStatus.FAILED, e.getMessage());
                }
            } catch (Throwable e) {
                log.error("Action {} failed unexpectedly", id, e);
                synchronized (lock) {
                    finish(id, ActionStatus.FAILED, e.toString());
                }
                if (e instanceof VirtualMachineError) {
                    throw (VirtualMachineError) e;
                }
            }
        }

        private void onTransientFailure(Action action, ProviderTransientException e) {
            ActionId id = action.id();
            synchronized (lock) {
                int attempt = attempts.get(id);
                errors.put(id, e.getMessage());
                if (attempt >= config.getMaxAttempts()) {
                    log.error("Action {} failed after {} attempts: {}", id, attempt, e.getMessage());
                    finish(id, ActionStatus.FAILED, "retries exhausted after " + attempt + " attempts: " + e.getMessage());
                    return;
                }
                if (cancellation.isCancelled()) {
                    finish(id, ActionStatus.CANCELLED, e.getMessage());
                    return;
                }
                Duration delay = backoff.next(delays.get(id), config.getBackoffMin(), config.getBackoffMax());
                delays.put(id, delay);
                log.warn("Action {} failed on attempt {}/{}. Retrying in {}. cause='{}'",
                        id, attempt, config.getMaxAttempts(), delay, e.getMessage());
                try {
                    backingOff.put(id, timers.schedule(() -> submit(id), delay.toMillis(), TimeUnit.MILLISECONDS));
                } catch (RejectedExecutionException ex) {
                    finish(id, ActionStatus.CANCELLED, e.getMessage());
                }
            }
        }

        private void cancelOutstanding() {
            synchronized (lock) {
                for (ActionId id : new ArrayList<>(actions.keySet())) {
                    ActionStatus status = statuses.get(id);
                    if (status == ActionStatus.PENDING || status == ActionStatus.READY) {
                        finish(id, ActionStatus.CANCELLED, null);
                    } else if (status == ActionStatus.RUNNING && backingOff.containsKey(id)) {
                        backingOff.remove(id).cancel(false);
                        finish(id, ActionStatus.CANCELLED, errors.get(id));
                    }
                }
            }
        }

        /**
         * Records a terminal status and releases or skips dependents. Caller holds {@code lock}.
         */
        private void finish(ActionId id, ActionStatus status, String error) {
            if (statuses.get(id).isTerminal()) {
                return;
            }
            statuses.put(id, status);
            if (error != null) {
                errors.put(id, error);
            }
            finished++;
            metrics.actionFinished(actions.get(id).type(), status);
            log.debug("Action {} -> {}", id, status);

            for (ActionId dependent : dependents.getOrDefault(id, List.of())) {
                if (statuses.get(dependent).isTerminal()) {
                    continue;
                }
                if (status.isSuccess()) {
                    if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                        release(dependent);
                    }
                } else if (status == ActionStatus.CANCELLED) {
                    finish(dependent, ActionStatus.CANCELLED, null);
                } else {
                    finish(dependent, ActionStatus.SKIPPED, "dependency " + id + " " + status.name().toLowerCase());
                }
            }
            if (finished == actions.size()) {
                done.complete(null);
            }
        }

        private void perform(Action action) {
            ResourceChange change = action.change();
            ResourceAddress address = action.address();
            ResourceProvider provider = providers.get(address.type());
            log.debug("Running {}", action.id());

            switch (action.type()) {
                case CREATE -> {
                    Map<String, Object> inputs = resolveInputs(change);
                    ProviderResult result = metrics.timeProviderCall(address.type(), "create", () -> provider.create(inputs));
                    ResourceState created = new ResourceState(address, result.id(), inputs, result.attributes(), change.dependencies());
                    commit(snapshot -> change.isCreateBeforeDestroy() ? snapshot.replace(created) : snapshot.put(created));
                    log.info("Created {} with id '{}'", address, result.id());
                }
                case UPDATE -> {
                    Map<String, Object> inputs = resolveInputs(change);
                    String id = change.prior().id();
                    Map<String, Object> attributes = metrics.timeProviderCall(address.type(), "update", () -> provider.update(id, inputs));
                    commit(snapshot -> snapshot.put(new ResourceState(address, id, inputs, attributes, change.dependencies())));
                    log.info("Updated {} ({})", address, change.changedAttributes());
                }
                case DELETE -> {
                    String id = action.id().objectId();
                    try {
                        metrics.timeProviderCall(address.type(), "delete", () -> {
                            provider.delete(id);
                            return null;
                        });
                    } catch (ResourceNotFoundException e) {
                        log.info("{} with id '{}' is already gone", address, id);
                    }
                    commit(snapshot -> snapshot.remove(address, id));
                    log.info("Deleted {} with id '{}'", address, id);
                }
                case NOOP -> {
                }
            }
        }

        /**
         * Saves the result of a provider call that already succeeded. Any failure here leaves a remote change
         * unrecorded, so it is reported apart from provider errors and stops the run.
         */
        private void commit(UnaryOperator<StateSnapshot> update) {
            try {
                writer.commit(update);
            } catch (RuntimeException e) {
                throw new StateCommitException(e);
            }
        }

        private Map<String, Object> resolveInputs(ResourceChange change) {
            StateSnapshot snapshot = writer.current();
            Map<String, Value> resolved = ReferenceEvaluator.evaluateAll(change.desired().attributes(),
                    reference -> appliedValue(reference, change, snapshot));
            return ReferenceEvaluator.toPlain(resolved);
        }

        private Value appliedValue(Value.Reference reference, ResourceChange change, StateSnapshot snapshot) {
            if (reference.selector() == Value.Selector.ALL) {
                List<Value> items = new ArrayList<>();
                for (ResourceAddress target : change.dependencies()) {
                    if (target.declarationKey().equals(reference.declarationKey())) {
                        items.add(appliedValue(target, reference.attribute(), snapshot));
                    }
                }
                return Value.list(items);
            }
            ResourceAddress target = reference.selector() == Value.Selector.INDEX
                    ? ResourceAddress.of(reference.type(), reference.name(), reference.index())
                    : ResourceAddress.of(reference.type(), reference.name());
            return appliedValue(target, reference.attribute(), snapshot);
        }

        private Value appliedValue(ResourceAddress target, String attribute, StateSnapshot snapshot) {
            ResourceState state = snapshot.get(target)
                    .orElseThrow(() -> new ProvisioningException("Referenced resource " + target + " is not in state"));
            return Value.fromPlain(state.read(attribute));
        }
    }

    private static final class StateCommitException extends ProvisioningException {
        StateCommitException(RuntimeException cause) {
            super("State could not be saved: " + cause.getMessage(), cause);
        }
    }
}
