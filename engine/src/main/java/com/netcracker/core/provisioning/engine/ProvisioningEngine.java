package com.netcracker.core.provisioning.engine;

import com.netcracker.core.provisioning.apply.ApplyExecutor;
import com.netcracker.core.provisioning.apply.ApplyReport;
import com.netcracker.core.provisioning.apply.CancellationSignal;
import com.netcracker.core.provisioning.apply.StateWriter;
import com.netcracker.core.provisioning.configuration.ProvisionerConfig;
import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.ResourceDeclaration;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.plan.Plan;
import com.netcracker.core.provisioning.plan.Planner;
import com.netcracker.core.provisioning.refresh.StateRefresher;
import com.netcracker.core.provisioning.state.LockHandle;
import com.netcracker.core.provisioning.state.StateStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Entry points of the engine.
 * <p>
 * {@link #plan} and {@link #apply} can be used separately, e.g. to review a plan before applying it.
 * {@link #run} performs the whole cycle while holding the state lock.
 */
@ApplicationScoped
@Slf4j
public class ProvisioningEngine {
    private final Planner planner;
    private final ApplyExecutor executor;
    private final StateStore store;
    private final StateRefresher refresher;
    private final boolean refreshEnabled;
    private final Duration lockTtl;

    @Inject
    public ProvisioningEngine(Planner planner,
                              ApplyExecutor executor,
                              StateStore store,
                              StateRefresher refresher,
                              ProvisionerConfig config) {
        this(planner, executor, store, refresher, config.refresh().enabled(), config.lockTtl());
    }

    ProvisioningEngine(Planner planner,
                       ApplyExecutor executor,
                       StateStore store,
                       StateRefresher refresher,
                       boolean refreshEnabled,
                       Duration lockTtl) {
        this.planner = planner;
        this.executor = executor;
        this.store = store;
        this.refresher = refresher;
        this.refreshEnabled = refreshEnabled;
        this.lockTtl = lockTtl;
    }

    public Plan plan(List<ResourceDeclaration> declarations, StateSnapshot state) {
        return planner.plan(declarations, state);
    }

    public ApplyReport apply(Plan plan) {
        return apply(plan, new CancellationSignal());
    }

    /**
     * @throws StateConflictException if the stored state changed since the plan was made
     */
    public ApplyReport apply(Plan plan, CancellationSignal cancellation) {
        if (!plan.isValid()) {
            log.warn("Refusing to apply an invalid plan: {} diagnostic(s)", plan.getDiagnostics().size());
            return ApplyReport.validationFailed(plan.getPriorState(), plan.getDiagnostics());
        }
        StateSnapshot prior = plan.getPriorState();
        StateSnapshot stored = store.load();
        boolean sameLineage = stored.getLineage().equals(prior.getLineage()) || stored.isEmpty();
        if (!sameLineage || stored.getSerial() != prior.getSerial()) {
            throw new StateConflictException("Plan was made against state serial " + prior.getSerial()
                                             + " but the stored state is at serial " + stored.getSerial());
        }
        ApplyReport report = executor.execute(plan, new StateWriter(store, prior), cancellation);
        log.info("Apply result: {}", report.result());
        return report;
    }

    public ApplyReport run(List<ResourceDeclaration> declarations) {
        return run(declarations, new CancellationSignal());
    }

    /**
     * Locks the state, loads it, optionally refreshes it, plans and applies.
     *
     * @throws StateConflictException if the lock cannot be acquired; nothing is changed in that case
     */
    public ApplyReport run(List<ResourceDeclaration> declarations, CancellationSignal cancellation) {
        try (LockHandle lock = store.lock(lockTtl)) {
            log.info("Acquired state lock {}", lock.getId());
            StateSnapshot state = store.load();
            if (refreshEnabled) {
                StateSnapshot refreshed = refresher.refresh(state);
                if (refreshed != state) {
                    store.save(refreshed);
                    state = refreshed;
                }
            }
            Plan plan = plan(declarations, state);
            if (!plan.isValid()) {
                return ApplyReport.validationFailed(state, plan.getDiagnostics());
            }
            if (plan.isEmpty()) {
                log.info("No changes. Infrastructure matches the declarations");
            }
            return apply(plan, cancellation);
        }
    }
}
