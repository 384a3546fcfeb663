package com.netcracker.core.provisioning.refresh;

import com.netcracker.core.provisioning.apply.ApplyConfig;
import com.netcracker.core.provisioning.apply.BackoffStrategy;
import com.netcracker.core.provisioning.exception.ProvisioningException;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.model.Values;
import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.provider.ProviderTransientException;
import com.netcracker.core.provisioning.provider.ResourceNotFoundException;
import com.netcracker.core.provisioning.provider.ResourceProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reconciles the state snapshot with what providers report before planning.
 * <p>
 * Objects the provider no longer knows are dropped, so the next plan creates them again. For objects that
 * still exist, provider attributes are replaced with the fresh ones and applied inputs are overwritten with
 * the remote values of the same attributes, so drift shows up as a change in the plan.
 */
@Slf4j
public class StateRefresher {
    private final ProviderRegistry providers;
    private final ApplyConfig config;
    private final BackoffStrategy backoff;

    public StateRefresher(ProviderRegistry providers, ApplyConfig config, BackoffStrategy backoff) {
        this.providers = Objects.requireNonNull(providers, "providers");
        this.config = Objects.requireNonNull(config, "config");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    /**
     * @return the refreshed snapshot, or {@code snapshot} itself when nothing drifted
     */
    public StateSnapshot refresh(StateSnapshot snapshot) {
        StateSnapshot result = snapshot;
        int dropped = 0;
        int drifted = 0;
        for (ResourceState state : snapshot.getResources().values()) {
            ResourceProvider provider = providers.get(state.type());
            Map<String, Object> remote;
            try {
                remote = Values.normalizeAll(read(provider, state));
            } catch (ResourceNotFoundException e) {
                log.warn("{} with id '{}' no longer exists, dropping it from state", state.address(), state.id());
                result = result.remove(state.address(), state.id());
                dropped++;
                continue;
            }
            ResourceState refreshed = refreshed(state, remote);
            if (!refreshed.equals(state)) {
                log.info("{} drifted from its recorded state", state.address());
                result = result.put(refreshed);
                drifted++;
            }
        }
        log.info("Refreshed {} resources: {} drifted, {} gone", snapshot.getResources().size(), drifted, dropped);
        return result;
    }

    private static ResourceState refreshed(ResourceState state, Map<String, Object> remote) {
        Map<String, Object> inputs = new LinkedHashMap<>(state.inputs());
        for (Map.Entry<String, Object> entry : state.inputs().entrySet()) {
            if (remote.containsKey(entry.getKey())) {
                inputs.put(entry.getKey(), remote.get(entry.getKey()));
            }
        }
        return new ResourceState(state.address(), state.id(), inputs, remote, state.dependencies());
    }

    private Map<String, Object> read(ResourceProvider provider, ResourceState state) {
        Duration delay = null;
        for (int attempt = 1; ; attempt++) {
            try {
                return provider.read(state.id());
            } catch (ProviderTransientException e) {
                if (attempt >= config.getMaxAttempts()) {
                    throw new ProvisioningException("Failed to read " + state.address() + " after " + attempt + " attempts", e);
                }
                delay = backoff.next(delay, config.getBackoffMin(), config.getBackoffMax());
                log.warn("Reading {} failed on attempt {}/{}. Retrying in {}. cause='{}'",
                        state.address(), attempt, config.getMaxAttempts(), delay, e.getMessage());
                sleep(delay);
            }
        }
    }

    private static void sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisioningException("Interrupted while refreshing state", e);
        }
    }
}
