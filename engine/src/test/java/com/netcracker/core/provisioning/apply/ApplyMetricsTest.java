package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.plan.ActionType;
import com.netcracker.core.provisioning.provider.ProviderTransientException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApplyMetricsTest {
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ApplyMetrics metrics = new ApplyMetrics(registry);

    @Test
    void countsFinishedActionsByTypeAndStatus() {
        metrics.actionFinished(ActionType.CREATE, ActionStatus.APPLIED);
        metrics.actionFinished(ActionType.CREATE, ActionStatus.APPLIED);
        metrics.actionFinished(ActionType.DELETE, ActionStatus.FAILED);

        assertThat(registry.get(ApplyMetrics.ACTIONS).tag("type", "create").tag("status", "applied").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get(ApplyMetrics.ACTIONS).tag("type", "delete").tag("status", "failed").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void timesProviderCallsWithOutcome() {
        String id = metrics.timeProviderCall("vpc", "create", () -> "vpc-1");
        assertThatThrownBy(() -> metrics.timeProviderCall("vpc", "create", () -> {
            throw new ProviderTransientException("throttled");
        })).isInstanceOf(ProviderTransientException.class);

        assertThat(id).isEqualTo("vpc-1");
        assertThat(registry.get(ApplyMetrics.PROVIDER_CALLS).tag("outcome", "success").timer().count()).isEqualTo(1);
        assertThat(registry.get(ApplyMetrics.PROVIDER_CALLS).tag("outcome", "error").timer().count()).isEqualTo(1);
    }
}
