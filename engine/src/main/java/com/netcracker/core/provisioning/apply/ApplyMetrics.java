package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.plan.ActionType;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;
import java.util.function.Supplier;

public class ApplyMetrics {
    static final String ACTIONS = "provisioner.apply.actions";
    static final String PROVIDER_CALLS = "provisioner.provider.calls";

    private final MeterRegistry registry;

    public ApplyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void actionFinished(ActionType type, ActionStatus status) {
        registry.counter(ACTIONS,
                "type", type.name().toLowerCase(Locale.ROOT),
                "status", status.name().toLowerCase(Locale.ROOT)).increment();
    }

    public <T> T timeProviderCall(String resourceType, String operation, Supplier<T> call) {
        Timer.Sample sample = Timer.start(registry);
        String outcome = "success";
        try {
            return call.get();
        } catch (RuntimeException e) {
            outcome = "error";
            throw e;
        } finally {
            sample.stop(registry.timer(PROVIDER_CALLS,
                    "type", resourceType,
                    "operation", operation,
                    "outcome", outcome));
        }
    }
}
