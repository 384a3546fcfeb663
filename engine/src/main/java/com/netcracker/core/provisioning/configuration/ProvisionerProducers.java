package com.netcracker.core.provisioning.configuration;

import com.netcracker.core.provisioning.apply.ApplyConfig;
import com.netcracker.core.provisioning.apply.ApplyExecutor;
import com.netcracker.core.provisioning.apply.ApplyMetrics;
import com.netcracker.core.provisioning.apply.BackoffStrategy;
import com.netcracker.core.provisioning.apply.ExponentialJitterBackoff;
import com.netcracker.core.provisioning.provider.ProviderRegistry;
import com.netcracker.core.provisioning.refresh.StateRefresher;
import com.netcracker.core.provisioning.state.FileStateStore;
import com.netcracker.core.provisioning.state.InMemoryStateStore;
import com.netcracker.core.provisioning.state.StateSnapshotSerializer;
import com.netcracker.core.provisioning.state.StateStore;
import com.netcracker.core.provisioning.state.consul.ConsulStateStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.ext.consul.ConsulClient;
import io.vertx.ext.consul.ConsulClientOptions;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;

@Slf4j
public class ProvisionerProducers {

    @Produces
    @Singleton
    public ApplyConfig applyConfig(ProvisionerConfig config) {
        ProvisionerConfig.Apply apply = config.apply();
        ApplyConfig applyConfig = ApplyConfig.builder()
                .parallelism(apply.parallelism())
                .maxAttempts(apply.maxAttempts())
                .backoffMin(apply.backoffMin())
                .backoffMax(apply.backoffMax())
                .timeout(apply.timeout().orElse(Duration.ZERO))
                .build();
        applyConfig.validate();
        return applyConfig;
    }

    @Produces
    @Singleton
    public BackoffStrategy backoffStrategy() {
        return new ExponentialJitterBackoff();
    }

    @Produces
    @Singleton
    public ApplyExecutor applyExecutor(ProviderRegistry providers,
                                       ApplyConfig config,
                                       BackoffStrategy backoff,
                                       MeterRegistry registry) {
        return new ApplyExecutor(providers, config, backoff, new ApplyMetrics(registry));
    }

    @Produces
    @Singleton
    public StateRefresher stateRefresher(ProviderRegistry providers, ApplyConfig config, BackoffStrategy backoff) {
        return new StateRefresher(providers, config, backoff);
    }

    @Produces
    @Singleton
    public StateStore stateStore(ProvisionerConfig config, Vertx vertx) {
        ProvisionerConfig.State state = config.state();
        StateSnapshotSerializer serializer = new StateSnapshotSerializer();
        log.info("Using '{}' state backend", state.backend().name().toLowerCase());
        return switch (state.backend()) {
            case MEMORY -> new InMemoryStateStore();
            case FILE -> new FileStateStore(Path.of(state.file().path()), serializer);
            case CONSUL -> {
                ProvisionerConfig.Consul consul = state.consul();
                ConsulClientOptions options = new ConsulClientOptions()
                        .setHost(consul.host())
                        .setPort(consul.port())
                        .setTimeout(consul.requestTimeout().toMillis());
                consul.aclToken().ifPresent(options::setAclToken);
                yield new ConsulStateStore(ConsulClient.create(vertx, options), consul.key(), serializer, consul.requestTimeout());
            }
        };
    }

    public void closeStateStore(@Disposes StateStore store) {
        if (store instanceof ConsulStateStore consul) {
            consul.close();
        }
    }
}
