package com.netcracker.core.provisioning.configuration;

import com.netcracker.core.provisioning.apply.ApplyConfig;
import com.netcracker.core.provisioning.state.FileStateStore;
import com.netcracker.core.provisioning.state.InMemoryStateStore;
import com.netcracker.core.provisioning.state.StateStore;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProvisionerProducersTest {
    private final ProvisionerProducers producers = new ProvisionerProducers();

    @TempDir
    Path dir;

    @Test
    void applyConfigFollowsConfiguration() {
        ProvisionerConfig config = mock(ProvisionerConfig.class, RETURNS_DEEP_STUBS);
        when(config.apply().parallelism()).thenReturn(3);
        when(config.apply().maxAttempts()).thenReturn(7);
        when(config.apply().backoffMin()).thenReturn(Duration.ofMillis(200));
        when(config.apply().backoffMax()).thenReturn(Duration.ofSeconds(5));
        when(config.apply().timeout()).thenReturn(Optional.empty());

        ApplyConfig applyConfig = producers.applyConfig(config);

        assertThat(applyConfig.getParallelism()).isEqualTo(3);
        assertThat(applyConfig.getMaxAttempts()).isEqualTo(7);
        assertThat(applyConfig.getTimeout()).isZero();
    }

    @Test
    void invalidApplySettingsAreRejected() {
        ProvisionerConfig config = mock(ProvisionerConfig.class, RETURNS_DEEP_STUBS);
        when(config.apply().parallelism()).thenReturn(0);
        when(config.apply().maxAttempts()).thenReturn(5);
        when(config.apply().backoffMin()).thenReturn(Duration.ofSeconds(1));
        when(config.apply().backoffMax()).thenReturn(Duration.ofSeconds(5));
        when(config.apply().timeout()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> producers.applyConfig(config)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stateBackendIsSelectedByConfiguration() {
        ProvisionerConfig config = mock(ProvisionerConfig.class, RETURNS_DEEP_STUBS);
        Vertx vertx = mock(Vertx.class);

        when(config.state().backend()).thenReturn(ProvisionerConfig.Backend.MEMORY);
        StateStore memory = producers.stateStore(config, vertx);

        when(config.state().backend()).thenReturn(ProvisionerConfig.Backend.FILE);
        when(config.state().file().path()).thenReturn(dir.resolve("state.json").toString());
        StateStore file = producers.stateStore(config, vertx);

        assertThat(memory).isInstanceOf(InMemoryStateStore.class);
        assertThat(file).isInstanceOf(FileStateStore.class);
        assertThat(file.load().isEmpty()).isTrue();
    }
}
