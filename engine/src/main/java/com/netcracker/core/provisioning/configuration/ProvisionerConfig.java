package com.netcracker.core.provisioning.configuration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "provisioner")
public interface ProvisionerConfig {

    Apply apply();

    Refresh refresh();

    State state();

    /**
     * How long the state lock is held before another run may take it over.
     */
    @WithDefault("15m")
    Duration lockTtl();

    interface Apply {
        @WithDefault("10")
        int parallelism();

        @WithDefault("5")
        int maxAttempts();

        @WithDefault("1s")
        Duration backoffMin();

        @WithDefault("30s")
        Duration backoffMax();

        Optional<Duration> timeout();
    }

    interface Refresh {
        @WithDefault("false")
        boolean enabled();
    }

    interface State {
        @WithDefault("memory")
        Backend backend();

        File file();

        Consul consul();
    }

    interface File {
        @WithDefault("provisioner-state.json")
        String path();
    }

    interface Consul {
        @WithDefault("localhost")
        String host();

        @WithDefault("8500")
        int port();

        @WithDefault("provisioner/state")
        String key();

        @WithName("acl-token")
        Optional<String> aclToken();

        @WithDefault("30s")
        Duration requestTimeout();
    }

    enum Backend {
        MEMORY, FILE, CONSUL
    }
}
