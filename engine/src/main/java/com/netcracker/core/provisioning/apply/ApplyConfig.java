package com.netcracker.core.provisioning.apply;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ApplyConfig {
    @Builder.Default int parallelism = 10;
    @Builder.Default int maxAttempts = 5;
    @Builder.Default Duration backoffMin = Duration.ofSeconds(1);
    @Builder.Default Duration backoffMax = Duration.ofSeconds(30);
    /**
     * Cancels the apply once elapsed; zero disables the timeout.
     */
    @Builder.Default Duration timeout = Duration.ZERO;

    public void validate() {
        if (parallelism < 1)
            throw new IllegalArgumentException("parallelism must be >= 1");
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoffMin.isNegative() || backoffMax.isNegative())
            throw new IllegalArgumentException("Backoff must be non-negative");
        if (backoffMin.compareTo(backoffMax) > 0)
            throw new IllegalArgumentException("backoffMin must be <= backoffMax");
        if (timeout.isNegative())
            throw new IllegalArgumentException("timeout must be >= 0");
    }
}
