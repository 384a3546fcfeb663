package com.netcracker.core.provisioning.apply;

import java.time.Duration;

public interface BackoffStrategy {
    Duration next(Duration current, Duration min, Duration max);
}
