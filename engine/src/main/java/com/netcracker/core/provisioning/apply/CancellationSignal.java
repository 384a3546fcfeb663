package com.netcracker.core.provisioning.apply;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation of an apply. Once signalled no new action is started; calls already in flight
 * are allowed to finish and commit.
 */
@Slf4j
public final class CancellationSignal {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel(String why) {
        if (reason.compareAndSet(null, why)) {
            log.info("Apply cancellation requested: {}", why);
            listeners.forEach(Runnable::run);
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<String> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * Registers a listener; runs it right away if cancellation was already requested.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled()) {
            listener.run();
        }
    }
}
