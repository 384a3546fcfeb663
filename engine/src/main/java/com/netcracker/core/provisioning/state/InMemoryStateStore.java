package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.StateSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Process local store. Keeps nothing across restarts; used for dry runs and tests.
 */
@Slf4j
public class InMemoryStateStore implements StateStore {
    private final Clock clock;
    private StateSnapshot snapshot;
    private String lockId;
    private Instant lockExpiry;

    public InMemoryStateStore() {
        this(StateSnapshot.empty(), Clock.systemUTC());
    }

    public InMemoryStateStore(StateSnapshot initial, Clock clock) {
        this.snapshot = initial;
        this.clock = clock;
    }

    @Override
    public synchronized StateSnapshot load() {
        return snapshot;
    }

    @Override
    public synchronized void save(StateSnapshot next) {
        StateSnapshots.checkNewer(snapshot, next);
        snapshot = next;
    }

    @Override
    public synchronized LockHandle lock(Duration ttl) {
        Instant now = clock.instant();
        if (lockId != null && now.isBefore(lockExpiry)) {
            throw new StateConflictException("State is locked by " + lockId + " until " + lockExpiry);
        }
        lockId = UUID.randomUUID().toString();
        lockExpiry = now.plus(ttl);
        log.debug("Acquired in-memory state lock {}", lockId);
        return new LockHandle(this, lockId, StateSnapshots.owner(), now);
    }

    @Override
    public synchronized void unlock(LockHandle handle) {
        if (handle.getId().equals(lockId)) {
            lockId = null;
            lockExpiry = null;
        } else {
            log.warn("Ignoring unlock of {}: lock is not held by it", handle);
        }
    }
}
