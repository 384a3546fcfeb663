package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.model.StateSnapshot;

import java.time.Duration;

/**
 * Persistent storage of the state snapshot.
 * <p>
 * {@link #save(StateSnapshot)} must reject snapshots that are not newer than the stored one and
 * {@link #lock(Duration)} must fail when another holder owns an unexpired lock; both with
 * {@link com.netcracker.core.provisioning.exception.StateConflictException}.
 */
public interface StateStore {

    /**
     * @return the stored snapshot, or an empty one when nothing was saved yet
     */
    StateSnapshot load();

    void save(StateSnapshot snapshot);

    LockHandle lock(Duration ttl);

    void unlock(LockHandle handle);
}
