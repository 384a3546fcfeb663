package com.netcracker.core.provisioning.state;

import java.time.Instant;
import java.util.Objects;

/**
 * Lock over the whole state, held for one plan and apply cycle. Closing the handle unlocks.
 */
public final class LockHandle implements AutoCloseable {
    private final StateStore store;
    private final String id;
    private final String owner;
    private final Instant acquiredAt;

    public LockHandle(StateStore store, String id, String owner, Instant acquiredAt) {
        this.store = Objects.requireNonNull(store, "store");
        this.id = Objects.requireNonNull(id, "id");
        this.owner = owner;
        this.acquiredAt = acquiredAt;
    }

    public String getId() {
        return id;
    }

    public String getOwner() {
        return owner;
    }

    public Instant getAcquiredAt() {
        return acquiredAt;
    }

    @Override
    public void close() {
        store.unlock(this);
    }

    @Override
    public String toString() {
        return "LockHandle{id=" + id + ", owner=" + owner + ", acquiredAt=" + acquiredAt + "}";
    }
}
