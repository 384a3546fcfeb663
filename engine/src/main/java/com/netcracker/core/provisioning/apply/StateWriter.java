package com.netcracker.core.provisioning.apply;

import com.netcracker.core.provisioning.model.StateSnapshot;
import com.netcracker.core.provisioning.state.StateStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Single writer of the state snapshot during an apply. Each commit is one resource update, applied to the
 * latest snapshot and saved before the next commit starts.
 */
@Slf4j
public final class StateWriter {
    private final StateStore store;
    private volatile StateSnapshot current;

    public StateWriter(StateStore store, StateSnapshot initial) {
        this.store = Objects.requireNonNull(store, "store");
        this.current = Objects.requireNonNull(initial, "initial");
    }

    public StateSnapshot current() {
        return current;
    }

    /**
     * @throws com.netcracker.core.provisioning.exception.StateConflictException if the store rejects the snapshot
     */
    public synchronized StateSnapshot commit(UnaryOperator<StateSnapshot> update) {
        StateSnapshot next = update.apply(current);
        store.save(next);
        current = next;
        log.debug("Committed state serial {}", next.getSerial());
        return next;
    }
}
