package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.exception.StateConflictException;
import com.netcracker.core.provisioning.model.StateSnapshot;

import java.lang.management.ManagementFactory;

public final class StateSnapshots {

    private StateSnapshots() {
    }

    public static void checkNewer(StateSnapshot stored, StateSnapshot next) {
        if (stored == null) {
            return;
        }
        if (!stored.getLineage().equals(next.getLineage()) && !stored.isEmpty()) {
            throw new StateConflictException("Snapshot lineage " + next.getLineage()
                                             + " does not match stored lineage " + stored.getLineage());
        }
        if (next.getSerial() <= stored.getSerial()) {
            throw new StateConflictException("Stale snapshot: serial " + next.getSerial()
                                             + " is not newer than stored serial " + stored.getSerial());
        }
    }

    public static String owner() {
        return ManagementFactory.getRuntimeMXBean().getName();
    }
}
