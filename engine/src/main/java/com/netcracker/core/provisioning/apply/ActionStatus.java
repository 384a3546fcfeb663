package com.netcracker.core.provisioning.apply;

/**
 * {@code PENDING -> READY -> RUNNING -> APPLIED | FAILED | SKIPPED | CANCELLED}. No-op actions end as
 * {@link #NO_OP} without a provider call.
 */
public enum ActionStatus {
    PENDING,
    READY,
    RUNNING,
    APPLIED,
    NO_OP,
    FAILED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return ordinal() >= APPLIED.ordinal();
    }

    public boolean isSuccess() {
        return this == APPLIED || this == NO_OP;
    }
}
