package com.netcracker.core.provisioning.exception;

/**
 * State lock is unavailable or the snapshot being written is stale. Always fatal for the run.
 */
public class StateConflictException extends ProvisioningException {

    public StateConflictException(String message) {
        super(message);
    }

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
