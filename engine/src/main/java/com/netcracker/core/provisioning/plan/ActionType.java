package com.netcracker.core.provisioning.plan;

/**
 * Single step executed against a provider. A replacement is planned as a {@link #CREATE} and a {@link #DELETE}.
 */
public enum ActionType {
    CREATE,
    UPDATE,
    DELETE,
    NOOP
}
