package com.netcracker.core.provisioning.plan;

public enum ChangeType {
    CREATE,
    UPDATE,
    REPLACE,
    DELETE,
    NOOP
}
