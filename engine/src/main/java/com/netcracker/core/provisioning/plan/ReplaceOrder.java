package com.netcracker.core.provisioning.plan;

public enum ReplaceOrder {
    CREATE_BEFORE_DESTROY,
    DESTROY_BEFORE_CREATE
}
