package com.netcracker.core.provisioning.apply;

public enum ApplyResult {
    SUCCESS,
    PARTIAL_FAILURE,
    CANCELLED,
    FAILED_VALIDATION
}
