package com.netcracker.core.provisioning.exception;

/**
 * Problem with the declarations detected before any mutation. Validation errors are collected
 * into the plan diagnostics instead of being thrown one by one.
 */
public abstract class ValidationException extends ProvisioningException {

    protected ValidationException(String message) {
        super(message);
    }
}
