package com.netcracker.core.provisioning.provider;

import com.netcracker.core.provisioning.exception.ProvisioningException;

/**
 * Non retryable provider failure. The affected node is marked failed.
 */
public class ProviderException extends ProvisioningException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
