package com.netcracker.core.provisioning.provider;

/**
 * Retryable provider failure, e.g. rate limiting or an eventually consistent resource that is not visible yet.
 */
public class ProviderTransientException extends ProviderException {

    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
