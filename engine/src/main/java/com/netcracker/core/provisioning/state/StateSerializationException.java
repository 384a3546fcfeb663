package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.exception.ProvisioningException;

public class StateSerializationException extends ProvisioningException {

    public StateSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
