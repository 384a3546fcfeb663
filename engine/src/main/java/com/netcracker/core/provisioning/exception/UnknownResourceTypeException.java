package com.netcracker.core.provisioning.exception;

import com.netcracker.core.provisioning.model.ResourceAddress;
import lombok.Getter;

@Getter
public class UnknownResourceTypeException extends ValidationException {
    private final ResourceAddress address;

    public UnknownResourceTypeException(ResourceAddress address) {
        super("No provider registered for resource type '" + address.type() + "' of " + address);
        this.address = address;
    }
}
