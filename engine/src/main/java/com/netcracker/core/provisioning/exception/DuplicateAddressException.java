package com.netcracker.core.provisioning.exception;

import com.netcracker.core.provisioning.model.ResourceAddress;
import lombok.Getter;

@Getter
public class DuplicateAddressException extends ValidationException {
    private final ResourceAddress address;

    public DuplicateAddressException(ResourceAddress address) {
        super("Duplicate resource address '" + address + "'");
        this.address = address;
    }
}
