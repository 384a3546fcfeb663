package com.netcracker.core.provisioning.provider;

import lombok.Getter;

@Getter
public class ResourceNotFoundException extends ProviderException {
    private final String id;

    public ResourceNotFoundException(String type, String id) {
        super("Resource of type '" + type + "' with id '" + id + "' not found");
        this.id = id;
    }
}
