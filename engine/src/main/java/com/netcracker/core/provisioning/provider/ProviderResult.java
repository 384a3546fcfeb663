package com.netcracker.core.provisioning.provider;

import java.util.Map;
import java.util.Objects;

public record ProviderResult(String id, Map<String, Object> attributes) {

    public ProviderResult {
        Objects.requireNonNull(id, "id");
        attributes = attributes == null ? Map.of() : attributes;
    }
}
