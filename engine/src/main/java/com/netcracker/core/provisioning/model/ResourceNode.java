package com.netcracker.core.provisioning.model;

import java.util.List;
import java.util.Map;

/**
 * Concrete resource instance after expansion. Attributes no longer contain {@link Value.CountIndex}.
 */
public record ResourceNode(ResourceAddress address,
                           Map<String, Value> attributes,
                           List<String> dependsOn,
                           Boolean createBeforeDestroy) {

    public ResourceNode {
        attributes = Map.copyOf(attributes);
        dependsOn = List.copyOf(dependsOn);
    }

    public String type() {
        return address.type();
    }
}
