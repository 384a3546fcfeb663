package com.netcracker.core.provisioning.model;

import java.util.Map;

/**
 * Old remote object left over by a create-before-destroy replacement until its delete succeeds.
 */
public record DeposedObject(ResourceAddress address, String id, Map<String, Object> attributes) {

    public DeposedObject {
        attributes = Values.normalizeAll(attributes);
    }

    public static DeposedObject of(ResourceState state) {
        return new DeposedObject(state.address(), state.id(), state.attributes());
    }
}
