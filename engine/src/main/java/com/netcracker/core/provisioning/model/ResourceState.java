package com.netcracker.core.provisioning.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Last applied state of one managed resource.
 *
 * @param id           identifier assigned by the provider
 * @param inputs       resolved desired attributes that were sent to the provider
 * @param attributes   attributes returned by the provider, including computed ones
 * @param dependencies addresses the resource referenced when it was applied
 */
public record ResourceState(ResourceAddress address,
                            String id,
                            Map<String, Object> inputs,
                            Map<String, Object> attributes,
                            Set<ResourceAddress> dependencies) {

    public ResourceState {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(id, "id");
        inputs = Values.normalizeAll(inputs);
        attributes = Values.normalizeAll(attributes);
        dependencies = dependencies == null ? Set.of() : Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }

    public String type() {
        return address.type();
    }

    /**
     * Reads an attribute for a reference: {@code id} is the provider identifier, other paths are looked up
     * in provider attributes first and then in the applied inputs.
     */
    public Object read(String path) {
        if ("id".equals(path)) {
            return id;
        }
        Object value = Values.readPath(attributes, path);
        return value != null ? value : Values.readPath(inputs, path);
    }

    public ResourceState withAttributes(Map<String, Object> newAttributes) {
        return new ResourceState(address, id, inputs, newAttributes, dependencies);
    }
}
