package com.netcracker.core.provisioning.state;

import java.util.List;
import java.util.Map;

/**
 * Serialized form of a state snapshot.
 */
public record StateDocument(int version,
                            String lineage,
                            long serial,
                            List<ResourceEntry> resources,
                            List<DeposedEntry> deposed) {

    public record ResourceEntry(String address,
                                String id,
                                Map<String, Object> inputs,
                                Map<String, Object> attributes,
                                List<String> dependencies) {}

    public record DeposedEntry(String address, String id, Map<String, Object> attributes) {}
}
