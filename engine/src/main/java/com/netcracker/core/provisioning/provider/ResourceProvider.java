package com.netcracker.core.provisioning.provider;

import java.util.Map;

/**
 * Remote API of one resource type. Every call is atomic from the engine's point of view: it either
 * succeeds and returns the new remote attributes, or throws and leaves nothing to record.
 * <p>
 * Implementations throw {@link ProviderTransientException} for errors worth retrying,
 * {@link ResourceNotFoundException} when the object does not exist and {@link ProviderException} otherwise.
 */
public interface ResourceProvider {

    String type();

    ResourceSchema schema();

    ProviderResult create(Map<String, Object> attributes);

    Map<String, Object> read(String id);

    Map<String, Object> update(String id, Map<String, Object> attributes);

    void delete(String id);
}
