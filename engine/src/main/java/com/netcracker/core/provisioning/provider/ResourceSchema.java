package com.netcracker.core.provisioning.provider;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * Per type rules the planner needs: which attributes can change in place and how replacement is ordered.
 */
@Value
@Builder
public class ResourceSchema {
    @Singular Set<String> updatableAttributes;
    @Builder.Default boolean createBeforeDestroy = false;

    public boolean isUpdatable(String attribute) {
        return updatableAttributes.contains(attribute);
    }
}
