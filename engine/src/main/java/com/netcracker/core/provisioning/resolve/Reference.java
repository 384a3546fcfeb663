package com.netcracker.core.provisioning.resolve;

import com.netcracker.core.provisioning.model.ResourceAddress;

/**
 * Dependency edge: {@code target} must be applied before {@code source}.
 *
 * @param attributePath attribute of the source holding the reference, {@code depends_on[i]} for explicit edges
 */
public record Reference(ResourceAddress source, ResourceAddress target, String attributePath) {

    public boolean isExplicit() {
        return attributePath.startsWith(ReferenceResolver.DEPENDS_ON);
    }
}
