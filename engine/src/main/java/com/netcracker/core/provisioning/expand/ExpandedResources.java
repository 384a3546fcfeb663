package com.netcracker.core.provisioning.expand;

import com.netcracker.core.provisioning.exception.ValidationException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceNode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * Result of declaration expansion.
 *
 * @param nodes        concrete nodes by address
 * @param declarations keys ({@code type.name}) of all declarations, including those expanded into no instance
 * @param counted      keys of declarations that use {@code count}
 * @param errors       validation errors found during expansion
 */
public record ExpandedResources(SortedMap<ResourceAddress, ResourceNode> nodes,
                                Set<String> declarations,
                                Set<String> counted,
                                List<ValidationException> errors) {

    public Optional<ResourceNode> node(ResourceAddress address) {
        return Optional.ofNullable(nodes.get(address));
    }

    public boolean isDeclared(String declarationKey) {
        return declarations.contains(declarationKey);
    }

    public boolean isCounted(String declarationKey) {
        return counted.contains(declarationKey);
    }

    public List<ResourceAddress> instancesOf(String declarationKey) {
        return nodes.keySet().stream()
                .filter(address -> address.declarationKey().equals(declarationKey))
                .toList();
    }

    public Map<ResourceAddress, ResourceNode> asMap() {
        return nodes;
    }
}
