package com.netcracker.core.provisioning.expand;

import com.netcracker.core.provisioning.exception.DuplicateAddressException;
import com.netcracker.core.provisioning.exception.InvalidDeclarationException;
import com.netcracker.core.provisioning.exception.ValidationException;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceDeclaration;
import com.netcracker.core.provisioning.model.ResourceNode;
import com.netcracker.core.provisioning.model.Value;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Expands counted declarations into indexed nodes. Runs before reference resolution so that instance
 * indices are fixed by the declaration alone and stay stable across runs.
 */
@ApplicationScoped
@Slf4j
public class DeclarationExpander {

    public ExpandedResources expand(List<ResourceDeclaration> declarations) {
        SortedMap<ResourceAddress, ResourceNode> nodes = new TreeMap<>();
        Set<String> declared = new LinkedHashSet<>();
        Set<String> counted = new LinkedHashSet<>();
        List<ValidationException> errors = new ArrayList<>();

        for (ResourceDeclaration declaration : declarations) {
            String key = declaration.declarationKey();
            if (!declared.add(key)) {
                errors.add(new DuplicateAddressException(ResourceAddress.of(declaration.type(), declaration.name())));
                continue;
            }
            try {
                for (ResourceNode node : expand(declaration)) {
                    if (nodes.putIfAbsent(node.address(), node) != null) {
                        errors.add(new DuplicateAddressException(node.address()));
                    }
                }
            } catch (InvalidDeclarationException e) {
                errors.add(e);
            }
            if (declaration.count() != null) {
                counted.add(key);
            }
        }
        log.debug("Expanded {} declarations into {} resource nodes", declarations.size(), nodes.size());
        return new ExpandedResources(Collections.unmodifiableSortedMap(nodes),
                Collections.unmodifiableSet(declared),
                Collections.unmodifiableSet(counted),
                List.copyOf(errors));
    }

    private List<ResourceNode> expand(ResourceDeclaration declaration) {
        Integer count = declaration.count();
        if (count == null) {
            ResourceAddress address = ResourceAddress.of(declaration.type(), declaration.name());
            return List.of(node(declaration, address, null));
        }
        if (count < 0) {
            throw new InvalidDeclarationException(declaration.declarationKey(), "count must not be negative, got " + count);
        }
        List<ResourceNode> instances = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            instances.add(node(declaration, ResourceAddress.of(declaration.type(), declaration.name(), i), i));
        }
        return instances;
    }

    private ResourceNode node(ResourceDeclaration declaration, ResourceAddress address, Integer index) {
        Map<String, Value> attributes = new LinkedHashMap<>();
        declaration.attributes().forEach((name, value) ->
                attributes.put(name, substituteIndex(declaration, name, value, index)));
        return new ResourceNode(address, attributes, declaration.dependsOn(), declaration.createBeforeDestroy());
    }

    private Value substituteIndex(ResourceDeclaration declaration, String path, Value value, Integer index) {
        if (value instanceof Value.CountIndex) {
            if (index == null) {
                throw new InvalidDeclarationException(declaration.declarationKey(),
                        "count.index used in '" + path + "' but the declaration has no count");
            }
            return Value.of(index);
        }
        if (value instanceof Value.ListValue list) {
            List<Value> items = new ArrayList<>(list.items().size());
            for (int i = 0; i < list.items().size(); i++) {
                items.add(substituteIndex(declaration, path + "[" + i + "]", list.items().get(i), index));
            }
            return Value.list(items);
        }
        if (value instanceof Value.MapValue map) {
            Map<String, Value> entries = new LinkedHashMap<>();
            map.entries().forEach((k, v) -> entries.put(k, substituteIndex(declaration, path + "." + k, v, index)));
            return Value.map(entries);
        }
        return value;
    }
}
