package com.netcracker.core.provisioning.resolve;

import com.netcracker.core.provisioning.exception.UnresolvedReferenceException;
import com.netcracker.core.provisioning.expand.ExpandedResources;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceNode;
import com.netcracker.core.provisioning.model.Value;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Walks attribute expression trees of expanded nodes and records an edge for every referenced address.
 * <ul>
 *     <li>{@code type.name.attr} refers to a single instance declaration;</li>
 *     <li>{@code type.name[i].attr} refers to one instance of a counted declaration;</li>
 *     <li>{@code type.name[*].attr} refers to every instance of a counted declaration.</li>
 * </ul>
 */
@ApplicationScoped
@Slf4j
public class ReferenceResolver {
    static final String DEPENDS_ON = "depends_on";

    public ResolvedReferences resolve(ExpandedResources resources) {
        List<Reference> references = new ArrayList<>();
        List<UnresolvedReferenceException> unresolved = new ArrayList<>();

        for (ResourceNode node : resources.nodes().values()) {
            for (Map.Entry<String, Value> attribute : node.attributes().entrySet()) {
                walk(resources, node.address(), attribute.getKey(), attribute.getValue(), references, unresolved);
            }
            List<String> dependsOn = node.dependsOn();
            for (int i = 0; i < dependsOn.size(); i++) {
                resolveExplicit(resources, node.address(), DEPENDS_ON + "[" + i + "]", dependsOn.get(i), references, unresolved);
            }
        }
        log.debug("Resolved {} references, {} unresolved", references.size(), unresolved.size());
        return new ResolvedReferences(List.copyOf(references), List.copyOf(unresolved));
    }

    private void walk(ExpandedResources resources,
                      ResourceAddress source,
                      String path,
                      Value value,
                      List<Reference> references,
                      List<UnresolvedReferenceException> unresolved) {
        if (value instanceof Value.ListValue list) {
            for (int i = 0; i < list.items().size(); i++) {
                walk(resources, source, path + "[" + i + "]", list.items().get(i), references, unresolved);
            }
        } else if (value instanceof Value.MapValue map) {
            map.entries().forEach((key, item) -> walk(resources, source, path + "." + key, item, references, unresolved));
        } else if (value instanceof Value.Reference reference) {
            List<ResourceAddress> targets = targets(resources, reference);
            if (targets == null) {
                unresolved.add(new UnresolvedReferenceException(source, path, reference.toString(), lookedUp(reference)));
                return;
            }
            for (ResourceAddress target : targets) {
                references.add(new Reference(source, target, path));
            }
        }
    }

    /**
     * @return addresses the reference points at, or {@code null} when it cannot be resolved
     */
    public static List<ResourceAddress> targets(ExpandedResources resources, Value.Reference reference) {
        return switch (reference.selector()) {
            case NONE -> {
                ResourceAddress address = ResourceAddress.of(reference.type(), reference.name());
                yield resources.node(address).isPresent() ? List.of(address) : null;
            }
            case INDEX -> {
                ResourceAddress address = ResourceAddress.of(reference.type(), reference.name(), reference.index());
                yield resources.node(address).isPresent() ? List.of(address) : null;
            }
            case ALL -> resources.isCounted(reference.declarationKey())
                    ? resources.instancesOf(reference.declarationKey())
                    : null;
        };
    }

    private static ResourceAddress lookedUp(Value.Reference reference) {
        return reference.selector() == Value.Selector.INDEX
                ? ResourceAddress.of(reference.type(), reference.name(), reference.index())
                : ResourceAddress.of(reference.type(), reference.name());
    }

    private void resolveExplicit(ExpandedResources resources,
                                 ResourceAddress source,
                                 String path,
                                 String dependency,
                                 List<Reference> references,
                                 List<UnresolvedReferenceException> unresolved) {
        ResourceAddress target;
        try {
            target = ResourceAddress.parse(dependency);
        } catch (IllegalArgumentException e) {
            log.debug("Malformed explicit dependency '{}' in {}", dependency, source);
            unresolved.add(new UnresolvedReferenceException(source, path, dependency, null));
            return;
        }
        if (resources.node(target).isPresent()) {
            references.add(new Reference(source, target, path));
        } else if (!target.isIndexed() && resources.isCounted(target.declarationKey())) {
            resources.instancesOf(target.declarationKey())
                    .forEach(instance -> references.add(new Reference(source, instance, path)));
        } else {
            unresolved.add(new UnresolvedReferenceException(source, path, dependency, target));
        }
    }
}
