package com.netcracker.core.provisioning.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One resource record as produced by the declaration parser.
 *
 * @param dependsOn            explicit dependencies, as resource addresses
 * @param count                number of indexed instances to expand into, {@code null} for a single instance
 * @param createBeforeDestroy  overrides the resource type's replacement policy when not {@code null}
 */
@Builder(toBuilder = true)
public record ResourceDeclaration(String type,
                                  String name,
                                  @Singular Map<String, Value> attributes,
                                  List<String> dependsOn,
                                  Integer count,
                                  Boolean createBeforeDestroy) {

    public ResourceDeclaration {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        attributes = attributes == null ? Map.of() : attributes;
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public String declarationKey() {
        return type + "." + name;
    }
}
