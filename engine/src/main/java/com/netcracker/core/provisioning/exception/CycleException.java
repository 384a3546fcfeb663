package com.netcracker.core.provisioning.exception;

import com.netcracker.core.provisioning.model.ResourceAddress;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Dependency cycle. The path starts and ends with the same address.
 */
@Getter
public class CycleException extends ValidationException {
    private final List<ResourceAddress> cycle;

    public CycleException(List<ResourceAddress> cycle) {
        super("Dependency cycle: " + cycle.stream().map(ResourceAddress::toString).collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }
}
