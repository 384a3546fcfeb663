package com.netcracker.core.provisioning.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable snapshot of all managed resources. Every mutation returns a new snapshot with the
 * serial incremented, so stores can detect stale writes.
 */
public final class StateSnapshot {
    private final String lineage;
    private final long serial;
    private final SortedMap<ResourceAddress, ResourceState> resources;
    private final List<DeposedObject> deposed;

    public StateSnapshot(String lineage,
                         long serial,
                         Map<ResourceAddress, ResourceState> resources,
                         List<DeposedObject> deposed) {
        this.lineage = Objects.requireNonNull(lineage, "lineage");
        this.serial = serial;
        this.resources = Collections.unmodifiableSortedMap(new TreeMap<>(resources));
        this.deposed = List.copyOf(deposed);
    }

    public static StateSnapshot empty() {
        return new StateSnapshot(UUID.randomUUID().toString(), 0, Map.of(), List.of());
    }

    public String getLineage() {
        return lineage;
    }

    public long getSerial() {
        return serial;
    }

    public SortedMap<ResourceAddress, ResourceState> getResources() {
        return resources;
    }

    public List<DeposedObject> getDeposed() {
        return deposed;
    }

    public Optional<ResourceState> get(ResourceAddress address) {
        return Optional.ofNullable(resources.get(address));
    }

    public boolean contains(ResourceAddress address) {
        return resources.containsKey(address);
    }

    public boolean isEmpty() {
        return resources.isEmpty() && deposed.isEmpty();
    }

    public StateSnapshot put(ResourceState state) {
        Map<ResourceAddress, ResourceState> next = new TreeMap<>(resources);
        next.put(state.address(), state);
        return new StateSnapshot(lineage, serial + 1, next, deposed);
    }

    /**
     * Moves the current object at the address to the deposed list and stores the replacement, in one step.
     */
    public StateSnapshot replace(ResourceState replacement) {
        ResourceState current = resources.get(replacement.address());
        List<DeposedObject> nextDeposed = new ArrayList<>(deposed);
        if (current != null && !current.id().equals(replacement.id())) {
            nextDeposed.add(DeposedObject.of(current));
        }
        Map<ResourceAddress, ResourceState> next = new TreeMap<>(resources);
        next.put(replacement.address(), replacement);
        return new StateSnapshot(lineage, serial + 1, next, nextDeposed);
    }

    /**
     * Forgets the remote object with the given id at the address, whether it is the current or a deposed one.
     */
    public StateSnapshot remove(ResourceAddress address, String id) {
        Map<ResourceAddress, ResourceState> next = new TreeMap<>(resources);
        ResourceState current = next.get(address);
        if (current != null && current.id().equals(id)) {
            next.remove(address);
        }
        List<DeposedObject> nextDeposed = new ArrayList<>(deposed);
        nextDeposed.removeIf(d -> d.address().equals(address) && d.id().equals(id));
        return new StateSnapshot(lineage, serial + 1, next, nextDeposed);
    }

    public StateSnapshot withSerial(long newSerial) {
        return new StateSnapshot(lineage, newSerial, resources, deposed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateSnapshot that)) return false;
        return serial == that.serial
               && lineage.equals(that.lineage)
               && resources.equals(that.resources)
               && deposed.equals(that.deposed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lineage, serial, resources, deposed);
    }

    @Override
    public String toString() {
        return "StateSnapshot{lineage=" + lineage + ", serial=" + serial
               + ", resources=" + resources.keySet() + ", deposed=" + deposed.size() + "}";
    }
}
