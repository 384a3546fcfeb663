package com.netcracker.core.provisioning.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.netcracker.core.provisioning.model.DeposedObject;
import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts snapshots to and from the JSON state document. Map entries are written sorted by key so
 * unchanged state always serializes to the same text.
 */
public class StateSnapshotSerializer {
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper;

    public StateSnapshotSerializer() {
        this(new ObjectMapper());
    }

    public StateSnapshotSerializer(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String serialize(StateSnapshot snapshot) {
        List<StateDocument.ResourceEntry> resources = snapshot.getResources().values().stream()
                .map(state -> new StateDocument.ResourceEntry(
                        state.address().toString(),
                        state.id(),
                        state.inputs(),
                        state.attributes(),
                        state.dependencies().stream().map(ResourceAddress::toString).toList()))
                .toList();
        List<StateDocument.DeposedEntry> deposed = snapshot.getDeposed().stream()
                .map(object -> new StateDocument.DeposedEntry(object.address().toString(), object.id(), object.attributes()))
                .toList();
        StateDocument document = new StateDocument(FORMAT_VERSION, snapshot.getLineage(), snapshot.getSerial(), resources, deposed);
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new StateSerializationException("Failed to serialize state snapshot", e);
        }
    }

    public StateSnapshot deserialize(String json) {
        StateDocument document;
        try {
            document = mapper.readValue(json, StateDocument.class);
        } catch (JsonProcessingException e) {
            throw new StateSerializationException("Failed to parse state document", e);
        }
        if (document.version() > FORMAT_VERSION) {
            throw new StateSerializationException("Unsupported state document version " + document.version(), null);
        }
        Map<ResourceAddress, ResourceState> resources = new LinkedHashMap<>();
        for (StateDocument.ResourceEntry entry : nullSafe(document.resources())) {
            ResourceAddress address = ResourceAddress.parse(entry.address());
            Set<ResourceAddress> dependencies = nullSafe(entry.dependencies()).stream()
                    .map(ResourceAddress::parse)
                    .collect(Collectors.toSet());
            resources.put(address, new ResourceState(address, entry.id(), entry.inputs(), entry.attributes(), dependencies));
        }
        List<DeposedObject> deposed = nullSafe(document.deposed()).stream()
                .map(entry -> new DeposedObject(ResourceAddress.parse(entry.address()), entry.id(), entry.attributes()))
                .toList();
        return new StateSnapshot(document.lineage(), document.serial(), resources, deposed);
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
