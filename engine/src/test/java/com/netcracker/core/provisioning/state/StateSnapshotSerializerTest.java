package com.netcracker.core.provisioning.state;

import com.netcracker.core.provisioning.model.ResourceAddress;
import com.netcracker.core.provisioning.model.ResourceState;
import com.netcracker.core.provisioning.model.StateSnapshot;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateSnapshotSerializerTest {
    private final StateSnapshotSerializer serializer = new StateSnapshotSerializer();

    @Test
    void outputDoesNotDependOnAttributeInsertionOrder() {
        Map<String, Object> forward = new LinkedHashMap<>();
        forward.put("a", 1);
        forward.put("z", 2);
        Map<String, Object> backward = new LinkedHashMap<>();
        backward.put("z", 2);
        backward.put("a", 1);
        StateSnapshot base = new StateSnapshot("lineage-1", 3, Map.of(), java.util.List.of());
        ResourceAddress address = ResourceAddress.parse("bucket.logs");

        String first = serializer.serialize(base.put(new ResourceState(address, "b-1", forward, Map.of(), Set.of())));
        String second = serializer.serialize(base.put(new ResourceState(address, "b-1", backward, Map.of(), Set.of())));

        assertThat(first).isEqualTo(second);
        assertThat(first).contains("\"lineage\" : \"lineage-1\"").contains("\"serial\" : 4");
    }

    @Test
    void readsDocumentWithDeposedObjects() {
        String json = """
                {
                  "version" : 1,
                  "lineage" : "lineage-1",
                  "serial" : 7,
                  "resources" : [ {
                    "address" : "vpc.main",
                    "id" : "vpc-2",
                    "inputs" : { "cidr" : "10.1.0.0/16" },
                    "attributes" : { "arn" : "arn:vpc:vpc-2" },
                    "dependencies" : [ ]
                  } ],
                  "deposed" : [ {
                    "address" : "vpc.main",
                    "id" : "vpc-1",
                    "attributes" : { }
                  } ]
                }
                """;

        StateSnapshot snapshot = serializer.deserialize(json);

        assertThat(snapshot.getLineage()).isEqualTo("lineage-1");
        assertThat(snapshot.getSerial()).isEqualTo(7);
        assertThat(snapshot.get(ResourceAddress.parse("vpc.main"))).map(ResourceState::id).contains("vpc-2");
        assertThat(snapshot.getDeposed()).singleElement().satisfies(deposed -> assertThat(deposed.id()).isEqualTo("vpc-1"));
    }

    @Test
    void rejectsNewerFormatVersion() {
        assertThatThrownBy(() -> serializer.deserialize("{\"version\":99,\"lineage\":\"l\",\"serial\":1}"))
                .isInstanceOf(StateSerializationException.class)
                .hasMessageContaining("99");
    }
}
