package com.netcracker.core.provisioning.model;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class StateSnapshotTest {
    private static final ResourceAddress VPC = ResourceAddress.of("vpc", "main");

    @Test
    void everyChangeIncrementsSerialAndKeepsLineage() {
        StateSnapshot empty = StateSnapshot.empty();

        StateSnapshot next = empty.put(state("vpc-1", "10.0.0.0/16"));

        assertThat(empty.isEmpty()).isTrue();
        assertThat(next.getSerial()).isEqualTo(empty.getSerial() + 1);
        assertThat(next.getLineage()).isEqualTo(empty.getLineage());
        assertThat(next.get(VPC)).map(ResourceState::id).contains("vpc-1");
    }

    @Test
    void replaceDeposesPreviousObject() {
        StateSnapshot snapshot = StateSnapshot.empty().put(state("vpc-1", "10.0.0.0/16"));

        StateSnapshot replaced = snapshot.replace(state("vpc-2", "10.1.0.0/16"));

        assertThat(replaced.get(VPC)).map(ResourceState::id).contains("vpc-2");
        assertThat(replaced.getDeposed()).extracting(DeposedObject::id).containsExactly("vpc-1");

        StateSnapshot cleaned = replaced.remove(VPC, "vpc-1");
        assertThat(cleaned.getDeposed()).isEmpty();
        assertThat(cleaned.get(VPC)).map(ResourceState::id).contains("vpc-2");
    }

    @Test
    void removeIgnoresOtherObjectIds() {
        StateSnapshot snapshot = StateSnapshot.empty().put(state("vpc-1", "10.0.0.0/16"));

        StateSnapshot next = snapshot.remove(VPC, "vpc-9");

        assertThat(next.contains(VPC)).isTrue();
        assertThat(snapshot.remove(VPC, "vpc-1").contains(VPC)).isFalse();
    }

    @Test
    void readsIdAttributesAndInputs() {
        ResourceState state = new ResourceState(VPC, "vpc-1",
                Map.of("cidr", "10.0.0.0/16"),
                Map.of("arn", "arn:vpc:vpc-1", "cidr", "10.0.0.0/16"),
                Set.of());

        assertThat(state.read("id")).isEqualTo("vpc-1");
        assertThat(state.read("arn")).isEqualTo("arn:vpc:vpc-1");
        assertThat(state.read("cidr")).isEqualTo("10.0.0.0/16");
        assertThat(state.read("missing")).isNull();
    }

    private static ResourceState state(String id, String cidr) {
        return new ResourceState(VPC, id, Map.of("cidr", cidr), Map.of("cidr", cidr), Set.of());
    }
}
